package io.grafcet.api.scenario;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class ScenarioResult implements Serializable {
   private final String name;
   private final int stepNumber;
   private final List<String> activeSteps;
   private final List<String> activeActions;
   private final Map<String, Object> variablesApplied;
   private final boolean success;

   public ScenarioResult(String name, int stepNumber, List<String> activeSteps, List<String> activeActions,
                         Map<String, Object> variablesApplied, boolean success) {
      this.name = name;
      this.stepNumber = stepNumber;
      this.activeSteps = Collections.unmodifiableList(activeSteps);
      this.activeActions = Collections.unmodifiableList(activeActions);
      this.variablesApplied = Collections.unmodifiableMap(variablesApplied);
      this.success = success;
   }

   public String name() {
      return name;
   }

   /**
    * @return 1-based position of the scenario in the run.
    */
   public int stepNumber() {
      return stepNumber;
   }

   public List<String> activeSteps() {
      return activeSteps;
   }

   public List<String> activeActions() {
      return activeActions;
   }

   public Map<String, Object> variablesApplied() {
      return variablesApplied;
   }

   public boolean success() {
      return success;
   }

   @Override
   public String toString() {
      return name + ": steps=" + activeSteps + ", actions=" + activeActions;
   }
}
