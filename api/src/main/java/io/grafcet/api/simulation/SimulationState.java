package io.grafcet.api.simulation;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of a running chart. Instances are never modified; each evaluation produces a new one.
 * Besides the active steps it keeps what the next evaluation needs: stored action outputs,
 * the variable values supplied so far and logical activation times. A variable keeps its value until an input
 * sets it again; the values held here are also what rising and falling edges compare against.
 * Two states are equal when they hold the same steps, stored outputs and activation times; the variable values
 * and the clock are bookkeeping and do not take part in equality.
 */
public final class SimulationState implements Serializable {
   private final Set<String> activeSteps;
   private final Map<String, Boolean> storedVariables;
   private final Map<String, Object> variables;
   private final Map<String, Double> activationTimes;
   private final double time;

   public SimulationState(Set<String> activeSteps, Map<String, Boolean> storedVariables,
                          Map<String, Object> variables, Map<String, Double> activationTimes, double time) {
      this.activeSteps = Collections.unmodifiableSet(new LinkedHashSet<>(activeSteps));
      this.storedVariables = Collections.unmodifiableMap(new LinkedHashMap<>(storedVariables));
      this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
      this.activationTimes = Collections.unmodifiableMap(new LinkedHashMap<>(activationTimes));
      this.time = time;
   }

   public static SimulationState of(Set<String> activeSteps, double time) {
      Map<String, Double> activationTimes = new LinkedHashMap<>();
      for (String stepId : activeSteps) {
         activationTimes.put(stepId, time);
      }
      return new SimulationState(activeSteps, Collections.emptyMap(), Collections.emptyMap(), activationTimes, time);
   }

   public Set<String> activeSteps() {
      return activeSteps;
   }

   public List<String> activeStepList() {
      return new ArrayList<>(activeSteps);
   }

   public boolean isActive(String stepId) {
      return activeSteps.contains(stepId);
   }

   public Map<String, Boolean> storedVariables() {
      return storedVariables;
   }

   public Map<String, Object> variables() {
      return variables;
   }

   public Map<String, Double> activationTimes() {
      return activationTimes;
   }

   /**
    * @return Logical time of the last evaluation, in seconds.
    */
   public double time() {
      return time;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof SimulationState)) {
         return false;
      }
      SimulationState that = (SimulationState) o;
      return activeSteps.equals(that.activeSteps) &&
            storedVariables.equals(that.storedVariables) &&
            activationTimes.equals(that.activationTimes);
   }

   @Override
   public int hashCode() {
      return Objects.hash(activeSteps, storedVariables, activationTimes);
   }

   @Override
   public String toString() {
      return "SimulationState{activeSteps=" + activeSteps + ", stored=" + storedVariables + ", time=" + time + '}';
   }
}
