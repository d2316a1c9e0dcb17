package io.grafcet.core.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.grafcet.api.diagram.StepType;

public class StepStatement extends Statement {
   private final String label;
   private final int number;
   private final StepType stepType;
   private final List<ActionStatement> actions = new ArrayList<>();

   StepStatement(int line, int column, String label, int number, StepType stepType) {
      super(line, column);
      this.label = label;
      this.number = number;
      this.stepType = stepType;
   }

   public String label() {
      return label;
   }

   public int number() {
      return number;
   }

   public StepType stepType() {
      return stepType;
   }

   public List<ActionStatement> actions() {
      return Collections.unmodifiableList(actions);
   }

   void addAction(ActionStatement action) {
      actions.add(action);
   }

   @Override
   public Kind kind() {
      return Kind.STEP;
   }

   @Override
   public String toString() {
      return "Step " + number + (stepType == StepType.NORMAL ? "" : " (" + stepType + ")");
   }
}
