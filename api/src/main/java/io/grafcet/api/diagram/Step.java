package io.grafcet.api.diagram;

import java.util.Collections;
import java.util.List;

public final class Step extends Element {
   private final int number;
   private final String name;
   private final StepType stepType;
   private final List<String> actionIds;

   public Step(String id, int number, String name, StepType stepType, Point position, Size size, List<String> actionIds) {
      super(id, position, size);
      this.number = number;
      this.name = name == null ? String.valueOf(number) : name;
      this.stepType = stepType;
      this.actionIds = Collections.unmodifiableList(actionIds);
   }

   public int number() {
      return number;
   }

   public String name() {
      return name;
   }

   public StepType stepType() {
      return stepType;
   }

   public boolean isInitial() {
      return stepType == StepType.INITIAL;
   }

   /**
    * @return Ids of the owned {@link ActionBlock action blocks}, in display order.
    */
   public List<String> actionIds() {
      return actionIds;
   }

   @Override
   public ElementType type() {
      return ElementType.STEP;
   }

   @Override
   public <R> R accept(ElementVisitor<R> visitor) {
      return visitor.visit(this);
   }
}
