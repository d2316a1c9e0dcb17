package io.grafcet.core.dsl;

public class TransitionStatement extends Statement {
   private final String condition;

   TransitionStatement(int line, int column, String condition) {
      super(line, column);
      this.condition = condition;
   }

   public String condition() {
      return condition;
   }

   @Override
   public Kind kind() {
      return Kind.TRANSITION;
   }

   @Override
   public String toString() {
      return "Transition \"" + condition + "\"";
   }
}
