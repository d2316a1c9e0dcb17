package io.grafcet.core.dsl;

public class JumpStatement extends Statement {
   private final int target;

   JumpStatement(int line, int column, int target) {
      super(line, column);
      this.target = target;
   }

   /**
    * @return Number of the step this jump leads to.
    */
   public int target() {
      return target;
   }

   @Override
   public Kind kind() {
      return Kind.JUMP;
   }

   @Override
   public String toString() {
      return "Jump " + target;
   }
}
