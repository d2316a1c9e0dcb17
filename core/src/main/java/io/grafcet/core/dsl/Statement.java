package io.grafcet.core.dsl;

/**
 * One statement of the intermediate program, located in the source text.
 */
public abstract class Statement {
   private final int line;
   private final int column;

   Statement(int line, int column) {
      this.line = line;
      this.column = column;
   }

   public int line() {
      return line;
   }

   public int column() {
      return column;
   }

   public abstract Kind kind();

   public enum Kind {
      STEP,
      TRANSITION,
      JUMP,
      DIVERGENCE
   }
}
