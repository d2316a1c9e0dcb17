package io.grafcet.core.compiler;

/**
 * Back-reference recorded by the layout pass and turned into a connection by the {@link JumpResolver}.
 */
public final class PendingJump {
   private final String sourceId;
   private final int targetNumber;
   private final int line;

   public PendingJump(String sourceId, int targetNumber, int line) {
      this.sourceId = sourceId;
      this.targetNumber = targetNumber;
      this.line = line;
   }

   public String sourceId() {
      return sourceId;
   }

   public int targetNumber() {
      return targetNumber;
   }

   public int line() {
      return line;
   }

   @Override
   public String toString() {
      return sourceId + " -> step " + targetNumber;
   }
}
