package io.grafcet.api.diagram;

/**
 * Discriminator of the closed element hierarchy. Gates carry two tags, one per {@link GateType}.
 */
public enum ElementType {
   STEP("step"),
   TRANSITION("transition"),
   ACTION_BLOCK("action-block"),
   GATE("gate"),
   CONNECTION("connection");

   private final String tag;

   ElementType(String tag) {
      this.tag = tag;
   }

   public String tag() {
      return tag;
   }
}
