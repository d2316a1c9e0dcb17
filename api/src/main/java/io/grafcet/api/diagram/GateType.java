package io.grafcet.api.diagram;

public enum GateType {
   AND("and-gate"),
   OR("or-gate");

   private final String tag;

   GateType(String tag) {
      this.tag = tag;
   }

   public String tag() {
      return tag;
   }

   public static GateType fromTag(String tag) {
      for (GateType type : values()) {
         if (type.tag.equalsIgnoreCase(tag) || type.name().equalsIgnoreCase(tag)) {
            return type;
         }
      }
      return null;
   }
}
