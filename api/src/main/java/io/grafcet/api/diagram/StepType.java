package io.grafcet.api.diagram;

public enum StepType {
   INITIAL,
   NORMAL,
   TASK,
   MACRO;

   public String tag() {
      return name().toLowerCase();
   }

   public static StepType fromTag(String tag) {
      for (StepType type : values()) {
         if (type.name().equalsIgnoreCase(tag)) {
            return type;
         }
      }
      return null;
   }
}
