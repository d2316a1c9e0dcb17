package io.grafcet.api.diagram;

public enum Orientation {
   HORIZONTAL("horizontal"),
   VERTICAL("vertical");

   private final String tag;

   Orientation(String tag) {
      this.tag = tag;
   }

   public String tag() {
      return tag;
   }

   public static Orientation fromTag(String tag) {
      for (Orientation orientation : values()) {
         if (orientation.tag.equalsIgnoreCase(tag)) {
            return orientation;
         }
      }
      throw new IllegalArgumentException("Unknown segment orientation '" + tag + "'");
   }
}
