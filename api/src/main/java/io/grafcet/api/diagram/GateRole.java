package io.grafcet.api.diagram;

public enum GateRole {
   DIVERGENCE,
   CONVERGENCE;

   public String tag() {
      return name().toLowerCase();
   }

   public static GateRole fromTag(String tag) {
      for (GateRole role : values()) {
         if (role.name().equalsIgnoreCase(tag)) {
            return role;
         }
      }
      throw new IllegalArgumentException("Unknown gate mode '" + tag + "'");
   }
}
