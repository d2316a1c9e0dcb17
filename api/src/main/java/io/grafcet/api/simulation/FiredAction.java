package io.grafcet.api.simulation;

import java.io.Serializable;

import io.grafcet.api.diagram.ActionQualifier;

public final class FiredAction implements Serializable {
   public static final String TYPE_ACTION = "action";
   public static final String TYPE_TEMPORAL = "temporal";
   public static final String TYPE_STORED = "stored";

   private final String variable;
   private final String stepId;
   private final ActionQualifier qualifier;
   private final String type;

   public FiredAction(String variable, String stepId, ActionQualifier qualifier, String type) {
      this.variable = variable;
      this.stepId = stepId;
      this.qualifier = qualifier;
      this.type = type;
   }

   public String variable() {
      return variable;
   }

   /**
    * @return Step owning the action, {@code null} for stored outputs.
    */
   public String stepId() {
      return stepId;
   }

   public ActionQualifier qualifier() {
      return qualifier;
   }

   public String type() {
      return type;
   }

   @Override
   public String toString() {
      return variable + (qualifier == null ? "" : "(" + qualifier + ")");
   }
}
