package io.grafcet.core.dsl;

import io.grafcet.api.diagram.ActionQualifier;

public class ActionStatement {
   private final int line;
   private final String label;
   private final ActionQualifier qualifier;
   private final String condition;
   private final String duration;
   private final boolean temporal;

   ActionStatement(int line, String label, ActionQualifier qualifier, String condition, String duration, boolean temporal) {
      this.line = line;
      this.label = label;
      this.qualifier = qualifier;
      this.condition = condition;
      this.duration = duration;
      this.temporal = temporal;
   }

   public int line() {
      return line;
   }

   public String label() {
      return label;
   }

   public ActionQualifier qualifier() {
      return qualifier;
   }

   public String condition() {
      return condition;
   }

   public String duration() {
      return duration;
   }

   public boolean isTemporal() {
      return temporal;
   }

   @Override
   public String toString() {
      return "Action \"" + label + "\" " + qualifier;
   }
}
