package io.grafcet.api.scenario;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named batch of inputs applied by one evaluation.
 */
public final class Scenario implements Serializable {
   private final String name;
   private final Map<String, Object> variables;
   private final Map<String, Object> transitions;
   private final Double time;

   public Scenario(String name, Map<String, ?> variables, Map<String, ?> transitions, Double time) {
      this.name = name;
      this.variables = variables == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
      this.transitions = transitions == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
      this.time = time;
   }

   public Scenario(String name, Map<String, ?> variables, Map<String, ?> transitions) {
      this(name, variables, transitions, null);
   }

   public String name() {
      return name;
   }

   public Map<String, Object> variables() {
      return variables;
   }

   public Map<String, Object> transitions() {
      return transitions;
   }

   public Double time() {
      return time;
   }

   public static Builder builder(String name) {
      return new Builder(name);
   }

   public static class Builder {
      private final String name;
      private final Map<String, Object> variables = new LinkedHashMap<>();
      private final Map<String, Object> transitions = new LinkedHashMap<>();
      private Double time;

      private Builder(String name) {
         this.name = name;
      }

      public Builder variable(String name, Object value) {
         variables.put(name, value);
         return this;
      }

      public Builder transition(String label, Object value) {
         transitions.put(label, value);
         return this;
      }

      public Builder time(double time) {
         this.time = time;
         return this;
      }

      public Scenario build() {
         return new Scenario(name, variables, transitions, time);
      }
   }
}
