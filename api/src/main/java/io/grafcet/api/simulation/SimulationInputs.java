package io.grafcet.api.simulation;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values applied by one evaluation. Trigger values are looked up by transition id, label or {@code T<number>};
 * anything but {@link Boolean#TRUE} does not trigger.
 */
public final class SimulationInputs implements Serializable {
   public static final SimulationInputs NONE = new SimulationInputs(Collections.emptyMap(), Collections.emptyMap(), null);

   private final Map<String, Object> transitions;
   private final Map<String, Object> variables;
   private final Double time;

   public SimulationInputs(Map<String, ?> transitions, Map<String, ?> variables, Double time) {
      this.transitions = transitions == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
      this.variables = variables == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
      this.time = time;
   }

   public static SimulationInputs transitions(Map<String, ?> transitions) {
      return new SimulationInputs(transitions, null, null);
   }

   public static SimulationInputs variables(Map<String, ?> variables) {
      return new SimulationInputs(null, variables, null);
   }

   public Map<String, Object> transitions() {
      return transitions;
   }

   public Map<String, Object> variables() {
      return variables;
   }

   /**
    * @return Logical time of this evaluation in seconds, or {@code null} to keep the previous time.
    */
   public Double time() {
      return time;
   }

   @Override
   public String toString() {
      return "SimulationInputs{transitions=" + transitions + ", variables=" + variables + ", time=" + time + '}';
   }
}
