package io.grafcet.api.simulation;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class StepResult implements Serializable {
   private final SimulationState state;
   private final List<FiredAction> actions;
   private final List<String> firedTransitions;
   private final List<String> ignoredInputs;

   public StepResult(SimulationState state, List<FiredAction> actions, List<String> firedTransitions, List<String> ignoredInputs) {
      this.state = state;
      this.actions = Collections.unmodifiableList(actions);
      this.firedTransitions = Collections.unmodifiableList(firedTransitions);
      this.ignoredInputs = Collections.unmodifiableList(ignoredInputs);
   }

   public SimulationState state() {
      return state;
   }

   public List<FiredAction> actions() {
      return actions;
   }

   public List<String> actionNames() {
      return actions.stream().map(FiredAction::variable).collect(Collectors.toList());
   }

   /**
    * @return Ids of the transitions cleared by this evaluation, in diagram order.
    */
   public List<String> firedTransitions() {
      return firedTransitions;
   }

   /**
    * @return Inputs that could not be interpreted and were treated as false.
    */
   public List<String> ignoredInputs() {
      return ignoredInputs;
   }
}
