package io.grafcet.core.simulation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Collections;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.grafcet.api.diagram.GrafcetDiagram;
import io.grafcet.api.simulation.FiredAction;
import io.grafcet.api.simulation.SimulationInputs;
import io.grafcet.api.simulation.SimulationState;
import io.grafcet.api.simulation.StepResult;
import io.grafcet.core.test.TestUtil;

public class SimulationEngineTest {
   private final SimulationEngine engine = new SimulationEngine();

   private static SimulationInputs trigger(String label) {
      return SimulationInputs.transitions(Map.of(label, true));
   }

   private static SimulationInputs at(double time, Map<String, ?> transitions) {
      return new SimulationInputs(transitions, Collections.emptyMap(), time);
   }

   @Test
   public void testInitActivatesInitialSteps() {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/start-done.sfc");
      SimulationState state = engine.init(diagram);
      assertThat(state.activeStepList()).containsExactly("step-0");
      assertThat(state.time()).isEqualTo(0);
   }

   @Test
   public void testAndDivergenceRoundTrip() {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/parallel.sfc");
      SimulationState state = engine.init(diagram);

      StepResult result = engine.executeStep(diagram, state, trigger("Go"));
      assertThat(result.firedTransitions()).containsExactly("transition-0");
      assertThat(result.state().activeStepList()).containsExactly("step-1", "step-2");
      assertThat(result.actionNames()).containsExactly("Pump", "Heater");

      result = engine.executeStep(diagram, result.state(), trigger("Ready"));
      assertThat(result.state().activeStepList()).containsExactly("step-3");
      assertThat(result.actions()).isEmpty();

      result = engine.executeStep(diagram, result.state(), trigger("Reset"));
      assertThat(result.state().activeStepList()).containsExactly("step-0");
   }

   @Test
   public void testAndConvergenceWaitsForAllBranches() {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/parallel.sfc");
      SimulationState initial = engine.init(diagram);
      StepResult result = engine.executeStep(diagram, initial, trigger("Ready"));
      assertThat(result.firedTransitions()).isEmpty();
      assertThat(result.state()).isEqualTo(initial);
      assertThat(result.ignoredInputs()).isEmpty();
   }

   @Test
   public void testOrDivergenceSelectsSingleBranch() {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/selection.sfc");
      SimulationState initial = engine.init(diagram);

      StepResult second = engine.executeStep(diagram, initial, SimulationInputs.variables(Map.of("A", false, "B", true)));
      assertThat(second.state().activeStepList()).containsExactly("step-2");
      assertThat(second.actionNames()).containsExactly("Rinse");

      StepResult both = engine.executeStep(diagram, initial, SimulationInputs.variables(Map.of("A", true, "B", true)));
      // the first branch wins
      assertThat(both.firedTransitions()).containsExactly("transition-0");
      assertThat(both.state().activeStepList()).containsExactly("step-1");

      StepResult converged = engine.executeStep(diagram, both.state(), trigger("DoneA"));
      assertThat(converged.state().activeStepList()).containsExactly("step-3");
      StepResult back = engine.executeStep(diagram, converged.state(), trigger("Back"));
      assertThat(back.state().activeStepList()).containsExactly("step-0");
   }

   @Test
   public void testEvaluationIsSimultaneous() {
      GrafcetDiagram diagram = TestUtil.compile("Step 0 (Initial)\nTransition a\nStep 1\nTransition \"a AND TRUE\"\nStep 2");
      SimulationInputs inputs = SimulationInputs.variables(Map.of("a", true));
      StepResult first = engine.executeStep(diagram, engine.init(diagram), inputs);
      assertThat(first.state().activeStepList()).containsExactly("step-1");
      StepResult second = engine.executeStep(diagram, first.state(), inputs);
      assertThat(second.state().activeStepList()).containsExactly("step-2");
   }

   @Test
   public void testVariablesCarryOver() {
      GrafcetDiagram diagram = TestUtil.compile("Step 0 (Initial)\nTransition A\nStep 1\nTransition \"A AND B\"\nStep 2");
      StepResult first = engine.executeStep(diagram, engine.init(diagram), SimulationInputs.variables(Map.of("A", true)));
      assertThat(first.state().activeStepList()).containsExactly("step-1");
      assertThat(first.state().variables()).containsEntry("A", true);
      // A keeps its value from the previous call
      StepResult second = engine.executeStep(diagram, first.state(), SimulationInputs.variables(Map.of("B", true)));
      assertThat(second.state().activeStepList()).containsExactly("step-2");
      assertThat(second.state().variables()).containsEntry("A", true).containsEntry("B", true);
   }

   @Test
   public void testEdgesCompareWithCarriedValues() {
      GrafcetDiagram diagram = TestUtil.compile("Step 0 (Initial)\nTransition A\nStep 1\nTransition \"FE A\"\nStep 2");
      StepResult first = engine.executeStep(diagram, engine.init(diagram), SimulationInputs.variables(Map.of("A", true)));
      assertThat(first.state().activeStepList()).containsExactly("step-1");
      // A is not mentioned, so it stays true and there is no falling edge
      StepResult second = engine.executeStep(diagram, first.state(), SimulationInputs.variables(Map.of("C", true)));
      assertThat(second.firedTransitions()).isEmpty();
      assertThat(second.state().activeStepList()).containsExactly("step-1");
      StepResult third = engine.executeStep(diagram, second.state(), SimulationInputs.variables(Map.of("A", false)));
      assertThat(third.state().activeStepList()).containsExactly("step-2");
   }

   @Test
   public void testRisingEdgeOnlyOnChange() {
      GrafcetDiagram diagram = TestUtil.compile("Step 0 (Initial)\nTransition go\nStep 1\nTransition \"RE S\"\nStep 2");
      SimulationState state = engine.executeStep(diagram, engine.init(diagram), SimulationInputs.variables(Map.of("S", true))).state();
      state = engine.executeStep(diagram, state, trigger("go")).state();
      assertThat(state.activeStepList()).containsExactly("step-1");
      // S was already true before, no rising edge
      StepResult held = engine.executeStep(diagram, state, SimulationInputs.variables(Map.of("S", true)));
      assertThat(held.state().activeStepList()).containsExactly("step-1");
      state = engine.executeStep(diagram, held.state(), SimulationInputs.variables(Map.of("S", false))).state();
      StepResult rising = engine.executeStep(diagram, state, SimulationInputs.variables(Map.of("S", true)));
      assertThat(rising.state().activeStepList()).containsExactly("step-2");
   }

   @Test
   public void testNoInputsIsIdempotent() {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/parallel.sfc");
      SimulationState state = engine.executeStep(diagram, engine.init(diagram), trigger("Go")).state();
      StepResult once = engine.executeStep(diagram, state, SimulationInputs.NONE);
      StepResult twice = engine.executeStep(diagram, once.state(), SimulationInputs.NONE);
      assertThat(once.firedTransitions()).isEmpty();
      assertThat(once.state()).isEqualTo(state);
      assertThat(twice.state()).isEqualTo(once.state());
      assertThat(twice.actionNames()).isEqualTo(once.actionNames());
   }

   @Test
   public void testUnknownAndInvalidTriggersAreIgnored() {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/start-done.sfc");
      SimulationState initial = engine.init(diagram);
      StepResult result = engine.executeStep(diagram, initial, SimulationInputs.transitions(Map.of("Nope", true)));
      assertThat(result.ignoredInputs()).containsExactly("Nope");
      assertThat(result.state()).isEqualTo(initial);

      result = engine.executeStep(diagram, initial, SimulationInputs.transitions(Map.of("Start", "yes")));
      assertThat(result.ignoredInputs()).containsExactly("Start");
      assertThat(result.firedTransitions()).isEmpty();
   }

   @Test
   public void testTriggerByIdAndNumber() {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/start-done.sfc");
      SimulationState initial = engine.init(diagram);
      assertThat(engine.executeStep(diagram, initial, trigger("transition-0")).state().activeStepList()).containsExactly("step-1");
      assertThat(engine.executeStep(diagram, initial, trigger("T0")).state().activeStepList()).containsExactly("step-1");
      assertThat(engine.executeStep(diagram, initial, SimulationInputs.variables(Map.of("Start", true)))
            .state().activeStepList()).containsExactly("step-1");
   }

   @Test
   public void testTimedTransition() {
      GrafcetDiagram diagram = TestUtil.compile("Step 0 (Initial)\nTransition go\nStep 1\nTransition \"X1.t >= 5s\"\nStep 2");
      SimulationState state = engine.executeStep(diagram, engine.init(diagram), at(0, Map.of("go", true))).state();
      assertThat(state.activeStepList()).containsExactly("step-1");
      state = engine.executeStep(diagram, state, at(3, Collections.emptyMap())).state();
      assertThat(state.activeStepList()).containsExactly("step-1");
      state = engine.executeStep(diagram, state, at(5, Collections.emptyMap())).state();
      assertThat(state.activeStepList()).containsExactly("step-2");
   }

   @Test
   public void testActionQualifiers() {
      GrafcetDiagram diagram = TestUtil.compile("Step 0 (Initial)\n"
            + "   Action Lamp S\n"
            + "Transition go\n"
            + "Step 1\n"
            + "   Action Beep P\n"
            + "   Action Fan L (Duration=5s)\n"
            + "   Action Alarm D (Duration=2s)\n"
            + "Transition stop\n"
            + "Step 2\n"
            + "   Action Lamp R\n"
            + "Transition again\n"
            + "Jump 0");
      SimulationState state = engine.init(diagram);
      assertThat(state.storedVariables()).containsEntry("Lamp", true);

      StepResult result = engine.executeStep(diagram, state, at(1, Map.of("go", true)));
      assertThat(result.actionNames()).containsExactly("Beep", "Fan", "Lamp");
      assertThat(result.actions()).filteredOn(action -> action.variable().equals("Lamp"))
            .extracting(FiredAction::type).containsExactly(FiredAction.TYPE_STORED);

      result = engine.executeStep(diagram, result.state(), at(4, Collections.emptyMap()));
      assertThat(result.actionNames()).containsExactly("Fan", "Alarm", "Lamp");

      result = engine.executeStep(diagram, result.state(), at(7, Collections.emptyMap()));
      assertThat(result.actionNames()).containsExactly("Alarm", "Lamp");

      result = engine.executeStep(diagram, result.state(), at(8, Map.of("stop", true)));
      assertThat(result.state().activeStepList()).containsExactly("step-2");
      assertThat(result.actions()).isEmpty();
      assertThat(result.state().storedVariables()).isEmpty();
   }

   @Test
   public void testConditionalAction() {
      GrafcetDiagram diagram = TestUtil.compile("Step 0 (Initial)\n   Action Heater (Condition=\"temp < 20\")\nTransition stop\nStep 1");
      SimulationState state = engine.init(diagram);
      assertThat(engine.executeStep(diagram, state, SimulationInputs.variables(Map.of("temp", 15))).actionNames())
            .containsExactly("Heater");
      assertThat(engine.executeStep(diagram, state, SimulationInputs.variables(Map.of("temp", 25))).actionNames())
            .isEmpty();
   }
}
