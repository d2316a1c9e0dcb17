package io.grafcet.core.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.grafcet.api.diagram.ActionBlock;
import io.grafcet.api.diagram.ActionQualifier;
import io.grafcet.api.diagram.Connection;
import io.grafcet.api.diagram.Element;
import io.grafcet.api.diagram.Gate;
import io.grafcet.api.diagram.GateType;
import io.grafcet.api.diagram.GrafcetDiagram;
import io.grafcet.api.diagram.Step;
import io.grafcet.api.diagram.Transition;
import io.grafcet.api.simulation.FiredAction;
import io.grafcet.api.simulation.SimulationInputs;
import io.grafcet.api.simulation.SimulationState;
import io.grafcet.api.simulation.StepResult;

/**
 * Evolves the set of active steps of a compiled chart.
 * <p>
 * All transitions are evaluated against the state before the call: a transition is cleared when every
 * step upstream of it is active and its guard holds. Cleared transitions then deactivate their upstream steps
 * and activate their downstream steps at once; a step that is both deactivated and activated stays active.
 * Among the transitions leading out of the same OR divergence only the one on the first branch is cleared.
 * <p>
 * The engine keeps no state of its own and never throws for a diagram it can load; inputs it cannot interpret
 * are reported in {@link StepResult#ignoredInputs()}.
 */
public class SimulationEngine {
   private static final Logger log = LogManager.getLogger(SimulationEngine.class);

   public SimulationState init(GrafcetDiagram diagram) {
      Set<String> active = new LinkedHashSet<>();
      Map<String, Double> activationTimes = new LinkedHashMap<>();
      for (Step step : diagram.initialSteps()) {
         active.add(step.id());
         activationTimes.put(step.id(), 0.0);
      }
      Map<String, Boolean> stored = new LinkedHashMap<>();
      Scope scope = new Scope(diagram, active, activationTimes, 0, Collections.emptyMap(), Collections.emptyMap(), stored);
      collectActions(diagram, active, active, scope, stored);
      return new SimulationState(active, stored, Collections.emptyMap(), activationTimes, 0);
   }

   public StepResult executeStep(GrafcetDiagram diagram, SimulationState state, SimulationInputs inputs) {
      double time = inputs.time() != null ? inputs.time() : state.time();
      List<String> ignored = new ArrayList<>();
      Set<String> triggered = directTriggers(diagram, inputs, ignored);
      Map<String, Object> variables = new LinkedHashMap<>(state.variables());
      variables.putAll(inputs.variables());
      Scope before = new Scope(diagram, state.activeSteps(), state.activationTimes(), time, variables,
            state.variables(), state.storedVariables());

      List<Candidate> candidates = new ArrayList<>();
      for (Transition transition : diagram.transitions()) {
         Upstream upstream = new Upstream();
         collectUpstream(diagram, transition.id(), upstream, false, new HashSet<>());
         if (!upstream.isEnabled(state.activeSteps())) {
            continue;
         }
         if (!triggered.contains(transition.id()) && !ConditionEvaluator.evaluate(transition.condition(), before)) {
            continue;
         }
         Set<String> targets = new LinkedHashSet<>();
         collectDownstream(diagram, transition.id(), targets, before, triggered, new HashSet<>());
         if (targets.isEmpty()) {
            log.debug("Transition {} leads to no step and is not cleared", transition.id());
            continue;
         }
         candidates.add(new Candidate(transition, upstream, targets));
      }
      resolveConflicts(diagram, candidates);

      Set<String> deactivated = new HashSet<>();
      Set<String> activated = new LinkedHashSet<>();
      List<String> fired = new ArrayList<>();
      for (Candidate candidate : candidates) {
         deactivated.addAll(candidate.upstream.required);
         for (String stepId : candidate.upstream.anyOf) {
            if (state.isActive(stepId)) {
               deactivated.add(stepId);
            }
         }
         activated.addAll(candidate.targets);
         fired.add(candidate.transition.id());
      }

      Set<String> active = new LinkedHashSet<>();
      for (Step step : diagram.steps()) {
         if (activated.contains(step.id()) || state.isActive(step.id()) && !deactivated.contains(step.id())) {
            active.add(step.id());
         }
      }
      for (String stepId : state.activeSteps()) {
         if (!active.contains(stepId) && !deactivated.contains(stepId)) {
            active.add(stepId);
         }
      }
      Map<String, Double> activationTimes = new LinkedHashMap<>();
      for (String stepId : active) {
         Double since = state.activationTimes().get(stepId);
         activationTimes.put(stepId, activated.contains(stepId) || since == null ? time : since);
      }

      Map<String, Boolean> stored = new LinkedHashMap<>(state.storedVariables());
      Scope after = new Scope(diagram, active, activationTimes, time, variables, state.variables(), stored);
      List<FiredAction> actions = collectActions(diagram, active, activated, after, stored);

      if (!fired.isEmpty()) {
         log.debug("Cleared {}, active steps now {}", fired, active);
      }
      return new StepResult(new SimulationState(active, stored, variables, activationTimes, time), actions, fired, ignored);
   }

   private Set<String> directTriggers(GrafcetDiagram diagram, SimulationInputs inputs, List<String> ignored) {
      Set<String> triggered = new HashSet<>();
      for (Map.Entry<String, Object> entry : inputs.transitions().entrySet()) {
         String key = entry.getKey();
         List<Transition> matches = new ArrayList<>();
         for (Transition transition : diagram.transitions()) {
            if (key.equals(transition.id()) || key.equals(transition.condition()) || key.equalsIgnoreCase(transition.label())) {
               matches.add(transition);
            }
         }
         if (matches.isEmpty()) {
            log.debug("Ignoring trigger '{}': no such transition", key);
            ignored.add(key);
         } else if (!(entry.getValue() instanceof Boolean)) {
            log.debug("Ignoring trigger '{}': {} is not a boolean", key, entry.getValue());
            ignored.add(key);
         } else if ((Boolean) entry.getValue()) {
            matches.forEach(transition -> triggered.add(transition.id()));
         }
      }
      return triggered;
   }

   private void collectUpstream(GrafcetDiagram diagram, String elementId, Upstream upstream, boolean any, Set<String> visited) {
      for (Connection connection : diagram.incoming(elementId)) {
         Element source = diagram.element(connection.sourceId());
         if (source == null || !visited.add(source.id())) {
            continue;
         }
         if (source instanceof Step) {
            (any ? upstream.anyOf : upstream.required).add(source.id());
         } else if (source instanceof Gate) {
            Gate gate = (Gate) source;
            if (gate.gateType() == GateType.OR && gate.isDivergence()) {
               if (upstream.group == null) {
                  upstream.group = gate.id();
               }
               collectUpstream(diagram, gate.id(), upstream, any, visited);
            } else {
               collectUpstream(diagram, gate.id(), upstream, any || gate.gateType() == GateType.OR, visited);
            }
         }
      }
   }

   private void collectDownstream(GrafcetDiagram diagram, String elementId, Set<String> targets, Scope scope,
                                  Set<String> triggered, Set<String> visited) {
      for (Connection connection : diagram.outgoing(elementId)) {
         Element target = diagram.element(connection.targetId());
         if (target == null || !visited.add(target.id())) {
            continue;
         }
         if (target instanceof Step) {
            targets.add(target.id());
         } else if (target instanceof Gate) {
            Gate gate = (Gate) target;
            if (gate.gateType() == GateType.OR && gate.isDivergence()) {
               selectBranch(diagram, gate, targets, scope, triggered, visited);
            } else {
               collectDownstream(diagram, gate.id(), targets, scope, triggered, visited);
            }
         }
      }
   }

   private void selectBranch(GrafcetDiagram diagram, Gate gate, Set<String> targets, Scope scope,
                             Set<String> triggered, Set<String> visited) {
      for (Connection branch : diagram.outgoing(gate.id())) {
         Element first = diagram.element(branch.targetId());
         if (first instanceof Step) {
            targets.add(first.id());
            return;
         } else if (first instanceof Transition && (triggered.contains(first.id())
               || ConditionEvaluator.evaluate(((Transition) first).condition(), scope))) {
            visited.add(first.id());
            collectDownstream(diagram, first.id(), targets, scope, triggered, visited);
            return;
         }
      }
   }

   private void resolveConflicts(GrafcetDiagram diagram, List<Candidate> candidates) {
      Map<String, Candidate> winners = new HashMap<>();
      for (Candidate candidate : candidates) {
         String group = candidate.upstream.group;
         if (group == null) {
            continue;
         }
         Candidate current = winners.get(group);
         if (current == null || branchIndex(diagram, group, candidate.transition) < branchIndex(diagram, group, current.transition)) {
            winners.put(group, candidate);
         }
      }
      candidates.removeIf(candidate -> {
         String group = candidate.upstream.group;
         if (group != null && winners.get(group) != candidate) {
            log.debug("Transition {} loses to {} on OR divergence {}", candidate.transition.id(), winners.get(group).transition.id(), group);
            return true;
         }
         return false;
      });
   }

   private int branchIndex(GrafcetDiagram diagram, String gateId, Transition transition) {
      List<Connection> branches = diagram.outgoing(gateId);
      for (int i = 0; i < branches.size(); ++i) {
         if (branches.get(i).targetId().equals(transition.id())) {
            return i;
         }
      }
      return branches.size();
   }

   private List<FiredAction> collectActions(GrafcetDiagram diagram, Set<String> active, Set<String> activated,
                                            Scope scope, Map<String, Boolean> stored) {
      List<FiredAction> actions = new ArrayList<>();
      for (Step step : diagram.steps()) {
         if (!active.contains(step.id())) {
            continue;
         }
         boolean justActivated = activated.contains(step.id());
         double elapsed = scope.elapsed(step.id());
         for (ActionBlock action : diagram.actionsOf(step)) {
            if (!action.condition().isBlank() && !ConditionEvaluator.evaluate(action.condition(), scope)) {
               continue;
            }
            double duration = ConditionEvaluator.parseDuration(action.duration());
            boolean timed = !Double.isNaN(duration);
            boolean emit = false;
            switch (action.qualifier()) {
               case N:
                  emit = true;
                  break;
               case P:
                  emit = justActivated;
                  break;
               case L:
                  emit = !timed || elapsed < duration;
                  break;
               case D:
                  emit = !timed || elapsed >= duration;
                  break;
               case S:
                  if (justActivated) {
                     stored.put(action.label(), true);
                  }
                  break;
               case R:
                  if (justActivated) {
                     stored.remove(action.label());
                  }
                  break;
               case SD:
               case DS:
                  if (!timed || elapsed >= duration) {
                     stored.put(action.label(), true);
                  }
                  break;
               case SL:
                  if (justActivated) {
                     stored.put(action.label(), true);
                  }
                  if (timed && elapsed >= duration) {
                     stored.remove(action.label());
                  }
                  break;
               default:
                  throw new IllegalStateException("Unknown qualifier " + action.qualifier());
            }
            if (emit) {
               boolean temporal = action.isTemporal() || action.qualifier() == ActionQualifier.L || action.qualifier() == ActionQualifier.D;
               actions.add(new FiredAction(action.label(), step.id(), action.qualifier(),
                     temporal ? FiredAction.TYPE_TEMPORAL : FiredAction.TYPE_ACTION));
            }
         }
      }
      stored.forEach((name, value) -> {
         if (value) {
            actions.add(new FiredAction(name, null, null, FiredAction.TYPE_STORED));
         }
      });
      return actions;
   }

   private static final class Upstream {
      final Set<String> required = new LinkedHashSet<>();
      final Set<String> anyOf = new LinkedHashSet<>();
      String group;

      boolean isEnabled(Set<String> active) {
         if (required.isEmpty() && anyOf.isEmpty()) {
            return false;
         }
         return active.containsAll(required) && (anyOf.isEmpty() || anyOf.stream().anyMatch(active::contains));
      }
   }

   private static final class Candidate {
      final Transition transition;
      final Upstream upstream;
      final Set<String> targets;

      Candidate(Transition transition, Upstream upstream, Set<String> targets) {
         this.transition = transition;
         this.upstream = upstream;
         this.targets = targets;
      }
   }

   private static final class Scope implements ConditionEvaluator.Scope {
      private final GrafcetDiagram diagram;
      private final Set<String> active;
      private final Map<String, Double> activationTimes;
      private final double time;
      private final Map<String, Object> variables;
      private final Map<String, Object> previous;
      private final Map<String, Boolean> stored;

      Scope(GrafcetDiagram diagram, Set<String> active, Map<String, Double> activationTimes, double time,
            Map<String, Object> variables, Map<String, Object> previous, Map<String, Boolean> stored) {
         this.diagram = diagram;
         this.active = active;
         this.activationTimes = activationTimes;
         this.time = time;
         this.variables = variables;
         this.previous = previous;
         this.stored = stored;
      }

      @Override
      public Object variable(String name) {
         if (variables.containsKey(name)) {
            return variables.get(name);
         }
         return stored.get(name);
      }

      @Override
      public Object previous(String name) {
         return previous.get(name);
      }

      @Override
      public boolean isStepActive(int number) {
         Step step = diagram.stepByNumber(number);
         return step != null && active.contains(step.id());
      }

      @Override
      public double stepElapsed(int number) {
         Step step = diagram.stepByNumber(number);
         return step == null ? 0 : elapsed(step.id());
      }

      double elapsed(String stepId) {
         Double since = activationTimes.get(stepId);
         return since == null || !active.contains(stepId) ? 0 : time - since;
      }
   }
}
