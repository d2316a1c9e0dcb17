package io.grafcet.core.scenario;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.grafcet.api.diagram.GrafcetDiagram;
import io.grafcet.api.scenario.Scenario;
import io.grafcet.api.scenario.ScenarioResult;
import io.grafcet.api.scenario.ScenarioRunResult;
import io.grafcet.api.simulation.SimulationInputs;
import io.grafcet.api.simulation.SimulationState;
import io.grafcet.api.simulation.StepResult;
import io.grafcet.core.json.DiagramCodec;
import io.grafcet.core.simulation.SimulationEngine;
import io.grafcet.core.storage.Storage;
import io.grafcet.internal.Properties;

/**
 * Replays scenarios, in order, against one simulation started from the initial steps.
 */
public class ScenarioRunner {
   private static final Logger log = LogManager.getLogger(ScenarioRunner.class);
   public static final int DEFAULT_MAX_SCENARIOS = 10000;

   private final SimulationEngine engine;
   private final int maxScenarios;

   public ScenarioRunner() {
      this(new SimulationEngine(), Properties.getInt(Properties.SCENARIO_MAX, DEFAULT_MAX_SCENARIOS));
   }

   public ScenarioRunner(SimulationEngine engine, int maxScenarios) {
      this.engine = engine;
      this.maxScenarios = maxScenarios;
   }

   /**
    * @throws IllegalArgumentException when there are more scenarios than {@code io.grafcet.scenario.max} allows.
    */
   public List<ScenarioResult> runScenarios(GrafcetDiagram diagram, List<Scenario> scenarios) {
      if (scenarios.size() > maxScenarios) {
         throw new IllegalArgumentException("Cannot run " + scenarios.size() + " scenarios, the limit is " + maxScenarios);
      }
      SimulationState state = engine.init(diagram);
      log.debug("Starting {} scenario(s) on '{}' with active steps {}", scenarios.size(), diagram.title(), state.activeSteps());
      List<ScenarioResult> results = new ArrayList<>(scenarios.size());
      for (int i = 0; i < scenarios.size(); ++i) {
         Scenario scenario = scenarios.get(i);
         String name = scenario.name() != null ? scenario.name() : "Scenario " + (i + 1);
         StepResult result = engine.executeStep(diagram, state, new SimulationInputs(scenario.transitions(), scenario.variables(), scenario.time()));
         state = result.state();
         log.trace("{}: fired {}, active {}, actions {}", name, result.firedTransitions(), state.activeSteps(), result.actionNames());
         if (!result.ignoredInputs().isEmpty()) {
            log.debug("{}: ignored inputs {}", name, result.ignoredInputs());
         }
         results.add(new ScenarioResult(name, i + 1, state.activeStepList(), result.actionNames(), scenario.variables(),
               result.ignoredInputs().isEmpty()));
      }
      return results;
   }

   /**
    * Loads the diagram stored under {@code path} and runs the scenarios against it.
    */
   public ScenarioRunResult runFromFile(Storage storage, String path, List<Scenario> scenarios) throws IOException {
      if (!storage.exists(path)) {
         throw new NoSuchFileException(path);
      }
      GrafcetDiagram diagram = DiagramCodec.fromJson(storage.readJson(path));
      return new ScenarioRunResult(runScenarios(diagram, scenarios), path, scenarios.size());
   }
}
