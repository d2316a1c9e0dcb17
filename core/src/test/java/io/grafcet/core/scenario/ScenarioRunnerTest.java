package io.grafcet.core.scenario;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.grafcet.api.diagram.GrafcetDiagram;
import io.grafcet.api.scenario.Scenario;
import io.grafcet.api.scenario.ScenarioResult;
import io.grafcet.api.scenario.ScenarioRunResult;
import io.grafcet.core.parser.ParserException;
import io.grafcet.core.parser.ScenarioParser;
import io.grafcet.core.simulation.SimulationEngine;
import io.grafcet.core.storage.LocalStorage;
import io.grafcet.core.test.TestUtil;

public class ScenarioRunnerTest {
   private final ScenarioRunner runner = new ScenarioRunner(new SimulationEngine(), 100);

   @TempDir
   Path dir;

   private static List<Scenario> scenarios() throws ParserException {
      return ScenarioParser.instance().parseScenarios(TestUtil.resource("scenarios.yaml"));
   }

   @Test
   public void testStartDoneCycle() throws ParserException {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/start-done.sfc");
      List<ScenarioResult> results = runner.runScenarios(diagram, scenarios());
      assertThat(results).hasSize(3);
      assertStartDone(results);
   }

   @Test
   public void testDirectTriggersAndIgnoredInputs() {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/start-done.sfc");
      List<ScenarioResult> results = runner.runScenarios(diagram, Arrays.asList(
            Scenario.builder("typo").transition("Strat", true).build(),
            Scenario.builder(null).transition("Start", true).build(),
            Scenario.builder(null).transition("Done", true).build(),
            Scenario.builder(null).build()));
      assertThat(results.get(0).success()).isFalse();
      assertThat(results.get(0).activeSteps()).containsExactly("step-0");
      assertThat(results.get(1).name()).isEqualTo("Scenario 2");
      assertThat(results.get(1).activeSteps()).containsExactly("step-1");
      // Jump 0 brings the chart back to the initial step
      assertThat(results.get(2).activeSteps()).containsExactly("step-0");
      assertThat(results.get(2).activeActions()).containsExactly("Motor");
      assertThat(results.get(3).activeSteps()).containsExactly("step-0");
      assertThat(results.get(3).stepNumber()).isEqualTo(4);
   }

   @Test
   public void testEmptyScenarioList() {
      GrafcetDiagram diagram = TestUtil.compileResource("charts/start-done.sfc");
      assertThat(runner.runScenarios(diagram, Collections.emptyList())).isEmpty();
   }

   @Test
   public void testScenarioLimit() throws ParserException {
      ScenarioRunner limited = new ScenarioRunner(new SimulationEngine(), 2);
      GrafcetDiagram diagram = TestUtil.compileResource("charts/start-done.sfc");
      assertThatThrownBy(() -> limited.runScenarios(diagram, scenarios()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("limit is 2");
   }

   @Test
   public void testRunFromLegacyFile() throws IOException, ParserException {
      Files.write(dir.resolve("legacy-diagram.json"), TestUtil.resource("legacy-diagram.json").getBytes(StandardCharsets.UTF_8));
      ScenarioRunResult run = runner.runFromFile(new LocalStorage(dir), "legacy-diagram.json", scenarios());
      assertThat(run.loadedFilePath()).isEqualTo("legacy-diagram.json");
      assertThat(run.totalScenarios()).isEqualTo(3);
      assertStartDone(run.results());
   }

   @Test
   public void testRunFromMissingFile() {
      assertThatThrownBy(() -> runner.runFromFile(new LocalStorage(dir), "nothing.json", Collections.emptyList()))
            .isInstanceOf(NoSuchFileException.class);
   }

   private static void assertStartDone(List<ScenarioResult> results) {
      ScenarioResult first = results.get(0);
      assertThat(first.name()).isEqualTo("press start");
      assertThat(first.stepNumber()).isEqualTo(1);
      assertThat(first.activeSteps()).containsExactly("step-1");
      assertThat(first.activeActions()).isEmpty();
      assertThat(first.success()).isTrue();

      ScenarioResult second = results.get(1);
      assertThat(second.name()).isEqualTo("finish");
      assertThat(second.activeSteps()).containsExactly("step-0");
      assertThat(second.activeActions()).containsExactly("Motor");

      ScenarioResult third = results.get(2);
      assertThat(third.name()).isEqualTo("Scenario 3");
      assertThat(third.activeSteps()).containsExactly("step-0");
      assertThat(third.variablesApplied()).containsEntry("level", 3.5).containsEntry("mode", "auto");
      assertThat(third.success()).isTrue();
   }
}
