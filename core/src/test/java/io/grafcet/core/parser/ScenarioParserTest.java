package io.grafcet.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.grafcet.api.scenario.Scenario;
import io.grafcet.core.test.TestUtil;

public class ScenarioParserTest {
   private final ScenarioParser parser = ScenarioParser.instance();

   @Test
   public void testMappingDocument() throws ParserException {
      List<Scenario> scenarios = parser.parseScenarios(TestUtil.resource("scenarios.yaml"));
      assertThat(scenarios).hasSize(3);
      assertThat(scenarios.get(0).name()).isEqualTo("press start");
      assertThat(scenarios.get(0).transitions()).containsEntry("Start", true);
      assertThat(scenarios.get(0).time()).isNull();
      Scenario third = scenarios.get(2);
      assertThat(third.name()).isNull();
      assertThat(third.variables()).containsEntry("level", 3.5).containsEntry("mode", "auto");
      assertThat(third.time()).isEqualTo(2.0);
   }

   @Test
   public void testListDocument() throws ParserException {
      List<Scenario> scenarios = parser.parseScenarios("- transitions: { T0: true }\n"
            + "- variables:\n    count: 4\n    label: '12'\n    flag: false\n    nothing: ~\n  time: 500ms\n");
      assertThat(scenarios).hasSize(2);
      assertThat(scenarios.get(0).transitions()).containsEntry("T0", true);
      Scenario second = scenarios.get(1);
      assertThat(second.variables()).containsEntry("count", 4).containsEntry("label", "12").containsEntry("flag", false);
      assertThat(second.variables()).containsKey("nothing");
      assertThat(second.variables().get("nothing")).isNull();
      assertThat(second.time()).isEqualTo(0.5);
   }

   @Test
   public void testJsonDocument() throws ParserException {
      List<Scenario> scenarios = parser.parseScenarios("{\"scenarios\": [{\"name\": \"json\", \"transitions\": {\"Go\": true}}]}");
      assertThat(scenarios).hasSize(1);
      assertThat(scenarios.get(0).name()).isEqualTo("json");
   }

   @Test
   public void testEmptyDocuments() throws ParserException {
      assertThat(parser.parseScenarios("")).isEmpty();
      assertThat(parser.parseScenarios("scenarios: []")).isEmpty();
   }

   @Test
   public void testUnknownProperty() {
      assertThatThrownBy(() -> parser.parseScenarios("- name: x\n  triggers:\n    Go: true\n"))
            .isInstanceOf(ParserException.class)
            .hasMessageContaining("Invalid property: 'triggers'")
            .satisfies(e -> assertThat(((ParserException) e).line()).isEqualTo(2));
   }

   @Test
   public void testMalformedYaml() {
      assertThatThrownBy(() -> parser.parseScenarios("- \"unclosed\n"))
            .isInstanceOf(ParserException.class)
            .hasMessageContaining("YAML is malformed");
   }

   @Test
   public void testScalarDocument() {
      assertThatThrownBy(() -> parser.parseScenarios("just text"))
            .isInstanceOf(ParserException.class)
            .hasMessageContaining("Expected a list of scenarios");
   }
}
