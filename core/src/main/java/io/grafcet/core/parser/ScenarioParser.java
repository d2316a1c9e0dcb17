package io.grafcet.core.parser;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.events.DocumentEndEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.events.StreamStartEvent;

import io.grafcet.api.scenario.Scenario;
import io.grafcet.internal.Properties;

/**
 * Reads scenario files. The document is either a list of scenarios or a mapping with a {@code scenarios} list:
 * <pre>
 * scenarios:
 * - name: press start
 *   transitions:
 *     Start: true
 * - variables:
 *     level: 3.5
 *   time: 2s
 * </pre>
 * JSON documents of the same shape are accepted as well.
 */
public class ScenarioParser extends AbstractMappingParser<List<Scenario>> {
   private static final Logger log = LogManager.getLogger(ScenarioParser.class);
   private static final ScenarioParser INSTANCE = new ScenarioParser();
   private static final boolean DEBUG_PARSER = Properties.getBoolean(Properties.PARSER_DEBUG);

   private final Parser<List<Scenario>> listParser = (ctx, scenarios) -> ctx.parseList(scenarios, new ItemParser());

   public static ScenarioParser instance() {
      return INSTANCE;
   }

   private ScenarioParser() {
      register("scenarios", listParser);
   }

   public List<Scenario> parseScenarios(String text) throws ParserException {
      Yaml yaml = new Yaml();
      Iterator<Event> events = yaml.parse(new StringReader(text)).iterator();
      if (DEBUG_PARSER) {
         events = new DebugIterator<>(events);
      }
      Context ctx = new Context(events);
      List<Scenario> scenarios = new ArrayList<>();

      ctx.expectEvent(StreamStartEvent.class);
      if (ctx.peek() instanceof StreamEndEvent) {
         return scenarios;
      }
      ctx.expectEvent(DocumentStartEvent.class);
      Event first = ctx.peek();
      if (first instanceof SequenceStartEvent) {
         listParser.parse(ctx, scenarios);
      } else if (first instanceof MappingStartEvent) {
         parse(ctx, scenarios);
      } else {
         throw new ParserException(first, "Expected a list of scenarios or a mapping with 'scenarios'");
      }
      ctx.expectEvent(DocumentEndEvent.class);
      ctx.expectEvent(StreamEndEvent.class);
      log.debug("Parsed {} scenario(s)", scenarios.size());
      return scenarios;
   }

   private static class ItemParser extends AbstractParser<List<Scenario>, Draft> {
      ItemParser() {
         register("name", new PropertyParser.String<>((draft, name) -> draft.name = name));
         register("variables", new PropertyParser.Values<>((draft, name, value) -> draft.variables.put(name, value)));
         register("transitions", new PropertyParser.Values<>((draft, name, value) -> draft.transitions.put(name, value)));
         register("time", new PropertyParser.Seconds<>((draft, time) -> draft.time = time));
      }

      @Override
      public void parse(Context ctx, List<Scenario> scenarios) throws ParserException {
         Draft draft = new Draft();
         callSubBuilders(ctx, draft);
         scenarios.add(new Scenario(draft.name, draft.variables, draft.transitions, draft.time));
      }
   }

   private static class Draft {
      String name;
      final Map<String, Object> variables = new LinkedHashMap<>();
      final Map<String, Object> transitions = new LinkedHashMap<>();
      Double time;
   }
}
