package io.grafcet.core.parser;

import java.util.HashMap;
import java.util.Map;

import org.yaml.snakeyaml.events.ScalarEvent;

abstract class AbstractParser<T, S> implements Parser<T> {
   Map<String, Parser<S>> subBuilders = new HashMap<>();

   void callSubBuilders(Context ctx, S target) throws ParserException {
      ctx.parseMapping(target, this::getSubBuilder);
   }

   private Parser<S> getSubBuilder(ScalarEvent event) throws ParserException {
      Parser<S> builder = subBuilders.get(event.getValue());
      if (builder == null) {
         throw new ParserException(event, "Invalid property: '" + event.getValue() + "', expected one of " + subBuilders.keySet());
      }
      return builder;
   }

   protected void register(String property, Parser<S> parser) {
      Parser<S> prev = subBuilders.put(property, parser);
      assert prev == null;
   }
}
