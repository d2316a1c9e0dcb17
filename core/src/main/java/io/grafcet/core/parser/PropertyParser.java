package io.grafcet.core.parser;

import java.util.function.BiConsumer;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.events.ScalarEvent;

import io.grafcet.core.simulation.ConditionEvaluator;

public class PropertyParser {
   private PropertyParser() {}

   public static class String<T> implements Parser<T> {
      private final BiConsumer<T, java.lang.String> consumer;

      public String(BiConsumer<T, java.lang.String> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         consumer.accept(target, event.getValue());
      }
   }

   /**
    * Accepts a plain number of seconds or a duration such as {@code 500ms} or {@code 2s}.
    */
   public static class Seconds<T> implements Parser<T> {
      private final BiConsumer<T, java.lang.Double> consumer;

      public Seconds(BiConsumer<T, java.lang.Double> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         double seconds = ConditionEvaluator.parseDuration(event.getValue());
         if (java.lang.Double.isNaN(seconds)) {
            throw new ParserException(event, "Failed to parse as time: " + event.getValue());
         }
         consumer.accept(target, seconds);
      }
   }

   /**
    * Mapping of names to scalar values. Plain {@code true}/{@code false} become booleans, plain numbers become
    * numbers; quoted scalars are always strings.
    */
   public static class Values<T> implements Parser<T> {
      private final ValueConsumer<T> consumer;

      public Values(ValueConsumer<T> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ctx.parseMapping(target, key -> (c, t) -> {
            ScalarEvent value = c.expectEvent(ScalarEvent.class);
            consumer.accept(t, key.getValue(), convert(value));
         });
      }

      static Object convert(ScalarEvent event) {
         java.lang.String value = event.getValue();
         if (event.getScalarStyle() != DumperOptions.ScalarStyle.PLAIN) {
            return value;
         }
         if (value.isEmpty() || value.equals("~") || value.equalsIgnoreCase("null")) {
            return null;
         } else if (value.equalsIgnoreCase("true")) {
            return java.lang.Boolean.TRUE;
         } else if (value.equalsIgnoreCase("false")) {
            return java.lang.Boolean.FALSE;
         }
         try {
            return Integer.parseInt(value);
         } catch (NumberFormatException e) {
            // not an integer
         }
         try {
            return java.lang.Double.parseDouble(value);
         } catch (NumberFormatException e) {
            return value;
         }
      }
   }

   @FunctionalInterface
   public interface ValueConsumer<T> {
      void accept(T target, java.lang.String name, Object value);
   }
}
