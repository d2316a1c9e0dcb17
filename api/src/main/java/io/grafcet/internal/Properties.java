package io.grafcet.internal;

import java.util.function.Function;

public interface Properties {
   String LAYOUT_PREFIX = "io.grafcet.layout.";
   String PARSER_DEBUG = "io.grafcet.parser.debug";
   String SCENARIO_MAX = "io.grafcet.scenario.max";
   String STORAGE_ROOT = "io.grafcet.storage.root";
   String LOG4J2_CONFIGURATION_FILE = "log4j.configurationFile";

   static String get(String property, String def) {
      return get(property, Function.identity(), def);
   }

   static double getDouble(String property, double def) {
      return get(property, Double::valueOf, def);
   }

   static int getInt(String property, int def) {
      return get(property, Integer::valueOf, def);
   }

   static boolean getBoolean(String property) {
      return get(property, Boolean::valueOf, false);
   }

   static <T> T get(String property, Function<String, T> f, T def) {
      String value = System.getProperty(property);
      if (value != null) {
         return f.apply(value);
      }
      value = System.getenv(property.replaceAll("[^a-zA-Z0-9]", "_").toUpperCase());
      if (value != null) {
         return f.apply(value);
      }
      return def;
   }
}
