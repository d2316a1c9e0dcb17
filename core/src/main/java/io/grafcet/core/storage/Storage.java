package io.grafcet.core.storage;

import java.io.IOException;

import io.vertx.core.json.JsonObject;

/**
 * Project-relative document store for diagrams and scenario files.
 */
public interface Storage {
   JsonObject readJson(String path) throws IOException;

   void writeJson(String path, JsonObject document) throws IOException;

   boolean exists(String path);

   /**
    * @return Raw content of the document, for formats other than JSON.
    */
   String readText(String path) throws IOException;
}
