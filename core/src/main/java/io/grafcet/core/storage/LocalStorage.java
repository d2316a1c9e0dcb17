package io.grafcet.core.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.grafcet.internal.Properties;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * {@link Storage} backed by a directory. Paths resolving outside of the root are rejected.
 */
public class LocalStorage implements Storage {
   private static final Logger log = LogManager.getLogger(LocalStorage.class);

   private final Path root;

   public LocalStorage(Path root) {
      this.root = root.toAbsolutePath().normalize();
   }

   /**
    * Storage rooted at {@code io.grafcet.storage.root}, or the working directory when unset.
    */
   public static LocalStorage fromProperties() {
      return new LocalStorage(Paths.get(Properties.get(Properties.STORAGE_ROOT, ".")));
   }

   public Path root() {
      return root;
   }

   @Override
   public JsonObject readJson(String path) throws IOException {
      String text = readText(path);
      try {
         return new JsonObject(text);
      } catch (DecodeException e) {
         throw new IOException("File " + path + " does not contain a JSON object", e);
      }
   }

   @Override
   public void writeJson(String path, JsonObject document) throws IOException {
      Path file = resolve(path);
      if (file.getParent() != null) {
         Files.createDirectories(file.getParent());
      }
      Files.write(file, document.encodePrettily().getBytes(StandardCharsets.UTF_8));
      log.debug("Wrote {}", file);
   }

   @Override
   public boolean exists(String path) {
      try {
         return Files.isRegularFile(resolve(path));
      } catch (IllegalArgumentException e) {
         log.debug("Rejected path {}: {}", path, e.getMessage());
         return false;
      }
   }

   @Override
   public String readText(String path) throws IOException {
      Path file = resolve(path);
      log.debug("Reading {}", file);
      return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
   }

   Path resolve(String path) {
      if (path == null || path.isBlank()) {
         throw new IllegalArgumentException("Path must not be empty");
      }
      Path resolved = root.resolve(path).normalize();
      if (!resolved.startsWith(root)) {
         throw new IllegalArgumentException("Path " + path + " escapes the storage root");
      }
      return resolved;
   }
}
