package io.grafcet.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.vertx.core.json.JsonObject;

public class LocalStorageTest {
   @TempDir
   Path dir;

   @Test
   public void testWriteAndRead() throws IOException {
      LocalStorage storage = new LocalStorage(dir);
      storage.writeJson("charts/one.json", new JsonObject().put("title", "One"));
      assertThat(Files.isRegularFile(dir.resolve("charts").resolve("one.json"))).isTrue();
      assertThat(storage.exists("charts/one.json")).isTrue();
      assertThat(storage.exists("charts/two.json")).isFalse();
      assertThat(storage.readJson("charts/one.json").getString("title")).isEqualTo("One");
   }

   @Test
   public void testMissingFile() {
      LocalStorage storage = new LocalStorage(dir);
      assertThatThrownBy(() -> storage.readText("nothing.json")).isInstanceOf(NoSuchFileException.class);
   }

   @Test
   public void testNotJson() throws IOException {
      Files.write(dir.resolve("text.json"), "[1, 2]".getBytes(StandardCharsets.UTF_8));
      LocalStorage storage = new LocalStorage(dir);
      assertThat(storage.readText("text.json")).isEqualTo("[1, 2]");
      assertThatThrownBy(() -> storage.readJson("text.json")).isInstanceOf(IOException.class)
            .hasMessageContaining("does not contain a JSON object");
   }

   @Test
   public void testEscapingRoot() {
      LocalStorage storage = new LocalStorage(dir.resolve("root"));
      assertThat(storage.exists("../outside.json")).isFalse();
      assertThatThrownBy(() -> storage.readText("../outside.json")).isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("escapes the storage root");
      assertThatThrownBy(() -> storage.writeJson("a/../../b.json", new JsonObject())).isInstanceOf(IllegalArgumentException.class);
   }

   @Test
   public void testBlankPath() {
      LocalStorage storage = new LocalStorage(dir);
      assertThat(storage.exists(" ")).isFalse();
      assertThatThrownBy(() -> storage.readText("")).isInstanceOf(IllegalArgumentException.class);
   }
}
