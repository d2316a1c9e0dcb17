package io.grafcet.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.aesh.command.registry.CommandRegistryException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.vertx.core.json.JsonObject;

public class GrafcetCliTest {
   private static final String CHART = "SFC \"Start and stop\"\n"
         + "Step 0 (Initial)\n"
         + "    Action \"Motor\" N\n"
         + "Transition Start\n"
         + "Step 1\n"
         + "Transition Done\n"
         + "Jump 0\n";

   @TempDir
   Path dir;

   @Test
   public void testCompileToFile() throws IOException, CommandRegistryException {
      Path source = write("chart.sfc", CHART);
      Path output = dir.resolve("out").resolve("chart.json");
      assertThat(new GrafcetCli().execute(new String[]{ "compile", source.toString(), "-o", output.toString() })).isTrue();
      JsonObject document = new JsonObject(new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
      assertThat(document.getString("title")).isEqualTo("Start and stop");
      assertThat(document.getJsonArray("elements").size()).isGreaterThan(0);
   }

   @Test
   public void testCompileFailure() throws IOException, CommandRegistryException {
      Path source = write("broken.sfc", "Step 0 (Initial)\nStep 1\n");
      Path output = dir.resolve("broken.json");
      assertThat(new GrafcetCli().execute(new String[]{ "compile", source.toString(), "-o", output.toString() })).isFalse();
      assertThat(Files.exists(output)).isFalse();
   }

   @Test
   public void testSimulate() throws IOException, CommandRegistryException {
      Path source = write("chart.sfc", CHART);
      assertThat(new GrafcetCli().execute(new String[]{ "compile", source.toString(), "-o", dir.resolve("chart.json").toString() })).isTrue();
      Path scenarios = write("scenarios.yaml", "- name: press start\n  transitions:\n    Start: true\n");
      Path result = dir.resolve("result.json");
      assertThat(new GrafcetCli().execute(new String[]{ "simulate", "chart.json", "--root", dir.toString(),
            "-s", scenarios.toString(), "-o", result.toString() })).isTrue();
      JsonObject json = new JsonObject(new String(Files.readAllBytes(result), StandardCharsets.UTF_8));
      assertThat(json.getInteger("totalScenarios")).isEqualTo(1);
      assertThat(json.getJsonArray("results").getJsonObject(0).getJsonArray("activeSteps").getList()).containsExactly("step-1");
   }

   @Test
   public void testUnknownCommand() throws CommandRegistryException {
      assertThat(new GrafcetCli().execute(new String[]{ "frobnicate" })).isFalse();
   }

   private Path write(String name, String content) throws IOException {
      Path file = dir.resolve(name);
      Files.write(file, content.getBytes(StandardCharsets.UTF_8));
      return file;
   }
}
