package io.grafcet.cli.commands;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.List;

import org.aesh.command.CommandDefinition;
import org.aesh.command.CommandException;
import org.aesh.command.CommandResult;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Argument;
import org.aesh.command.option.Option;
import org.aesh.io.Resource;

import io.grafcet.api.scenario.Scenario;
import io.grafcet.api.scenario.ScenarioResult;
import io.grafcet.api.scenario.ScenarioRunResult;
import io.grafcet.core.json.DiagramFormatException;
import io.grafcet.core.json.ResultJson;
import io.grafcet.core.parser.ParserException;
import io.grafcet.core.parser.ScenarioParser;
import io.grafcet.core.scenario.ScenarioRunner;
import io.grafcet.core.storage.LocalStorage;

@CommandDefinition(name = "simulate", description = "Runs scenarios against a stored diagram.")
public class Simulate extends BaseFileCommand {
   @Option(shortName = 'h', hasValue = false, overrideRequired = true)
   boolean help;

   @Option(shortName = 's', description = "YAML or JSON file with the scenarios", required = true)
   Resource scenarios;

   @Option(shortName = 'r', description = "Storage root the diagram path is resolved against; defaults to io.grafcet.storage.root")
   String root;

   @Option(shortName = 'o', description = "File the results are written to; a summary is printed when not set")
   String output;

   @Argument(description = "Diagram document, relative to the storage root", required = true)
   String diagram;

   @Override
   public CommandResult execute(CommandInvocation invocation) throws CommandException {
      if (help) {
         invocation.println(invocation.getHelpInfo("simulate"));
         return CommandResult.SUCCESS;
      }
      List<Scenario> list;
      try {
         list = ScenarioParser.instance().parseScenarios(read(scenarios));
      } catch (ParserException e) {
         throw new CommandException("Cannot parse scenarios in " + scenarios + ": " + e.getMessage(), e);
      }
      LocalStorage storage = root == null ? LocalStorage.fromProperties() : new LocalStorage(Paths.get(root));
      ScenarioRunResult result;
      try {
         result = new ScenarioRunner().runFromFile(storage, diagram, list);
      } catch (NoSuchFileException e) {
         throw new CommandException("Diagram " + diagram + " not found in " + storage.root(), e);
      } catch (IOException | DiagramFormatException | IllegalArgumentException e) {
         throw new CommandException("Cannot simulate " + diagram + ": " + e.getMessage(), e);
      }
      if (output != null) {
         write(invocation, ResultJson.toJson(result), output);
         return CommandResult.SUCCESS;
      }
      invocation.println("Loaded " + result.loadedFilePath() + ", " + result.totalScenarios() + " scenario(s)");
      for (ScenarioResult scenario : result.results()) {
         invocation.println(String.format("%3d %-20s %s steps=%s actions=%s", scenario.stepNumber(), scenario.name(),
               scenario.success() ? "ok     " : "ignored", scenario.activeSteps(), scenario.activeActions()));
      }
      return CommandResult.SUCCESS;
   }
}
