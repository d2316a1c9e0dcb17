package io.grafcet.cli;

import java.util.Arrays;
import java.util.List;

import org.aesh.AeshConsoleRunner;
import org.aesh.command.AeshCommandRuntimeBuilder;
import org.aesh.command.Command;
import org.aesh.command.CommandNotFoundException;
import org.aesh.command.CommandRuntime;
import org.aesh.command.impl.registry.AeshCommandRegistryBuilder;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.registry.CommandRegistry;
import org.aesh.command.registry.CommandRegistryException;
import org.aesh.command.settings.Settings;
import org.aesh.command.settings.SettingsBuilder;
import org.aesh.readline.Prompt;
import org.aesh.readline.terminal.formatting.Color;
import org.aesh.readline.terminal.formatting.TerminalColor;
import org.aesh.readline.terminal.formatting.TerminalString;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.grafcet.cli.commands.Compile;
import io.grafcet.cli.commands.Exit;
import io.grafcet.cli.commands.Simulate;

/**
 * Without arguments starts an interactive console; otherwise executes the arguments as a single command,
 * e.g. {@code compile chart.sfc --output chart.json}.
 */
public class GrafcetCli {
   private static final Logger log = LogManager.getLogger(GrafcetCli.class);

   public static final String CLI_PROMPT = "CLI_PROMPT";

   public static void main(String[] args) throws CommandRegistryException {
      GrafcetCli cli = new GrafcetCli();
      if (args.length == 0) {
         cli.run();
      } else if (!cli.execute(args)) {
         System.exit(1);
      }
   }

   public void run() throws CommandRegistryException {
      Settings settings = SettingsBuilder.builder()
            .logging(true)
            .enableMan(false)
            .enableAlias(false)
            .enableExport(false)
            .readInputrc(true)
            .commandRegistry(commandRegistry())
            .build();
      AeshConsoleRunner runner = AeshConsoleRunner.builder().settings(settings);
      String cliPrompt = System.getenv(CLI_PROMPT);
      if (cliPrompt == null) {
         runner.prompt(new Prompt(new TerminalString("[grafcet]$ ",
               new TerminalColor(Color.GREEN, Color.DEFAULT, Color.Intensity.BRIGHT))));
      } else {
         runner.prompt(new Prompt(cliPrompt));
      }
      runner.start();
   }

   /**
    * @return {@code false} when the command could not be found, parsed or completed.
    */
   public boolean execute(String[] args) throws CommandRegistryException {
      CommandRuntime runtime = AeshCommandRuntimeBuilder.builder()
            .commandRegistry(commandRegistry())
            .build();
      StringBuilder sb = new StringBuilder();
      for (String arg : args) {
         if (arg.indexOf(' ') >= 0) {
            sb.append('"').append(arg).append("\" ");
         } else {
            sb.append(arg).append(' ');
         }
      }
      String line = sb.toString().trim();
      try {
         runtime.executeCommand(line);
         return true;
      } catch (CommandNotFoundException e) {
         System.err.println("Command not found: " + args[0]);
         System.err.println("Available commands: compile, simulate");
      } catch (Exception e) {
         log.debug("Command '{}' failed", line, e);
         System.err.println("Failed to execute command: " + e.getMessage());
      }
      return false;
   }

   @SuppressWarnings("unchecked")
   private CommandRegistry<CommandInvocation> commandRegistry() throws CommandRegistryException {
      AeshCommandRegistryBuilder<CommandInvocation> builder = AeshCommandRegistryBuilder.builder();
      for (Class<? extends Command> command : getCommands()) {
         builder.command(command);
      }
      return builder.create();
   }

   protected List<Class<? extends Command>> getCommands() {
      return Arrays.asList(
            Compile.class,
            Exit.class,
            Simulate.class
      );
   }
}
