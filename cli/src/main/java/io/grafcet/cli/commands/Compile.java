package io.grafcet.cli.commands;

import org.aesh.command.CommandDefinition;
import org.aesh.command.CommandException;
import org.aesh.command.CommandResult;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Argument;
import org.aesh.command.option.Option;
import org.aesh.io.Resource;
import org.aesh.terminal.utils.ANSI;

import io.grafcet.api.compiler.CompileResult;
import io.grafcet.api.compiler.Diagnostic;
import io.grafcet.core.compiler.SfcCompiler;
import io.grafcet.core.json.DiagramCodec;
import io.grafcet.core.json.ResultJson;
import io.vertx.core.json.JsonObject;

@CommandDefinition(name = "compile", description = "Compiles chart source into a diagram document.")
public class Compile extends BaseFileCommand {
   @Option(shortName = 'h', hasValue = false, overrideRequired = true)
   boolean help;

   @Option(shortName = 't', description = "Diagram title, overrides the SFC header")
   String title;

   @Option(shortName = 'o', description = "File the diagram is written to; printed when not set")
   String output;

   @Option(name = "json", hasValue = false, description = "Print diagnostics as JSON")
   boolean json;

   @Argument(description = "Chart source file", required = true)
   Resource source;

   @Override
   public CommandResult execute(CommandInvocation invocation) throws CommandException {
      if (help) {
         invocation.println(invocation.getHelpInfo("compile"));
         return CommandResult.SUCCESS;
      }
      CompileResult result = new SfcCompiler().compile(read(source), title);
      if (json) {
         if (!result.details().isEmpty()) {
            invocation.println(ResultJson.toJson(result.details()).encodePrettily());
         }
      } else {
         for (Diagnostic diagnostic : result.details()) {
            String prefix = diagnostic.isError() ? ANSI.RED_TEXT + "error" : ANSI.YELLOW_TEXT + "warning";
            invocation.println(prefix + ANSI.RESET + ": " + diagnostic.format());
         }
      }
      if (!result.isSuccess()) {
         throw new CommandException("Compilation of " + source + " failed with " + result.errors().size() + " error(s)");
      }
      JsonObject document = DiagramCodec.toJson(result.generatedSFC());
      write(invocation, document, output);
      return CommandResult.SUCCESS;
   }
}
