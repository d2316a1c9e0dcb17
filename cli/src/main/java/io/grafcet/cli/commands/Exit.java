package io.grafcet.cli.commands;

import org.aesh.command.Command;
import org.aesh.command.CommandDefinition;
import org.aesh.command.CommandResult;
import org.aesh.command.invocation.CommandInvocation;

@CommandDefinition(name = "exit", description = "exit the program", aliases = { "quit" })
public class Exit implements Command<CommandInvocation> {
   @Override
   public CommandResult execute(CommandInvocation invocation) {
      invocation.stop();
      return CommandResult.SUCCESS;
   }
}
