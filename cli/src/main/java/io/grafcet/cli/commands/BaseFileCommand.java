package io.grafcet.cli.commands;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.aesh.command.Command;
import org.aesh.command.CommandException;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.io.Resource;

import io.vertx.core.json.JsonObject;

public abstract class BaseFileCommand implements Command<CommandInvocation> {

   protected String read(Resource resource) throws CommandException {
      if (!resource.exists()) {
         throw new CommandException("File " + resource + " does not exist");
      }
      try (InputStream stream = resource.read()) {
         return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
      } catch (FileNotFoundException e) {
         throw new CommandException("Couldn't find file " + resource, e);
      } catch (IOException e) {
         throw new CommandException("Cannot read " + resource + ": " + e.getMessage(), e);
      }
   }

   /**
    * Prints the document when {@code output} is not set, otherwise writes it into that file.
    */
   protected void write(CommandInvocation invocation, JsonObject document, String output) throws CommandException {
      String text = document.encodePrettily();
      if (output == null) {
         invocation.println(text);
         return;
      }
      Path file = Paths.get(output);
      try {
         if (file.toAbsolutePath().getParent() != null) {
            Files.createDirectories(file.toAbsolutePath().getParent());
         }
         Files.write(file, text.getBytes(StandardCharsets.UTF_8));
      } catch (IOException e) {
         throw new CommandException("Failed to write " + output + ": " + e.getMessage(), e);
      }
      invocation.println("Written to " + file.toAbsolutePath());
   }
}
