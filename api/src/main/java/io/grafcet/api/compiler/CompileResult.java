package io.grafcet.api.compiler;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import io.grafcet.api.diagram.GrafcetDiagram;

public final class CompileResult implements Serializable {
   private final GrafcetDiagram diagram;
   private final String error;
   private final List<Diagnostic> details;

   private CompileResult(GrafcetDiagram diagram, String error, List<Diagnostic> details) {
      this.diagram = diagram;
      this.error = error;
      this.details = Collections.unmodifiableList(details);
   }

   public static CompileResult success(GrafcetDiagram diagram, List<Diagnostic> warnings) {
      return new CompileResult(diagram, null, warnings);
   }

   public static CompileResult failure(List<Diagnostic> details) {
      return new CompileResult(null, format(details), details);
   }

   public static String format(List<Diagnostic> diagnostics) {
      if (diagnostics.isEmpty()) {
         return "No validation errors";
      }
      return diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining("\n"));
   }

   public boolean isSuccess() {
      return diagram != null;
   }

   /**
    * @return The finished diagram; {@code null} on failure.
    */
   public GrafcetDiagram generatedSFC() {
      return diagram;
   }

   public String error() {
      return error;
   }

   /**
    * @return All diagnostics on failure, the warnings on success.
    */
   public List<Diagnostic> details() {
      return details;
   }

   public List<Diagnostic> errors() {
      return details.stream().filter(Diagnostic::isError).collect(Collectors.toList());
   }
}
