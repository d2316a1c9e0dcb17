package io.grafcet.api.compiler;

import java.io.Serializable;
import java.util.Objects;

/**
 * Problem found while compiling a chart. Errors make the compilation fail, warnings are only reported.
 */
public final class Diagnostic implements Serializable {
   private final DiagnosticType type;
   private final Severity severity;
   private final String message;
   private final String element;
   private final int line;

   public Diagnostic(DiagnosticType type, Severity severity, String message, String element, int line) {
      this.type = Objects.requireNonNull(type);
      this.severity = Objects.requireNonNull(severity);
      this.message = message;
      this.element = element;
      this.line = line;
   }

   public static Diagnostic error(DiagnosticType type, String message, String element, int line) {
      return new Diagnostic(type, Severity.ERROR, message, element, line);
   }

   public static Diagnostic warning(DiagnosticType type, String message, String element, int line) {
      return new Diagnostic(type, Severity.WARNING, message, element, line);
   }

   public DiagnosticType type() {
      return type;
   }

   public Severity severity() {
      return severity;
   }

   public boolean isError() {
      return severity == Severity.ERROR;
   }

   public String message() {
      return message;
   }

   /**
    * @return Path of the offending statement (e.g. {@code main.divergence[2].branch[0]}) or an element id.
    */
   public String element() {
      return element;
   }

   /**
    * @return 1-based source line, or 0 when unknown.
    */
   public int line() {
      return line;
   }

   public String format() {
      StringBuilder sb = new StringBuilder(severity.name());
      if (element != null) {
         sb.append(" [").append(element).append(']');
      }
      if (line > 0) {
         sb.append(" (line ").append(line).append(')');
      }
      return sb.append(": ").append(message).toString();
   }

   @Override
   public String toString() {
      return type.tag() + ": " + format();
   }

   public enum Severity {
      ERROR,
      WARNING
   }
}
