package io.grafcet.core.json;

/**
 * The document does not describe a diagram.
 */
public class DiagramFormatException extends RuntimeException {
   public DiagramFormatException(String message) {
      super(message);
   }

   public DiagramFormatException(String message, Throwable cause) {
      super(message, cause);
   }
}
