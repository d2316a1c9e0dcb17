package io.grafcet.core.parser;

import org.yaml.snakeyaml.events.Event;

/**
 * Malformed input, located by 1-based line and column when known.
 */
public class ParserException extends Exception {
   private final int line;
   private final int column;

   public ParserException(String msg) {
      this(msg, null);
   }

   public ParserException(String msg, Throwable cause) {
      super(msg, cause);
      this.line = 0;
      this.column = 0;
   }

   public ParserException(int line, int column, String msg) {
      super(location(line, column).append(": ").append(msg).toString());
      this.line = line;
      this.column = column;
   }

   public ParserException(Event event, String msg) {
      this(event, msg, null);
   }

   public ParserException(Event event, String msg, Throwable cause) {
      super(location(event.getStartMark().getLine() + 1, event.getStartMark().getColumn() + 1).append(": ").append(msg).toString(), cause);
      this.line = event.getStartMark().getLine() + 1;
      this.column = event.getStartMark().getColumn() + 1;
   }

   static StringBuilder location(int line, int column) {
      return new StringBuilder("line ").append(line).append(", column ").append(column);
   }

   public int line() {
      return line;
   }

   public int column() {
      return column;
   }
}
