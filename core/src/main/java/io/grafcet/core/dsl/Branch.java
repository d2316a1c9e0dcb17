package io.grafcet.core.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Branch {
   private final int line;
   private final List<Statement> statements = new ArrayList<>();

   Branch(int line) {
      this.line = line;
   }

   public int line() {
      return line;
   }

   public List<Statement> statements() {
      return Collections.unmodifiableList(statements);
   }

   List<Statement> mutableStatements() {
      return statements;
   }
}
