package io.grafcet.core.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed chart before layout: the top-level statement sequence with divergences nesting their branches.
 */
public class ParserInput {
   private final String title;
   private final List<Statement> sequence;

   public ParserInput(String title, List<Statement> sequence) {
      this.title = title;
      this.sequence = Collections.unmodifiableList(new ArrayList<>(sequence));
   }

   /**
    * @return Title from the {@code SFC} header line, or {@code null}.
    */
   public String title() {
      return title;
   }

   public List<Statement> sequence() {
      return sequence;
   }

   /**
    * @return Every step statement, nested ones included, in declaration order.
    */
   public List<StepStatement> allSteps() {
      List<StepStatement> steps = new ArrayList<>();
      collectSteps(sequence, steps);
      return steps;
   }

   private static void collectSteps(List<Statement> statements, List<StepStatement> steps) {
      for (Statement statement : statements) {
         if (statement instanceof StepStatement) {
            steps.add((StepStatement) statement);
         } else if (statement instanceof DivergenceStatement) {
            for (Branch branch : ((DivergenceStatement) statement).branches()) {
               collectSteps(branch.statements(), steps);
            }
         }
      }
   }
}
