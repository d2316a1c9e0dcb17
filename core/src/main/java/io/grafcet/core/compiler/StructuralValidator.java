package io.grafcet.core.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.grafcet.api.compiler.Diagnostic;
import io.grafcet.api.compiler.DiagnosticType;
import io.grafcet.api.diagram.StepType;
import io.grafcet.core.dsl.Branch;
import io.grafcet.core.dsl.DivergenceStatement;
import io.grafcet.core.dsl.JumpStatement;
import io.grafcet.core.dsl.ParserInput;
import io.grafcet.core.dsl.Statement;
import io.grafcet.core.dsl.StepStatement;
import io.grafcet.core.dsl.TransitionStatement;

/**
 * Checks well-formedness of the parsed chart before it is laid out. Offending statements are identified by their
 * path, e.g. {@code main.divergence[3].branch[1][0]} is the first statement of the second branch of the
 * divergence at index 3 of the main sequence.
 */
public class StructuralValidator {

   public List<Diagnostic> validate(ParserInput input) {
      List<Diagnostic> diagnostics = new ArrayList<>();
      validateSequence(input.sequence(), "main", null, diagnostics);
      if (input.allSteps().stream().noneMatch(step -> step.stepType() == StepType.INITIAL)) {
         diagnostics.add(Diagnostic.error(DiagnosticType.INITIAL_STEP,
               "The chart has no initial step; declare one as 'Step <n> (Initial)'", "main", 0));
      }
      checkLabels(input.sequence(), "main", new HashMap<>(), diagnostics);
      return diagnostics;
   }

   private Flow validateSequence(List<Statement> statements, String path, Flow entry, List<Diagnostic> diagnostics) {
      Flow previous = entry;
      for (int i = 0; i < statements.size(); ++i) {
         Statement statement = statements.get(i);
         String at = path + "[" + i + "]";
         switch (statement.kind()) {
            case STEP:
               if (previous == Flow.STEP) {
                  String what = i > 0 && statements.get(i - 1) instanceof DivergenceStatement ? "an AND convergence" : "another step";
                  diagnostics.add(Diagnostic.error(DiagnosticType.SEQUENCE,
                        statement + " directly follows " + what + "; a Transition is required in between", at, statement.line()));
               }
               previous = Flow.STEP;
               break;
            case TRANSITION:
               if (previous == Flow.TRANSITION) {
                  String what = i > 0 && statements.get(i - 1) instanceof DivergenceStatement ? "an OR convergence" : "another transition";
                  diagnostics.add(Diagnostic.error(DiagnosticType.SEQUENCE,
                        statement + " directly follows " + what + "; a Step is required in between", at, statement.line()));
               }
               previous = Flow.TRANSITION;
               break;
            case JUMP:
               if (previous != Flow.TRANSITION) {
                  diagnostics.add(Diagnostic.error(DiagnosticType.SEQUENCE,
                        statement + " must follow a Transition", at, statement.line()));
               }
               if (i != statements.size() - 1) {
                  diagnostics.add(Diagnostic.error(DiagnosticType.SEQUENCE,
                        statement + " must be the last statement of its sequence", at, statement.line()));
               }
               previous = Flow.TRANSITION;
               break;
            case DIVERGENCE:
               previous = validateDivergence((DivergenceStatement) statement, path + ".divergence[" + i + "]", previous, diagnostics);
               break;
            default:
               throw new IllegalStateException("Unexpected statement " + statement);
         }
      }
      return previous;
   }

   private Flow validateDivergence(DivergenceStatement divergence, String path, Flow previous, List<Diagnostic> diagnostics) {
      boolean and = divergence.isAnd();
      DiagnosticType type = and ? DiagnosticType.AND_DIVERGENCE : DiagnosticType.OR_DIVERGENCE;
      String name = and ? "AND divergence" : "OR divergence";
      if (and && previous != Flow.TRANSITION) {
         diagnostics.add(Diagnostic.error(type, name + " must be preceded by a Transition", path, divergence.line()));
      } else if (!and && previous != Flow.STEP) {
         diagnostics.add(Diagnostic.error(type, name + " must be preceded by a Step", path, divergence.line()));
      }
      List<Branch> branches = divergence.branches();
      if (branches.size() < 2) {
         diagnostics.add(Diagnostic.error(type, name + " needs at least two branches, found " + branches.size(), path, divergence.line()));
      }
      for (int j = 0; j < branches.size(); ++j) {
         Branch branch = branches.get(j);
         String branchPath = path + ".branch[" + j + "]";
         List<Statement> statements = branch.statements();
         if (statements.isEmpty()) {
            diagnostics.add(Diagnostic.error(type, "Branch " + j + " of the " + name + " is empty", branchPath, branch.line()));
            continue;
         }
         Statement first = statements.get(0);
         Statement last = statements.get(statements.size() - 1);
         if (and) {
            if (!(first instanceof StepStatement)) {
               diagnostics.add(Diagnostic.error(type, "Branch " + j + " of the AND divergence must start with a Step, found " + first,
                     branchPath, first.line()));
            }
            if (!(last instanceof StepStatement)) {
               diagnostics.add(Diagnostic.error(type, "Branch " + j + " of the AND divergence must end with a Step before the convergence, found " + last,
                     branchPath, last.line()));
            }
         } else {
            if (!(first instanceof TransitionStatement)) {
               diagnostics.add(Diagnostic.error(type, "Branch " + j + " of the OR divergence must start with a Transition, found " + first,
                     branchPath, first.line()));
            }
            Statement end = last;
            if (last instanceof JumpStatement && statements.size() > 1) {
               end = statements.get(statements.size() - 2);
            }
            if (!(end instanceof TransitionStatement)) {
               diagnostics.add(Diagnostic.error(type, "Branch " + j + " of the OR divergence must end with a Transition, found " + last,
                     branchPath, last.line()));
            }
         }
         validateSequence(statements, branchPath, null, diagnostics);
      }
      return and ? Flow.STEP : Flow.TRANSITION;
   }

   private void checkLabels(List<Statement> statements, String path, Map<String, String> seen, List<Diagnostic> diagnostics) {
      for (int i = 0; i < statements.size(); ++i) {
         Statement statement = statements.get(i);
         if (statement instanceof TransitionStatement) {
            String label = ((TransitionStatement) statement).condition();
            String at = path + "[" + i + "]";
            String other = seen.putIfAbsent(label, at);
            if (other != null) {
               diagnostics.add(Diagnostic.warning(DiagnosticType.AMBIGUOUS_LABEL,
                     "Transition label '" + label + "' is also used at " + other + "; a direct trigger by this label applies to both",
                     at, statement.line()));
            }
         } else if (statement instanceof DivergenceStatement) {
            List<Branch> branches = ((DivergenceStatement) statement).branches();
            for (int j = 0; j < branches.size(); ++j) {
               checkLabels(branches.get(j).statements(), path + ".divergence[" + i + "].branch[" + j + "]", seen, diagnostics);
            }
         }
      }
   }

   private enum Flow {
      STEP,
      TRANSITION
   }
}
