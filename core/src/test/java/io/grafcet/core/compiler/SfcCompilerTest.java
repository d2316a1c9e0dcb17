package io.grafcet.core.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.grafcet.api.compiler.CompileResult;
import io.grafcet.api.compiler.Diagnostic;
import io.grafcet.api.compiler.DiagnosticType;
import io.grafcet.api.diagram.Connection;
import io.grafcet.api.diagram.Element;
import io.grafcet.api.diagram.GrafcetDiagram;
import io.grafcet.api.diagram.Step;
import io.grafcet.api.diagram.StepType;
import io.grafcet.api.diagram.Transition;
import io.grafcet.core.test.TestUtil;

public class SfcCompilerTest {
   private final SfcCompiler compiler = new SfcCompiler(LayoutConstants.defaults());

   @Test
   public void testCompileLinearChart() {
      CompileResult result = compiler.compile(TestUtil.resource("charts/start-done.sfc"), null);
      assertThat(result.isSuccess()).isTrue();
      assertThat(result.error()).isNull();
      GrafcetDiagram diagram = result.generatedSFC();
      assertThat(diagram.title()).isEqualTo("Start and stop");
      assertThat(diagram.version()).isEqualTo(GrafcetDiagram.CURRENT_VERSION);
      assertThat(diagram.id()).isNotBlank();
      assertThat(diagram.steps()).extracting(Step::id).containsExactly("step-0", "step-1");
      assertThat(diagram.initialSteps()).extracting(Step::stepType).containsExactly(StepType.INITIAL);
      assertThat(diagram.actionsOf(diagram.stepByNumber(0))).hasSize(1);
      assertThat(diagram.transitions()).hasSize(2);
      assertThat(diagram.connections()).hasSize(4);
   }

   @Test
   public void testTitleOverride() {
      CompileResult result = compiler.compile(TestUtil.resource("charts/start-done.sfc"), "Conveyor");
      assertThat(result.generatedSFC().title()).isEqualTo("Conveyor");
      assertThat(compiler.compile("Step 0 (Initial)\nTransition a\nStep 1", " ").generatedSFC().title()).isEqualTo("Untitled");
   }

   @Test
   public void testNoDanglingConnections() {
      for (String file : new String[]{ "charts/start-done.sfc", "charts/parallel.sfc", "charts/selection.sfc" }) {
         GrafcetDiagram diagram = TestUtil.compileResource(file);
         assertThat(diagram.danglingConnections()).as(file).isEmpty();
         Set<String> ids = new HashSet<>();
         for (Element element : diagram.elements()) {
            assertThat(ids.add(element.id())).as("duplicate id %s", element.id()).isTrue();
         }
         // every step and transition is linked both ways
         for (Element element : diagram.elements()) {
            if (element instanceof Step || element instanceof Transition) {
               assertThat(diagram.incoming(element.id())).as("incoming of %s in %s", element.id(), file).isNotEmpty();
               assertThat(diagram.outgoing(element.id())).as("outgoing of %s in %s", element.id(), file).isNotEmpty();
            }
         }
         for (Connection connection : diagram.connections()) {
            assertThat(diagram.contains(connection.sourceId())).isTrue();
            assertThat(diagram.contains(connection.targetId())).isTrue();
         }
      }
   }

   @Test
   public void testAndBranchEndingInTransition() {
      CompileResult result = compiler.compile("Step 0 (Initial)\nTransition go\nDivergence AND\n"
            + "Branch\nStep 1\nTransition x\nEndBranch\n"
            + "Branch\nStep 2\nEndBranch\nEndDivergence\nTransition ready\nStep 3", null);
      assertThat(result.isSuccess()).isFalse();
      assertThat(result.generatedSFC()).isNull();
      assertThat(result.errors()).extracting(Diagnostic::type).containsExactly(DiagnosticType.AND_DIVERGENCE);
      assertThat(result.error()).contains("must end with a Step");
   }

   @Test
   public void testSyntaxError() {
      CompileResult result = compiler.compile("Step 0 (Initial)\nTransitoin a", null);
      assertThat(result.isSuccess()).isFalse();
      Diagnostic diagnostic = result.errors().get(0);
      assertThat(diagnostic.type()).isEqualTo(DiagnosticType.SYNTAX);
      assertThat(diagnostic.line()).isEqualTo(2);
   }

   @Test
   public void testDanglingJump() {
      CompileResult result = compiler.compile("Step 0 (Initial)\nTransition a\nStep 1\nTransition b\nJump 9", null);
      assertThat(result.isSuccess()).isFalse();
      assertThat(result.errors()).extracting(Diagnostic::type).containsExactly(DiagnosticType.DANGLING_REFERENCE);
   }

   @Test
   public void testWarningsDoNotFailCompilation() {
      CompileResult result = compiler.compile("Step 0 (Initial)\nTransition go\nStep 1\nTransition go\nJump 0", null);
      assertThat(result.isSuccess()).isTrue();
      assertThat(result.details()).extracting(Diagnostic::type).containsExactly(DiagnosticType.AMBIGUOUS_LABEL);
      assertThat(result.errors()).isEmpty();
   }
}
