package io.grafcet.core.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.grafcet.api.diagram.Connection;
import io.grafcet.api.diagram.Element;
import io.grafcet.api.diagram.Gate;
import io.grafcet.api.diagram.GateRole;
import io.grafcet.api.diagram.Orientation;
import io.grafcet.api.diagram.Point;
import io.grafcet.api.diagram.Segment;
import io.grafcet.core.dsl.DslParser;
import io.grafcet.core.parser.ParserException;
import io.grafcet.core.test.TestUtil;

public class LayoutCompilerTest {
   private final LayoutCompiler compiler = new LayoutCompiler(LayoutConstants.defaults());

   private CompilationContext layout(String file) throws ParserException {
      return compiler.compile(DslParser.parse(TestUtil.resource(file)));
   }

   @Test
   public void testLinearPlacement() throws ParserException {
      CompilationContext context = layout("charts/start-done.sfc");
      assertThat(context.element("step-0").position()).isEqualTo(new Point(114, 0));
      assertThat(context.element("transition-0").top()).isEqualTo(87);
      assertThat(context.element("step-1").top()).isEqualTo(140);
      assertThat(context.element("transition-1").top()).isEqualTo(227);
      // actions sit right of their step
      assertThat(context.element("action-0-0").position()).isEqualTo(new Point(164, 0));

      Connection first = (Connection) context.element("connection-0");
      assertThat(first.sourceId()).isEqualTo("step-0");
      assertThat(first.targetId()).isEqualTo("transition-0");
      assertThat(first.segments()).containsExactly(Segment.vertical(134, 40, 87));
   }

   @Test
   public void testJumpsArePending() throws ParserException {
      CompilationContext context = layout("charts/start-done.sfc");
      assertThat(context.pendingJumps()).hasSize(1);
      PendingJump jump = context.pendingJumps().get(0);
      assertThat(jump.sourceId()).isEqualTo("transition-1");
      assertThat(jump.targetNumber()).isEqualTo(0);
      assertThat(context.jumpsResolved()).isFalse();
      assertThatThrownBy(() -> context.build(null)).isInstanceOf(IllegalStateException.class);
   }

   @Test
   public void testAndDivergence() throws ParserException {
      CompilationContext context = layout("charts/parallel.sfc");
      // transition before an AND divergence uses the compressed gap
      assertThat(context.element("transition-0").top()).isEqualTo(65);

      Gate opening = (Gate) context.element("and-gate-0");
      assertThat(opening.role()).isEqualTo(GateRole.DIVERGENCE);
      assertThat(opening.branchCount()).isEqualTo(2);
      assertThat(opening.top()).isEqualTo(86);
      assertThat(opening.left()).isEqualTo(14);
      assertThat(opening.size().width()).isEqualTo(240);

      assertThat(context.element("step-1").position()).isEqualTo(new Point(14, 140));
      assertThat(context.element("step-2").position()).isEqualTo(new Point(214, 140));

      Gate closing = (Gate) context.element("and-gate-1");
      assertThat(closing.role()).isEqualTo(GateRole.CONVERGENCE);
      assertThat(closing.top()).isEqualTo(205);
      assertThat(context.element("transition-1").top()).isEqualTo(233);

      Connection toLeftLane = connection(context, "and-gate-0", "step-1");
      assertThat(toLeftLane.segments()).containsExactly(
            Segment.vertical(134, 94, 104),
            Segment.horizontal(104, 134, 34),
            Segment.vertical(34, 104, 140));
      Connection fromRightLane = connection(context, "step-2", "and-gate-1");
      assertThat(fromRightLane.end()).isEqualTo(new Point(134, 205));
   }

   @Test
   public void testOrDivergence() throws ParserException {
      CompilationContext context = layout("charts/selection.sfc");
      Gate opening = (Gate) context.element("or-gate-0");
      assertThat(opening.size().height()).isEqualTo(0);
      assertThat(opening.top()).isEqualTo(60);
      // both branches start with their transition
      assertThat(connection(context, "or-gate-0", "transition-0")).isNotNull();
      assertThat(connection(context, "or-gate-0", "transition-2")).isNotNull();
      assertThat(connection(context, "transition-1", "or-gate-1")).isNotNull();
      assertThat(connection(context, "or-gate-1", "step-3")).isNotNull();
   }

   @Test
   public void testConnectionsAreOrthogonalAndContinuous() throws ParserException {
      for (String file : List.of("charts/start-done.sfc", "charts/parallel.sfc", "charts/selection.sfc")) {
         CompilationContext context = layout(file);
         JumpResolver.resolveJumps(context);
         for (Element element : context.elements()) {
            if (!(element instanceof Connection)) {
               continue;
            }
            Connection connection = (Connection) element;
            for (Segment segment : connection.segments()) {
               if (segment.orientation() == Orientation.VERTICAL) {
                  assertThat(segment.from().x()).isEqualTo(segment.to().x());
               } else {
                  assertThat(segment.from().y()).isEqualTo(segment.to().y());
               }
            }
            Element target = context.element(connection.targetId());
            assertThat(connection.end()).as("%s in %s", connection, file).isEqualTo(new Point(target.centerX(), target.top()));
         }
      }
   }

   private static Connection connection(CompilationContext context, String sourceId, String targetId) {
      for (Element element : context.elements()) {
         if (element instanceof Connection) {
            Connection connection = (Connection) element;
            if (connection.sourceId().equals(sourceId) && connection.targetId().equals(targetId)) {
               return connection;
            }
         }
      }
      throw new AssertionError("No connection " + sourceId + " -> " + targetId);
   }
}
