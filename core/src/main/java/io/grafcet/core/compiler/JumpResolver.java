package io.grafcet.core.compiler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.grafcet.api.compiler.Diagnostic;
import io.grafcet.api.compiler.DiagnosticType;
import io.grafcet.api.diagram.Connection;
import io.grafcet.api.diagram.Element;
import io.grafcet.api.diagram.Segment;
import io.grafcet.api.diagram.Step;

/**
 * Second compilation pass: turns every {@link PendingJump} into a connection once all steps have their final
 * position. Each jump is routed on its own track left of everything placed so far: down from the source,
 * left past the leftmost element, up to just above the target and right into the target.
 * <p>
 * Both horizontal runs are placed in a free corridor: a band of y values where no element lies between the
 * run's inner end and the track. A jump leaving a branch that has siblings on its left therefore drops
 * between the siblings' elements, never through them.
 */
public final class JumpResolver {
   private static final Logger log = LogManager.getLogger(JumpResolver.class);

   private JumpResolver() {
   }

   public static void resolveJumps(CompilationContext context) {
      LayoutConstants constants = context.constants();
      double leftmost = Double.POSITIVE_INFINITY;
      for (Element element : context.elements()) {
         if (!(element instanceof Connection)) {
            leftmost = Math.min(leftmost, element.left());
         }
      }
      if (leftmost == Double.POSITIVE_INFINITY) {
         leftmost = constants.startX();
      }
      double track = leftmost;
      for (PendingJump jump : context.pendingJumps()) {
         Step target = context.step(jump.targetNumber());
         if (target == null) {
            context.addDiagnostic(Diagnostic.error(DiagnosticType.DANGLING_REFERENCE,
                  "Jump target step " + jump.targetNumber() + " does not exist", jump.sourceId(), jump.line()));
            continue;
         }
         Element source = context.element(jump.sourceId());
         if (source == null) {
            throw new IllegalStateException("Jump source " + jump.sourceId() + " is not part of the diagram");
         }
         track -= constants.jumpMargin();
         double dropY = leaveY(context, source, target, track);
         double approachY = approachY(context, source, target, track);
         List<Segment> path = new ArrayList<>();
         path.add(Segment.vertical(source.centerX(), source.bottom(), dropY));
         ConnectionRouter.lineTo(path, track, dropY);
         ConnectionRouter.lineTo(path, track, approachY);
         ConnectionRouter.lineTo(path, target.centerX(), approachY);
         ConnectionRouter.lineTo(path, target.centerX(), target.top());
         context.add(new Connection(context.nextConnectionId(), source.id(), target.id(), path));
         log.trace("Resolved jump {} along x={}", jump, track);
      }
      context.markJumpsResolved();
   }

   private static double leaveY(CompilationContext context, Element source, Element target, double track) {
      LayoutConstants constants = context.constants();
      double x = source.centerX();
      double floor = Double.POSITIVE_INFINITY;
      List<double[]> blocked = new ArrayList<>();
      for (Element element : context.elements()) {
         if (element instanceof Connection || element == source) {
            continue;
         }
         if (element != target && element.left() < x && x < element.right() && element.top() >= source.bottom()) {
            // the drop below the source must stop above the next element in its column
            floor = Math.min(floor, element.top());
         }
         if (element.left() < x && track < element.right()) {
            blocked.add(new double[]{ element.top(), element.bottom() });
         }
      }
      return corridor(blocked, source.bottom(), floor, source.bottom() + constants.jumpDrop(), constants.jumpApproach(), source);
   }

   private static double approachY(CompilationContext context, Element source, Element target, double track) {
      LayoutConstants constants = context.constants();
      double x = target.centerX();
      double ceiling = Double.NEGATIVE_INFINITY;
      List<double[]> blocked = new ArrayList<>();
      for (Element element : context.elements()) {
         if (element instanceof Connection || element == target) {
            continue;
         }
         if (element != source && element.left() < x && x < element.right() && element.bottom() <= target.top()) {
            ceiling = Math.max(ceiling, element.bottom());
         }
         if (element.left() < x && track < element.right()) {
            blocked.add(new double[]{ element.top(), element.bottom() });
         }
      }
      return corridor(blocked, ceiling, target.top(), target.top() - constants.jumpApproach(), constants.jumpApproach(), target);
   }

   /**
    * Picks the y closest to {@code preferred} inside {@code (low, high)} that lies outside every blocked band.
    * Gaps wide enough to keep {@code clearance} on both sides win over narrower ones.
    */
   static double corridor(List<double[]> blocked, double low, double high, double preferred, double clearance, Element near) {
      blocked.sort(Comparator.comparingDouble(band -> band[0]));
      List<double[]> gaps = new ArrayList<>();
      double start = low;
      for (double[] band : blocked) {
         if (band[1] <= start) {
            continue;
         }
         if (band[0] >= high) {
            break;
         }
         if (band[0] > start) {
            gaps.add(new double[]{ start, band[0] });
         }
         start = Math.max(start, band[1]);
      }
      if (start < high) {
         gaps.add(new double[]{ start, high });
      }
      double best = Double.NaN;
      boolean bestWide = false;
      for (double[] gap : gaps) {
         boolean wide = gap[1] - gap[0] >= 2 * clearance;
         if (bestWide && !wide) {
            continue;
         }
         double margin = Math.min(clearance, (gap[1] - gap[0]) / 2);
         double y = Math.max(gap[0] + margin, Math.min(gap[1] - margin, preferred));
         if (Double.isNaN(best) || wide && !bestWide || Math.abs(y - preferred) < Math.abs(best - preferred)) {
            best = y;
            bestWide = wide;
         }
      }
      if (Double.isNaN(best)) {
         log.warn("No free corridor for the jump next to {}, routing through other elements", near.id());
         return preferred;
      }
      return best;
   }
}
