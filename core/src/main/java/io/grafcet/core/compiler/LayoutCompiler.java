package io.grafcet.core.compiler;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.grafcet.api.diagram.ActionBlock;
import io.grafcet.api.diagram.Connection;
import io.grafcet.api.diagram.Element;
import io.grafcet.api.diagram.Gate;
import io.grafcet.api.diagram.GateRole;
import io.grafcet.api.diagram.GateType;
import io.grafcet.api.diagram.Point;
import io.grafcet.api.diagram.Size;
import io.grafcet.api.diagram.Step;
import io.grafcet.api.diagram.Transition;
import io.grafcet.core.dsl.ActionStatement;
import io.grafcet.core.dsl.Branch;
import io.grafcet.core.dsl.DivergenceStatement;
import io.grafcet.core.dsl.JumpStatement;
import io.grafcet.core.dsl.ParserInput;
import io.grafcet.core.dsl.Statement;
import io.grafcet.core.dsl.StepStatement;
import io.grafcet.core.dsl.TransitionStatement;

/**
 * Forward layout pass. Walks the statements top to bottom with a vertical cursor per lane, places every element
 * and links consecutive elements with orthogonal connections. Jumps are only recorded as {@link PendingJump}s;
 * run the {@link JumpResolver} on the returned context before building the diagram.
 */
public class LayoutCompiler {
   private static final Logger log = LogManager.getLogger(LayoutCompiler.class);

   private final LayoutConstants constants;

   public LayoutCompiler() {
      this(LayoutConstants.fromProperties());
   }

   public LayoutCompiler(LayoutConstants constants) {
      this.constants = constants;
   }

   public CompilationContext compile(ParserInput input) {
      CompilationContext context = new CompilationContext(constants, input.title());
      Cursor cursor = new Cursor(constants.startX(), constants.startY());
      layoutSequence(context, input.sequence(), cursor);
      log.debug("Laid out {} elements with {} pending jump(s)", context.elements().size(), context.pendingJumps().size());
      return context;
   }

   private void layoutSequence(CompilationContext context, List<Statement> statements, Cursor cursor) {
      for (int i = 0; i < statements.size(); ++i) {
         Statement statement = statements.get(i);
         Statement next = i + 1 < statements.size() ? statements.get(i + 1) : null;
         switch (statement.kind()) {
            case STEP:
               placeStep(context, (StepStatement) statement, cursor);
               break;
            case TRANSITION:
               boolean compressed = cursor.previous == Slot.STEP
                     && next instanceof DivergenceStatement && ((DivergenceStatement) next).isAnd();
               placeTransition(context, (TransitionStatement) statement, cursor, compressed);
               break;
            case JUMP:
               JumpStatement jump = (JumpStatement) statement;
               if (cursor.previousId != null) {
                  context.addPendingJump(new PendingJump(cursor.previousId, jump.target(), jump.line()));
               }
               cursor.bottom += constants.jumpDrop();
               cursor.previous = Slot.JUMP;
               cursor.previousId = null;
               context.advanceTo(cursor.bottom);
               break;
            case DIVERGENCE:
               layoutDivergence(context, (DivergenceStatement) statement, cursor);
               break;
            default:
               throw new IllegalStateException("Unexpected statement " + statement);
         }
      }
   }

   private void placeStep(CompilationContext context, StepStatement statement, Cursor cursor) {
      double top = top(cursor, Slot.STEP, false);
      String id = "step-" + statement.number();
      List<String> actionIds = new ArrayList<>();
      List<ActionBlock> actions = new ArrayList<>();
      double actionX = cursor.x + constants.stepWidth() / 2 + constants.actionGap();
      for (int i = 0; i < statement.actions().size(); ++i) {
         ActionStatement action = statement.actions().get(i);
         String actionId = "action-" + statement.number() + "-" + i;
         actionIds.add(actionId);
         actions.add(new ActionBlock(actionId, id, action.label(), action.qualifier(), action.condition(), action.duration(),
               action.isTemporal(), i, new Point(actionX + i * constants.actionWidth(), top),
               new Size(constants.actionWidth(), constants.actionHeight())));
      }
      Step step = new Step(id, statement.number(), statement.label(), statement.stepType(),
            new Point(cursor.x - constants.stepWidth() / 2, top), new Size(constants.stepWidth(), constants.stepHeight()), actionIds);
      context.add(step);
      actions.forEach(context::add);
      connect(context, cursor, step);
      cursor.moveTo(Slot.STEP, step);
      context.advanceTo(step.bottom());
   }

   private void placeTransition(CompilationContext context, TransitionStatement statement, Cursor cursor, boolean compressed) {
      double top = top(cursor, Slot.TRANSITION, compressed);
      int number = context.nextTransitionNumber();
      Transition transition = new Transition("transition-" + number, number, statement.condition(),
            new Point(cursor.x - constants.transitionWidth() / 2, top),
            new Size(constants.transitionWidth(), constants.transitionHeight()));
      context.add(transition);
      connect(context, cursor, transition);
      cursor.moveTo(Slot.TRANSITION, transition);
      context.advanceTo(transition.bottom());
   }

   private void layoutDivergence(CompilationContext context, DivergenceStatement divergence, Cursor cursor) {
      GateType type = divergence.gateType();
      boolean and = divergence.isAnd();
      List<Branch> branches = divergence.branches();
      int n = branches.size();
      double[] lanes = new double[n];
      for (int i = 0; i < n; ++i) {
         lanes[i] = cursor.x - (n - 1) * constants.branchSpacing() / 2 + i * constants.branchSpacing();
      }

      double top = top(cursor, and ? Slot.AND_DIVERGENCE : Slot.OR_DIVERGENCE, false);
      Gate opening = gate(context, type, GateRole.DIVERGENCE, n, lanes, cursor.x, top);
      context.add(opening);
      connect(context, cursor, opening);
      context.advanceTo(opening.bottom());

      List<Cursor> ends = new ArrayList<>();
      double lowest = opening.bottom();
      for (int i = 0; i < n; ++i) {
         Cursor lane = new Cursor(lanes[i], opening.bottom());
         lane.previous = and ? Slot.AND_DIVERGENCE : Slot.OR_DIVERGENCE;
         lane.previousId = opening.id();
         lane.anchorX = opening.centerX();
         lane.turnY = opening.bottom() + constants.busOffset();
         layoutSequence(context, branches.get(i).statements(), lane);
         ends.add(lane);
         lowest = Math.max(lowest, lane.bottom);
      }

      if (ends.stream().noneMatch(end -> end.previousId != null)) {
         // every branch left through a jump
         cursor.bottom = lowest;
         cursor.previous = Slot.JUMP;
         cursor.previousId = null;
         return;
      }
      double convergenceTop = lowest + (and ? constants.andConvergenceGap() : constants.orConvergenceGap());
      Gate closing = gate(context, type, GateRole.CONVERGENCE, n, lanes, cursor.x, convergenceTop);
      context.add(closing);
      for (Cursor end : ends) {
         if (end.previousId == null) {
            continue;
         }
         end.turnY = closing.top() - constants.busOffset();
         connect(context, end, closing);
      }
      cursor.moveTo(and ? Slot.AND_CONVERGENCE : Slot.OR_CONVERGENCE, closing);
      context.advanceTo(closing.bottom());
   }

   private Gate gate(CompilationContext context, GateType type, GateRole role, int branchCount, double[] lanes, double x, double top) {
      double left = x;
      double right = x;
      for (double lane : lanes) {
         left = Math.min(left, lane);
         right = Math.max(right, lane);
      }
      left -= constants.gateMargin();
      right += constants.gateMargin();
      double height = type == GateType.AND ? constants.andGateHeight() : constants.orGateHeight();
      return new Gate(context.nextGateId(type), type, role, branchCount, new Point(left, top), new Size(right - left, height));
   }

   private void connect(CompilationContext context, Cursor from, Element target) {
      if (from.previousId == null) {
         return;
      }
      double turnY = Double.isNaN(from.turnY) ? (from.bottom + target.top()) / 2 : from.turnY;
      context.add(new Connection(context.nextConnectionId(), from.previousId, target.id(),
            ConnectionRouter.route(from.anchorX, from.bottom, target.centerX(), target.top(), turnY)));
   }

   private double top(Cursor cursor, Slot next, boolean compressed) {
      if (cursor.previous == Slot.NONE) {
         return cursor.bottom;
      }
      return cursor.bottom + gap(cursor.previous, next, compressed);
   }

   private double gap(Slot previous, Slot next, boolean compressed) {
      switch (previous) {
         case STEP:
            if (next == Slot.TRANSITION) {
               return compressed ? constants.stepToTransitionCompressed() : constants.stepToTransition();
            } else if (next == Slot.OR_DIVERGENCE) {
               return constants.stepToOrGate();
            }
            return constants.stepToTransition();
         case TRANSITION:
            return next == Slot.AND_DIVERGENCE ? constants.transitionToAndGate() : constants.transitionToStep();
         case AND_DIVERGENCE:
            return constants.andGateToStep();
         case OR_DIVERGENCE:
            return constants.orGateToTransition();
         case AND_CONVERGENCE:
            return constants.andConvergenceToTransition();
         case OR_CONVERGENCE:
            return constants.orConvergenceToStep();
         default:
            return constants.transitionToStep();
      }
   }

   private enum Slot {
      NONE,
      STEP,
      TRANSITION,
      AND_DIVERGENCE,
      OR_DIVERGENCE,
      AND_CONVERGENCE,
      OR_CONVERGENCE,
      JUMP
   }

   private static final class Cursor {
      final double x;
      double bottom;
      Slot previous = Slot.NONE;
      String previousId;
      double anchorX;
      double turnY = Double.NaN;

      Cursor(double x, double bottom) {
         this.x = x;
         this.bottom = bottom;
         this.anchorX = x;
      }

      void moveTo(Slot slot, Element element) {
         previous = slot;
         previousId = element.id();
         bottom = element.bottom();
         anchorX = element.centerX();
         turnY = Double.NaN;
      }
   }
}
