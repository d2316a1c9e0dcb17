package io.grafcet.core.compiler;

import io.grafcet.internal.Properties;

/**
 * Sizes and spacings used by the {@link LayoutCompiler}. All distances are in diagram units;
 * every value can be overridden through {@code io.grafcet.layout.<key>}.
 */
public final class LayoutConstants {
   private final double startX;
   private final double startY;
   private final double stepWidth;
   private final double stepHeight;
   private final double transitionWidth;
   private final double transitionHeight;
   private final double actionWidth;
   private final double actionHeight;
   private final double actionGap;
   private final double andGateHeight;
   private final double orGateHeight;
   private final double gateMargin;
   private final double branchSpacing;
   private final double stepToTransition;
   private final double stepToTransitionCompressed;
   private final double transitionToStep;
   private final double transitionToAndGate;
   private final double stepToOrGate;
   private final double andGateToStep;
   private final double orGateToTransition;
   private final double andConvergenceGap;
   private final double andConvergenceToTransition;
   private final double orConvergenceGap;
   private final double orConvergenceToStep;
   private final double busOffset;
   private final double jumpMargin;
   private final double jumpDrop;
   private final double jumpApproach;

   private LayoutConstants(Lookup lookup) {
      startX = lookup.get("start.x", 134);
      startY = lookup.get("start.y", 0);
      stepWidth = lookup.get("step.width", 40);
      stepHeight = lookup.get("step.height", 40);
      transitionWidth = lookup.get("transition.width", 40);
      transitionHeight = lookup.get("transition.height", 6);
      actionWidth = lookup.get("action.width", 120);
      actionHeight = lookup.get("action.height", 40);
      actionGap = lookup.get("action.gap", 10);
      andGateHeight = lookup.get("gate.and.height", 8);
      orGateHeight = lookup.get("gate.or.height", 0);
      gateMargin = lookup.get("gate.margin", 20);
      branchSpacing = lookup.get("branch.spacing", 200);
      stepToTransition = lookup.get("gap.step-transition", 47);
      stepToTransitionCompressed = lookup.get("gap.step-transition.compressed", 25);
      transitionToStep = lookup.get("gap.transition-step", 47);
      transitionToAndGate = lookup.get("gap.transition-and-gate", 15);
      stepToOrGate = lookup.get("gap.step-or-gate", 20);
      andGateToStep = lookup.get("gap.and-gate-step", 46);
      orGateToTransition = lookup.get("gap.or-gate-transition", 27);
      andConvergenceGap = lookup.get("gap.and-convergence", 25);
      andConvergenceToTransition = lookup.get("gap.and-convergence-transition", 20);
      orConvergenceGap = lookup.get("gap.or-convergence", 20);
      orConvergenceToStep = lookup.get("gap.or-convergence-step", 47);
      busOffset = lookup.get("bus.offset", 10);
      jumpMargin = lookup.get("jump.margin", 100);
      jumpDrop = lookup.get("jump.drop", 40);
      jumpApproach = lookup.get("jump.approach", 20);
   }

   public static LayoutConstants defaults() {
      return new LayoutConstants((key, def) -> def);
   }

   public static LayoutConstants fromProperties() {
      return new LayoutConstants((key, def) -> Properties.getDouble(Properties.LAYOUT_PREFIX + key, def));
   }

   /**
    * @return Horizontal center of the main lane.
    */
   public double startX() {
      return startX;
   }

   public double startY() {
      return startY;
   }

   public double stepWidth() {
      return stepWidth;
   }

   public double stepHeight() {
      return stepHeight;
   }

   public double transitionWidth() {
      return transitionWidth;
   }

   public double transitionHeight() {
      return transitionHeight;
   }

   public double actionWidth() {
      return actionWidth;
   }

   public double actionHeight() {
      return actionHeight;
   }

   public double actionGap() {
      return actionGap;
   }

   public double andGateHeight() {
      return andGateHeight;
   }

   public double orGateHeight() {
      return orGateHeight;
   }

   public double gateMargin() {
      return gateMargin;
   }

   public double branchSpacing() {
      return branchSpacing;
   }

   public double stepToTransition() {
      return stepToTransition;
   }

   /**
    * @return Gap between a step and a transition that directly leads into an AND divergence.
    */
   public double stepToTransitionCompressed() {
      return stepToTransitionCompressed;
   }

   public double transitionToStep() {
      return transitionToStep;
   }

   public double transitionToAndGate() {
      return transitionToAndGate;
   }

   public double stepToOrGate() {
      return stepToOrGate;
   }

   public double andGateToStep() {
      return andGateToStep;
   }

   public double orGateToTransition() {
      return orGateToTransition;
   }

   public double andConvergenceGap() {
      return andConvergenceGap;
   }

   public double andConvergenceToTransition() {
      return andConvergenceToTransition;
   }

   public double orConvergenceGap() {
      return orConvergenceGap;
   }

   public double orConvergenceToStep() {
      return orConvergenceToStep;
   }

   /**
    * @return Distance between a gate and the horizontal bus of a dogleg connection.
    */
   public double busOffset() {
      return busOffset;
   }

   public double jumpMargin() {
      return jumpMargin;
   }

   public double jumpDrop() {
      return jumpDrop;
   }

   public double jumpApproach() {
      return jumpApproach;
   }

   @FunctionalInterface
   private interface Lookup {
      double get(String key, double def);
   }
}
