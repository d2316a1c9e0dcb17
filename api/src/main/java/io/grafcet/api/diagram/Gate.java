package io.grafcet.api.diagram;

/**
 * Bar opening or closing a set of parallel (AND) or alternative (OR) branches.
 */
public final class Gate extends Element {
   private final GateType gateType;
   private final GateRole role;
   private final int branchCount;

   public Gate(String id, GateType gateType, GateRole role, int branchCount, Point position, Size size) {
      super(id, position, size);
      this.gateType = gateType;
      this.role = role;
      this.branchCount = branchCount;
   }

   public GateType gateType() {
      return gateType;
   }

   public GateRole role() {
      return role;
   }

   public boolean isDivergence() {
      return role == GateRole.DIVERGENCE;
   }

   public int branchCount() {
      return branchCount;
   }

   @Override
   public ElementType type() {
      return ElementType.GATE;
   }

   @Override
   public String tag() {
      return gateType.tag();
   }

   @Override
   public <R> R accept(ElementVisitor<R> visitor) {
      return visitor.visit(this);
   }
}
