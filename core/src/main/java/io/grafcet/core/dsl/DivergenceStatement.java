package io.grafcet.core.dsl;

import java.util.Collections;
import java.util.List;

import io.grafcet.api.diagram.GateType;

public class DivergenceStatement extends Statement {
   private final GateType gateType;
   private final List<Branch> branches;

   DivergenceStatement(int line, int column, GateType gateType, List<Branch> branches) {
      super(line, column);
      this.gateType = gateType;
      this.branches = Collections.unmodifiableList(branches);
   }

   public GateType gateType() {
      return gateType;
   }

   public boolean isAnd() {
      return gateType == GateType.AND;
   }

   public List<Branch> branches() {
      return branches;
   }

   @Override
   public Kind kind() {
      return Kind.DIVERGENCE;
   }

   @Override
   public String toString() {
      return "Divergence " + gateType + " (" + branches.size() + " branches)";
   }
}
