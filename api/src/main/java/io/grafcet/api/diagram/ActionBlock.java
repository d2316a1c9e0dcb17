package io.grafcet.api.diagram;

public final class ActionBlock extends Element {
   private final String parentId;
   private final String label;
   private final ActionQualifier qualifier;
   private final String condition;
   private final String duration;
   private final boolean temporal;
   private final int index;

   public ActionBlock(String id, String parentId, String label, ActionQualifier qualifier, String condition,
                      String duration, boolean temporal, int index, Point position, Size size) {
      super(id, position, size);
      this.parentId = parentId;
      this.label = label;
      this.qualifier = qualifier == null ? ActionQualifier.N : qualifier;
      this.condition = condition == null ? "" : condition;
      this.duration = duration == null ? "" : duration;
      this.temporal = temporal;
      this.index = index;
   }

   /**
    * @return Id of the owning {@link Step}.
    */
   public String parentId() {
      return parentId;
   }

   /**
    * @return Name of the controlled variable.
    */
   public String label() {
      return label;
   }

   public ActionQualifier qualifier() {
      return qualifier;
   }

   public String condition() {
      return condition;
   }

   public String duration() {
      return duration;
   }

   public boolean isTemporal() {
      return temporal;
   }

   public int index() {
      return index;
   }

   @Override
   public ElementType type() {
      return ElementType.ACTION_BLOCK;
   }

   @Override
   public <R> R accept(ElementVisitor<R> visitor) {
      return visitor.visit(this);
   }
}
