package io.grafcet.api.diagram;

public final class Transition extends Element {
   private final int number;
   private final String condition;

   public Transition(String id, int number, String condition, Point position, Size size) {
      super(id, position, size);
      this.number = number;
      this.condition = condition == null ? "" : condition;
   }

   public int number() {
      return number;
   }

   /**
    * @return Guard expression; doubles as the label under which direct triggers are looked up.
    */
   public String condition() {
      return condition;
   }

   public String label() {
      return "T" + number;
   }

   @Override
   public ElementType type() {
      return ElementType.TRANSITION;
   }

   @Override
   public <R> R accept(ElementVisitor<R> visitor) {
      return visitor.visit(this);
   }
}
