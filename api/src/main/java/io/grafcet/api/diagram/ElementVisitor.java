package io.grafcet.api.diagram;

public interface ElementVisitor<R> {
   R visit(Step step);

   R visit(Transition transition);

   R visit(ActionBlock action);

   R visit(Gate gate);

   R visit(Connection connection);
}
