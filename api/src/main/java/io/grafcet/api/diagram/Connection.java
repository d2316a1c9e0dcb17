package io.grafcet.api.diagram;

import java.util.Collections;
import java.util.List;

/**
 * Directed edge routed as a chain of orthogonal segments.
 */
public final class Connection extends Element {
   private static final Size NO_SIZE = new Size(0, 0);
   private static final Point ORIGIN = new Point(0, 0);

   private final String sourceId;
   private final String targetId;
   private final List<Segment> segments;

   public Connection(String id, String sourceId, String targetId, List<Segment> segments) {
      super(id, ORIGIN, NO_SIZE);
      if (segments.isEmpty()) {
         throw new IllegalArgumentException("Connection " + id + " has no segments");
      }
      for (int i = 1; i < segments.size(); ++i) {
         if (!segments.get(i - 1).to().equals(segments.get(i).from())) {
            throw new IllegalArgumentException("Connection " + id + " is not continuous at segment " + i);
         }
      }
      this.sourceId = sourceId;
      this.targetId = targetId;
      this.segments = Collections.unmodifiableList(segments);
   }

   public String sourceId() {
      return sourceId;
   }

   public String targetId() {
      return targetId;
   }

   public List<Segment> segments() {
      return segments;
   }

   public Point start() {
      return segments.get(0).from();
   }

   public Point end() {
      return segments.get(segments.size() - 1).to();
   }

   @Override
   public ElementType type() {
      return ElementType.CONNECTION;
   }

   @Override
   public <R> R accept(ElementVisitor<R> visitor) {
      return visitor.visit(this);
   }
}
