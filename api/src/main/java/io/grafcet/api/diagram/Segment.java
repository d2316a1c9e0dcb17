package io.grafcet.api.diagram;

import java.io.Serializable;
import java.util.Objects;

/**
 * One axis-aligned piece of a routed connection.
 */
public final class Segment implements Serializable {
   private final Orientation orientation;
   private final Point from;
   private final Point to;

   public Segment(Orientation orientation, Point from, Point to) {
      if (orientation == Orientation.VERTICAL && Double.compare(from.x(), to.x()) != 0) {
         throw new IllegalArgumentException("Vertical segment must keep x: " + from + " -> " + to);
      } else if (orientation == Orientation.HORIZONTAL && Double.compare(from.y(), to.y()) != 0) {
         throw new IllegalArgumentException("Horizontal segment must keep y: " + from + " -> " + to);
      }
      this.orientation = orientation;
      this.from = from;
      this.to = to;
   }

   public static Segment vertical(double x, double fromY, double toY) {
      return new Segment(Orientation.VERTICAL, new Point(x, fromY), new Point(x, toY));
   }

   public static Segment horizontal(double y, double fromX, double toX) {
      return new Segment(Orientation.HORIZONTAL, new Point(fromX, y), new Point(toX, y));
   }

   public Orientation orientation() {
      return orientation;
   }

   public Point from() {
      return from;
   }

   public Point to() {
      return to;
   }

   public double minX() {
      return Math.min(from.x(), to.x());
   }

   public double maxX() {
      return Math.max(from.x(), to.x());
   }

   public double minY() {
      return Math.min(from.y(), to.y());
   }

   public double maxY() {
      return Math.max(from.y(), to.y());
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Segment)) {
         return false;
      }
      Segment segment = (Segment) o;
      return orientation == segment.orientation && from.equals(segment.from) && to.equals(segment.to);
   }

   @Override
   public int hashCode() {
      return Objects.hash(orientation, from, to);
   }

   @Override
   public String toString() {
      return orientation.tag() + " " + from + " -> " + to;
   }
}
