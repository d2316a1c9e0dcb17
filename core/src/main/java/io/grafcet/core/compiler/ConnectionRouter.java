package io.grafcet.core.compiler;

import java.util.ArrayList;
import java.util.List;

import io.grafcet.api.diagram.Segment;

/**
 * Builds orthogonal polylines. Paths never contain diagonal or zero-length segments.
 */
final class ConnectionRouter {
   private ConnectionRouter() {
   }

   /**
    * Straight vertical drop when both ends share the x coordinate, otherwise a vertical-horizontal-vertical
    * dogleg that turns at {@code turnY}.
    */
   static List<Segment> route(double fromX, double fromY, double toX, double toY, double turnY) {
      List<Segment> segments = new ArrayList<>();
      if (Double.compare(fromX, toX) == 0) {
         segments.add(Segment.vertical(fromX, fromY, toY));
         return segments;
      }
      if (Double.compare(fromY, turnY) != 0) {
         segments.add(Segment.vertical(fromX, fromY, turnY));
      }
      segments.add(Segment.horizontal(turnY, fromX, toX));
      if (Double.compare(turnY, toY) != 0) {
         segments.add(Segment.vertical(toX, turnY, toY));
      }
      return segments;
   }

   static List<Segment> route(double fromX, double fromY, double toX, double toY) {
      return route(fromX, fromY, toX, toY, (fromY + toY) / 2);
   }

   /**
    * Appends a segment from the end of the path to the given point, merging it into the last segment when both
    * run along the same axis.
    */
   static void lineTo(List<Segment> path, double x, double y) {
      Segment last = path.get(path.size() - 1);
      double fromX = last.to().x();
      double fromY = last.to().y();
      if (Double.compare(fromX, x) == 0 && Double.compare(fromY, y) == 0) {
         return;
      } else if (Double.compare(fromX, x) != 0 && Double.compare(fromY, y) != 0) {
         throw new IllegalArgumentException("Diagonal move from (" + fromX + ", " + fromY + ") to (" + x + ", " + y + ")");
      }
      Segment next = Double.compare(fromX, x) == 0 ? Segment.vertical(x, fromY, y) : Segment.horizontal(y, fromX, x);
      if (next.orientation() == last.orientation()) {
         path.set(path.size() - 1, new Segment(last.orientation(), last.from(), next.to()));
      } else {
         path.add(next);
      }
   }
}
