package io.grafcet.api.diagram;

import java.io.Serializable;
import java.util.Objects;

public final class Point implements Serializable {
   private final double x;
   private final double y;

   public Point(double x, double y) {
      this.x = x;
      this.y = y;
   }

   public double x() {
      return x;
   }

   public double y() {
      return y;
   }

   public Point translate(double dx, double dy) {
      return new Point(x + dx, y + dy);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Point)) {
         return false;
      }
      Point point = (Point) o;
      return Double.compare(point.x, x) == 0 && Double.compare(point.y, y) == 0;
   }

   @Override
   public int hashCode() {
      return Objects.hash(x, y);
   }

   @Override
   public String toString() {
      return "(" + x + ", " + y + ")";
   }
}
