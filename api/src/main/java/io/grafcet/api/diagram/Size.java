package io.grafcet.api.diagram;

import java.io.Serializable;
import java.util.Objects;

public final class Size implements Serializable {
   private final double width;
   private final double height;

   public Size(double width, double height) {
      this.width = width;
      this.height = height;
   }

   public double width() {
      return width;
   }

   public double height() {
      return height;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Size)) {
         return false;
      }
      Size size = (Size) o;
      return Double.compare(size.width, width) == 0 && Double.compare(size.height, height) == 0;
   }

   @Override
   public int hashCode() {
      return Objects.hash(width, height);
   }

   @Override
   public String toString() {
      return width + "x" + height;
   }
}
