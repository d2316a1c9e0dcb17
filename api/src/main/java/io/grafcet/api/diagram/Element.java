package io.grafcet.api.diagram;

import java.io.Serializable;
import java.util.Objects;

/**
 * Common part of every diagram element. The set of subclasses is closed: {@link Step},
 * {@link Transition}, {@link ActionBlock}, {@link Gate} and {@link Connection}.
 */
public abstract class Element implements Serializable {
   private final String id;
   private final Point position;
   private final Size size;

   Element(String id, Point position, Size size) {
      this.id = Objects.requireNonNull(id, "id");
      this.position = Objects.requireNonNull(position, "position");
      this.size = Objects.requireNonNull(size, "size");
   }

   public String id() {
      return id;
   }

   public Point position() {
      return position;
   }

   public Size size() {
      return size;
   }

   public double centerX() {
      return position.x() + size.width() / 2;
   }

   public double top() {
      return position.y();
   }

   public double bottom() {
      return position.y() + size.height();
   }

   public double left() {
      return position.x();
   }

   public double right() {
      return position.x() + size.width();
   }

   public abstract ElementType type();

   /**
    * @return Tag written into the {@code type} field of the persisted document.
    */
   public String tag() {
      return type().tag();
   }

   public abstract <R> R accept(ElementVisitor<R> visitor);

   @Override
   public String toString() {
      return tag() + " " + id + " at " + position;
   }
}
