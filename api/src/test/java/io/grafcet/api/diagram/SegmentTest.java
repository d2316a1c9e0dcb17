package io.grafcet.api.diagram;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

public class SegmentTest {
   @Test
   public void testAxis() {
      Segment v = Segment.vertical(10, 50, 20);
      assertThat(v.orientation()).isEqualTo(Orientation.VERTICAL);
      assertThat(v.minY()).isEqualTo(20);
      assertThat(v.maxY()).isEqualTo(50);
      Segment h = Segment.horizontal(5, 30, -10);
      assertThat(h.minX()).isEqualTo(-10);
      assertThat(h.maxX()).isEqualTo(30);
      assertThatThrownBy(() -> new Segment(Orientation.VERTICAL, new Point(0, 0), new Point(1, 5)))
            .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> new Segment(Orientation.HORIZONTAL, new Point(0, 0), new Point(5, 1)))
            .isInstanceOf(IllegalArgumentException.class);
   }

   @Test
   public void testConnectionContinuity() {
      Connection ok = new Connection("c", "a", "b", Arrays.asList(
            Segment.vertical(0, 0, 10), Segment.horizontal(10, 0, 30), Segment.vertical(30, 10, 40)));
      assertThat(ok.start()).isEqualTo(new Point(0, 0));
      assertThat(ok.end()).isEqualTo(new Point(30, 40));
      assertThatThrownBy(() -> new Connection("c", "a", "b", Arrays.asList(Segment.vertical(0, 0, 10), Segment.horizontal(12, 0, 30))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not continuous at segment 1");
      assertThatThrownBy(() -> new Connection("c", "a", "b", Collections.emptyList()))
            .isInstanceOf(IllegalArgumentException.class);
   }
}
