package io.probetools.probedata.ordering;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.probetools.probedata.SyntheticProbe;
import io.probetools.probedata.geometry.AxisGeometry;
import io.probetools.probedata.geometry.AxisGeometryBuilder;
import io.probetools.probedata.geometry.ProbeGeometry;
import io.probetools.probedata.selection.AxisSlice;
import io.probetools.probedata.selection.ProbeSelection;
import io.probetools.probedata.selection.RangeRequest;
import io.probetools.probedata.selection.SelectionAssembler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OrderingBuilder")
class OrderingBuilderTest {

  private static final List<String> FIELDS = List.of("Ex");
  private static final long[] TIMESTEPS = {0};

  private static ProbeSelection select(SyntheticProbe probe, Map<String, RangeRequest> subset,
      Map<String, RangeRequest> average) {
    return SelectionAssembler.assemble(AxisGeometryBuilder.build(probe.metadata().geometry()), subset, average);
  }

  private static Ordering build(SyntheticProbe probe, ProbeSelection selection, int chunkSize) {
    return new OrderingBuilder(probe.metadata().geometry(), selection, chunkSize).build(probe);
  }

  /// every slot must hold the raw point recorded at the grid index of that slot
  private static void assertSlotsMatchGrid(SyntheticProbe probe, ProbeSelection selection, Ordering ordering) {
    int[] shape = selection.selectedShape();
    int[][] positions = SyntheticProbe.gridIndices(shape);
    for (int slot = 0; slot < ordering.size(); slot++) {
      int[] gridIndex = new int[shape.length];
      for (int d = 0; d < shape.length; d++) {
        gridIndex[d] = selection.slice(d).indexAt(positions[slot][d]);
      }
      long raw = ordering.rawIndexAt(slot);
      assertThat(raw).as("slot %d", slot).isNotEqualTo(Ordering.ABSENT);
      assertThat(probe.readField(0, 0, raw, 1)[0])
          .as("value at slot %d, grid index %s", slot, Arrays.toString(gridIndex))
          .isEqualTo(probe.expected(0, 0, gridIndex));
    }
  }

  @Nested
  @DisplayName("complete grids")
  class CompleteGrids {

    @Test
    @DisplayName("orders a shuffled 2D grid as a bijection onto its slots")
    void plane() {
      SyntheticProbe probe = SyntheticProbe.grid(new double[]{0, 0}, new double[][]{{3, 0}, {0, 2}},
          new int[]{4, 3}, FIELDS, TIMESTEPS, 7, SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of(), Map.of());

      Ordering ordering = build(probe, selection, OrderingBuilder.DEFAULT_CHUNK_SIZE);

      assertThat(ordering.isComplete()).isTrue();
      assertThat(ordering.shape()).containsExactly(4, 3);
      assertThat(Arrays.stream(ordering.toArray()).sorted().toArray())
          .containsExactly(LongStream.range(0, 12).toArray());
      assertThat(ordering.droppedPoints()).isZero();
      assertThat(ordering.collisions()).isZero();
      assertSlotsMatchGrid(probe, selection, ordering);
    }

    @Test
    @DisplayName("orders a skewed 3D volume")
    void volume() {
      SyntheticProbe probe = SyntheticProbe.grid(new double[]{1, -1, 2},
          new double[][]{{3, -1, 2}, {1.5, 0, 2}, {1, -1, 4.5}}, new int[]{3, 2, 4}, FIELDS, TIMESTEPS, 11,
          SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of(), Map.of());

      Ordering ordering = build(probe, selection, 5);

      assertThat(ordering.isComplete()).isTrue();
      assertSlotsMatchGrid(probe, selection, ordering);
    }

    @Test
    @DisplayName("orders a tilted plane inside a 3D simulation")
    void planeInSpace() {
      SyntheticProbe probe = SyntheticProbe.grid(new double[]{1, 1, 1},
          new double[][]{{4, 2, 1}, {1, 1, 3}}, new int[]{4, 3}, FIELDS, TIMESTEPS, 3, SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of(), Map.of());

      Ordering ordering = build(probe, selection, 4);

      assertThat(ordering.isComplete()).isTrue();
      assertSlotsMatchGrid(probe, selection, ordering);
    }

    @Test
    @DisplayName("orders a line by distance from p0")
    void line() {
      SyntheticProbe probe = SyntheticProbe.grid(new double[]{0, 0, 0},
          new double[][]{{0, 3, 4}}, new int[]{6}, FIELDS, TIMESTEPS, 5, SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of(), Map.of());

      Ordering ordering = build(probe, selection, 2);

      assertThat(ordering.isComplete()).isTrue();
      assertSlotsMatchGrid(probe, selection, ordering);
    }

    @Test
    @DisplayName("maps a point probe to its only raw point without reading positions")
    void pointProbe() {
      SyntheticProbe probe = SyntheticProbe.grid(new double[]{1, 2}, new double[][]{{1, 2}},
          new int[]{1}, FIELDS, TIMESTEPS, 1, SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of(), Map.of());

      Ordering ordering = build(probe, selection, 10);

      assertThat(ordering.toArray()).containsExactly(0L);
      assertThat(probe.positionReads()).isZero();
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 5, 11, 12, 13, 1_000})
  @DisplayName("does not depend on the chunk size")
  void chunkSizeInvariance(int chunkSize) {
    SyntheticProbe probe = SyntheticProbe.grid(new double[]{0, 0}, new double[][]{{3, 0}, {0, 2}},
        new int[]{4, 3}, FIELDS, TIMESTEPS, 19, SyntheticProbe.LINEAR);
    ProbeSelection selection = select(probe, Map.of(), Map.of());

    Ordering reference = build(probe, selection, OrderingBuilder.DEFAULT_CHUNK_SIZE);
    Ordering chunked = build(probe, selection, chunkSize);

    assertThat(chunked.toArray()).containsExactly(reference.toArray());
  }

  @Nested
  @DisplayName("subsets")
  class Subsets {

    @Test
    @DisplayName("a subset covering whole axes orders exactly like no subset")
    void wholeAxisSubsetIsIdempotent() {
      SyntheticProbe probe = SyntheticProbe.grid(new double[]{0, 0, 0},
          new double[][]{{3, 1, 0}, {-1, 2, 0.5}}, new int[]{5, 4}, FIELDS, TIMESTEPS, 23, SyntheticProbe.LINEAR);
      List<AxisGeometry> axes = AxisGeometryBuilder.build(probe.metadata().geometry());
      double[] d1 = axes.get(0).distances();
      double[] d2 = axes.get(1).distances();

      ProbeSelection unrestricted = select(probe, Map.of(), Map.of());
      ProbeSelection everything = select(probe, Map.of("axis1", RangeRequest.all(), "axis2", RangeRequest.all()),
          Map.of());
      ProbeSelection byDistance = select(probe, Map.of(
          "axis1", new RangeRequest.Between(0, d1[d1.length - 1], 1),
          "axis2", new RangeRequest.Between(0, d2[d2.length - 1], 1)), Map.of());

      Ordering expected = build(probe, unrestricted, 7);
      for (ProbeSelection selection : List.of(everything, byDistance)) {
        assertThat(selection.finalShape()).containsExactly(unrestricted.finalShape());
        Ordering ordering = build(probe, selection, 7);
        assertThat(ordering.toArray()).containsExactly(expected.toArray());
        assertThat(ordering.droppedPoints()).isZero();
      }
    }

    @Test
    @DisplayName("keeps only the selected indices of a line inside a volume")
    void lineInsideAVolume() {
      SyntheticProbe probe = SyntheticProbe.grid(new double[]{0, 0, 0},
          new double[][]{{3, 0, 0}, {0, 1, 0}, {0, 0, 1}}, new int[]{4, 1, 1}, FIELDS, TIMESTEPS, 2,
          SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of("axis1", new RangeRequest.Indices(1, 3, 1)), Map.of());

      Ordering ordering = build(probe, selection, OrderingBuilder.DEFAULT_CHUNK_SIZE);

      assertThat(selection.finalShape()[0]).isEqualTo(2);
      assertThat(selection.visibleAxes()).hasSize(1);
      assertThat(ordering.size()).isEqualTo(2);
      assertThat(ordering.droppedPoints()).isEqualTo(2);
      assertSlotsMatchGrid(probe, selection, ordering);
    }

    @Test
    @DisplayName("keeps every other point of a strided subset")
    void strided() {
      SyntheticProbe probe = SyntheticProbe.grid(new double[]{0, 0}, new double[][]{{6, 0}, {0, 2}},
          new int[]{7, 3}, FIELDS, TIMESTEPS, 23, SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of("axis1", new RangeRequest.Between(0, 6, 2)), Map.of());

      Ordering ordering = build(probe, selection, 4);

      assertThat(selection.slice(0)).isEqualTo(new AxisSlice(0, 7, 2));
      assertThat(ordering.shape()).containsExactly(4, 3);
      assertThat(ordering.isComplete()).isTrue();
      assertThat(ordering.droppedPoints()).isEqualTo(9);
      assertSlotsMatchGrid(probe, selection, ordering);
    }

    @Test
    @DisplayName("keeps every averaged point")
    void averaged() {
      SyntheticProbe probe = SyntheticProbe.grid(new double[]{0, 0}, new double[][]{{3, 0}, {0, 2}},
          new int[]{4, 3}, FIELDS, TIMESTEPS, 29, SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of(), Map.of("axis2", new RangeRequest.Indices(1, 3, 1)));

      Ordering ordering = build(probe, selection, 3);

      assertThat(ordering.shape()).containsExactly(4, 2);
      assertSlotsMatchGrid(probe, selection, ordering);
    }
  }

  @Nested
  @DisplayName("malformed positions")
  class MalformedPositions {

    private final double[] p0 = {0, 0};
    private final double[][] endpoints = {{1, 0}, {0, 1}};
    private final int[] shape = {2, 2};

    @Test
    @DisplayName("drops points that cannot be located")
    void dropsNonFinite() {
      double[][] positions = {{0, 0}, {Double.NaN, 0}, {1, 0}, {0, 1}, {1, 1}, {50, 50}};
      int[][] indices = {{0, 0}, null, {1, 0}, {0, 1}, {1, 1}, null};
      SyntheticProbe probe = SyntheticProbe.withPositions(p0, endpoints, shape, FIELDS, TIMESTEPS, positions,
          indices, SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of(), Map.of());

      Ordering ordering = build(probe, selection, 4);

      assertThat(ordering.isComplete()).isTrue();
      assertThat(ordering.droppedPoints()).isEqualTo(2);
      assertThat(ordering.toArray()).containsExactly(0L, 3L, 2L, 4L);
    }

    @Test
    @DisplayName("keeps the first of two points landing on the same slot")
    void collisions() {
      double[][] positions = {{0, 0}, {1, 0}, {0.01, 0.02}, {0, 1}, {1, 1}};
      int[][] indices = {{0, 0}, {1, 0}, {0, 0}, {0, 1}, {1, 1}};
      SyntheticProbe probe = SyntheticProbe.withPositions(p0, endpoints, shape, FIELDS, TIMESTEPS, positions,
          indices, SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of(), Map.of());

      Ordering ordering = build(probe, selection, 2);

      assertThat(ordering.collisions()).isEqualTo(1);
      assertThat(ordering.rawIndexAt(0)).isEqualTo(0L);
      assertThat(ordering.retainedPoints()).isEqualTo(5);
    }

    @Test
    @DisplayName("marks slots with no point as absent")
    void absentSlots() {
      double[][] positions = {{1, 1}, {0, 0}, {1, 0}};
      int[][] indices = {{1, 1}, {0, 0}, {1, 0}};
      SyntheticProbe probe = SyntheticProbe.withPositions(p0, endpoints, shape, FIELDS, TIMESTEPS, positions,
          indices, SyntheticProbe.LINEAR);
      ProbeSelection selection = select(probe, Map.of(), Map.of());

      Ordering ordering = build(probe, selection, 10);

      assertThat(ordering.isComplete()).isFalse();
      assertThat(ordering.absentSlots()).isEqualTo(1);
      assertThat(ordering.filledSlots()).isEqualTo(3);
      assertThat(ordering.rawIndexAt(1)).isEqualTo(Ordering.ABSENT);
      assertThat(ordering.toArray()).containsExactly(1L, Ordering.ABSENT, 2L, 0L);
    }
  }

  @Test
  @DisplayName("rejects a selection made for another probe")
  void rejectsMismatchedSelection() {
    SyntheticProbe probe = SyntheticProbe.grid(new double[]{0, 0}, new double[][]{{3, 0}, {0, 2}},
        new int[]{4, 3}, FIELDS, TIMESTEPS, 7, SyntheticProbe.LINEAR);
    ProbeGeometry line = ProbeGeometry.of(new double[]{0, 0}, new double[][]{{3, 0}}, new int[]{4}, 4);

    assertThatThrownBy(() -> new OrderingBuilder(line, select(probe, Map.of(), Map.of()), 10))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new OrderingBuilder(probe.metadata().geometry(), select(probe, Map.of(), Map.of()), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
