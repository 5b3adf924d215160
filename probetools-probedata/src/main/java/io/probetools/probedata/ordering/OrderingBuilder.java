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

import io.probetools.probedata.geometry.InverseBasis;
import io.probetools.probedata.geometry.ProbeGeometry;
import io.probetools.probedata.selection.AxisSlice;
import io.probetools.probedata.selection.ProbeSelection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/// Computes the [Ordering] of a probe from its recorded point positions.
///
/// Points are read in chunks of increasing raw index. Each position is moved into the probe
/// frame (minus `p0`), mapped through the inverse basis onto continuous grid coordinates and
/// rounded to the nearest grid index per axis. Points whose index falls outside the selected
/// slice of any axis, or off its stride, are dropped. The others are linearized row-major over
/// the selected shape and written once into their slot.
///
/// Nothing here fails on bad positions: a non-finite position cannot be located and is dropped.
public class OrderingBuilder {
  private static final Logger logger = LogManager.getLogger(OrderingBuilder.class);

  /// the default number of points read per chunk
  public static final int DEFAULT_CHUNK_SIZE = 10_000_000;

  private final ProbeGeometry geometry;
  private final ProbeSelection selection;
  private final int chunkSize;

  /// create an ordering builder
  /// @param geometry
  ///     the probe geometry
  /// @param selection
  ///     the resolved selection over the probe axes
  /// @param chunkSize
  ///     the number of points read at once
  public OrderingBuilder(ProbeGeometry geometry, ProbeSelection selection, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunk size must be positive: " + chunkSize);
    }
    if (geometry.naxes() != selection.naxes()) {
      throw new IllegalArgumentException(
          "selection has " + selection.naxes() + " axes but the probe has " + geometry.naxes());
    }
    this.geometry = geometry;
    this.selection = selection;
    this.chunkSize = chunkSize;
  }

  /// build the ordering
  /// @param positions
  ///     reader of the recorded point positions
  /// @return the ordering
  public Ordering build(PositionReader positions) {
    int naxes = geometry.naxes();
    if (naxes == 0) {
      return Ordering.pointProbe();
    }

    InverseBasis basis = InverseBasis.of(geometry);
    int[] shape = selection.selectedShape();
    AxisSlice[] slices = new AxisSlice[naxes];
    for (int d = 0; d < naxes; d++) {
      slices[d] = selection.slice(d);
    }

    long[] slots = new long[selection.size()];
    Arrays.fill(slots, Ordering.ABSENT);

    double[] p0 = geometry.p0();
    double[] local = new double[p0.length];
    double[] grid = new double[basis.logicalAxes()];
    int[] position = new int[naxes];

    long retained = 0;
    long dropped = 0;
    long collisions = 0;

    ChunkedRange chunks = new ChunkedRange(geometry.numpoints(), chunkSize);
    logger.debug("ordering {} points over shape {} in {} chunk(s)", geometry.numpoints(), Arrays.toString(shape),
        chunks.chunkCount());

    for (ChunkedRange.Chunk chunk : chunks) {
      double[][] raw = positions.readPositions(chunk.first(), chunk.count());
      long keptInChunk = 0;
      for (int k = 0; k < raw.length; k++) {
        for (int c = 0; c < p0.length; c++) {
          local[c] = raw[k][c] - p0[c];
        }
        basis.locate(local, grid);

        boolean keep = true;
        for (int d = 0; d < naxes; d++) {
          double rounded = Math.rint(grid[d]);
          if (!Double.isFinite(rounded)) {
            keep = false;
            break;
          }
          long index = (long) rounded;
          if (!slices[d].contains(index)) {
            keep = false;
            break;
          }
          position[d] = slices[d].positionOf(index);
        }
        if (!keep) {
          dropped++;
          continue;
        }

        int slot = position[0];
        for (int d = 1; d < naxes; d++) {
          slot = slot * shape[d] + position[d];
        }
        retained++;
        keptInChunk++;
        if (slots[slot] == Ordering.ABSENT) {
          slots[slot] = chunk.first() + k;
        } else {
          collisions++;
          logger.trace("raw point {} collides with raw point {} at slot {}", chunk.first() + k, slots[slot], slot);
        }
      }
      logger.trace("chunk [{}, {}): kept {} of {} points", chunk.first(), chunk.last(), keptInChunk, raw.length);
    }

    Ordering ordering = new Ordering(slots, shape, retained, dropped, collisions);
    logger.debug("built {}", ordering);
    if (collisions > 0) {
      logger.warn("{} probe points landed on an already filled grid slot; the probe positions contain duplicates",
          collisions);
    }
    if (ordering.absentSlots() > 0) {
      logger.warn("{} of {} grid slots have no recorded point and will read as NaN", ordering.absentSlots(),
          ordering.size());
    }
    return ordering;
  }
}
