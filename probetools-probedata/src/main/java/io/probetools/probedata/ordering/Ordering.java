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

import java.util.Arrays;

/// Maps every slot of the selected probe grid, in row-major order, to the raw index of the
/// point stored for it, or to [#ABSENT] if no recorded point landed there.
///
/// An ordering is immutable once built, and is reused for every timestep extracted with the
/// same subset and average configuration. It also records how the build went: how many points
/// were retained, dropped as out of the selection, or collided with an already filled slot.
public final class Ordering {

  /// the raw index of a slot no point maps to
  public static final long ABSENT = -1L;

  private final long[] rawIndices;
  private final int[] shape;
  private final long retainedPoints;
  private final long droppedPoints;
  private final long collisions;
  private final int filledSlots;

  /// create an ordering
  /// @param rawIndices
  ///     the raw index per slot, [#ABSENT] where unfilled
  /// @param shape
  ///     the grid shape the slots linearize
  /// @param retainedPoints
  ///     the number of points that fell inside the selection
  /// @param droppedPoints
  ///     the number of points outside the selection, or not locatable
  /// @param collisions
  ///     the number of retained points whose slot was already filled
  public Ordering(long[] rawIndices, int[] shape, long retainedPoints, long droppedPoints, long collisions) {
    this.rawIndices = rawIndices;
    this.shape = shape.clone();
    this.retainedPoints = retainedPoints;
    this.droppedPoints = droppedPoints;
    this.collisions = collisions;
    int filled = 0;
    for (long raw : rawIndices) {
      if (raw != ABSENT) {
        filled++;
      }
    }
    this.filledSlots = filled;
  }

  /// the ordering of a point probe, which holds a single value at raw index 0
  /// @return a single-slot ordering
  public static Ordering pointProbe() {
    return new Ordering(new long[]{0L}, new int[0], 1, 0, 0);
  }

  /// @return the number of slots
  public int size() {
    return rawIndices.length;
  }

  /// @param slot
  ///     a slot in row-major order
  /// @return the raw index stored for that slot, or [#ABSENT]
  public long rawIndexAt(int slot) {
    return rawIndices[slot];
  }

  /// @return the grid shape linearized by the slots
  public int[] shape() {
    return shape.clone();
  }

  /// @return a copy of the raw index per slot
  public long[] toArray() {
    return rawIndices.clone();
  }

  /// @return the number of points that fell inside the selection
  public long retainedPoints() {
    return retainedPoints;
  }

  /// @return the number of points outside the selection or not locatable
  public long droppedPoints() {
    return droppedPoints;
  }

  /// @return the number of retained points that landed on an already filled slot
  public long collisions() {
    return collisions;
  }

  /// @return the number of distinct slots holding a raw index
  public int filledSlots() {
    return filledSlots;
  }

  /// @return the number of slots no point maps to
  public int absentSlots() {
    return rawIndices.length - filledSlots;
  }

  /// @return true if every slot holds a raw index
  public boolean isComplete() {
    return filledSlots == rawIndices.length;
  }

  @Override
  public String toString() {
    return "Ordering{shape=" + Arrays.toString(shape) + ", slots=" + rawIndices.length + ", filled=" + filledSlots
        + ", retained=" + retainedPoints + ", dropped=" + droppedPoints + ", collisions=" + collisions + "}";
  }
}
