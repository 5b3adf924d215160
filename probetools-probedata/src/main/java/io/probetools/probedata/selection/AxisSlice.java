package io.probetools.probedata.selection;

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

/// A half-open, strided range of grid indices along one axis, `[start, stop)` every `step`.
/// @param start
///     the first selected index
/// @param stop
///     the exclusive upper bound
/// @param step
///     the stride, at least 1
public record AxisSlice(int start, int stop, int step) {

  public AxisSlice {
    if (start < 0) {
      throw new IllegalArgumentException("slice start must be non-negative: " + start);
    }
    if (stop < start) {
      throw new IllegalArgumentException("slice stop must not precede start: [" + start + ":" + stop + ")");
    }
    if (step < 1) {
      throw new IllegalArgumentException("slice step must be positive: " + step);
    }
  }

  /// the whole axis
  /// @param length
  ///     the number of points along the axis
  /// @return `[0:length:1]`
  public static AxisSlice full(int length) {
    return new AxisSlice(0, length, 1);
  }

  /// a single index
  /// @param index
  ///     the selected index
  /// @return `[index:index+1:1]`
  public static AxisSlice single(int index) {
    return new AxisSlice(index, index + 1, 1);
  }

  /// @return the number of selected indices
  public int length() {
    if (stop <= start) {
      return 0;
    }
    return (stop - start + step - 1) / step;
  }

  /// @param index
  ///     a grid index
  /// @return true if the index falls inside this slice and on its stride
  public boolean contains(long index) {
    return index >= start && index < stop && (index - start) % step == 0;
  }

  /// @param index
  ///     a grid index contained in this slice
  /// @return the position of the index within the selection
  public int positionOf(long index) {
    return (int) ((index - start) / step);
  }

  /// @param position
  ///     a position within the selection
  /// @return the grid index at that position
  public int indexAt(int position) {
    return start + position * step;
  }

  @Override
  public String toString() {
    return "[" + start + ":" + stop + ":" + step + "]";
  }
}
