package io.probetools.probedata.extract;

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

/// The values of a derived quantity over the visible probe grid at one timestep.
///
/// Values are stored row-major over `shape`. A point probe, or a probe with every axis averaged
/// away, has an empty shape and a single value.
/// @param timestep
///     the timestep
/// @param values
///     the values, row-major
/// @param shape
///     the number of points along every visible axis
/// @param title
///     the display title of the quantity
/// @param units
///     the units of the values
public record ProbeFrame(long timestep, double[] values, int[] shape, String title, String units) {

  /// @return the number of visible axes
  public int rank() {
    return shape.length;
  }

  /// @return true if the frame holds a single value with no visible axis
  public boolean isScalar() {
    return shape.length == 0;
  }

  /// @param indices
  ///     one index per visible axis
  /// @return the value at those indices
  public double get(int... indices) {
    if (indices.length != shape.length) {
      throw new IllegalArgumentException(
          "expected " + shape.length + " indices for shape " + Arrays.toString(shape) + ", got " + indices.length);
    }
    int offset = 0;
    for (int d = 0; d < shape.length; d++) {
      if (indices[d] < 0 || indices[d] >= shape[d]) {
        throw new IndexOutOfBoundsException("index " + indices[d] + " out of bounds for axis " + d + " of length " + shape[d]);
      }
      offset = offset * shape[d] + indices[d];
    }
    return values[offset];
  }

  @Override
  public String toString() {
    return "ProbeFrame{timestep=" + timestep + ", title='" + title + "', units='" + units + "', shape="
        + Arrays.toString(shape) + "}";
  }
}
