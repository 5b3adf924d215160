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

/// Reductions over row-major grid arrays.
public class GridReductions {

  private GridReductions() {
  }

  /// Arithmetic mean along one axis, keeping that axis with length 1.
  /// @param data
  ///     the values, row-major over `shape`
  /// @param shape
  ///     the grid shape
  /// @param axis
  ///     the axis to average
  /// @return the averaged values, row-major over `shape` with `shape[axis] = 1`
  public static double[] meanAlongAxis(double[] data, int[] shape, int axis) {
    int outer = 1;
    for (int d = 0; d < axis; d++) {
      outer *= shape[d];
    }
    int inner = 1;
    for (int d = axis + 1; d < shape.length; d++) {
      inner *= shape[d];
    }
    int n = shape[axis];
    if (data.length != outer * n * inner) {
      throw new IllegalArgumentException("data length " + data.length + " does not match shape of " + outer * n * inner + " values");
    }
    double[] result = new double[outer * inner];
    for (int o = 0; o < outer; o++) {
      for (int i = 0; i < inner; i++) {
        double sum = 0.0d;
        for (int k = 0; k < n; k++) {
          sum += data[(o * n + k) * inner + i];
        }
        result[o * inner + i] = sum / n;
      }
    }
    return result;
  }

  /// base-10 logarithm of every value
  /// @param data
  ///     the values
  /// @return a new array of logarithms
  public static double[] log10(double[] data) {
    double[] result = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      result[i] = Math.log10(data[i]);
    }
    return result;
  }
}
