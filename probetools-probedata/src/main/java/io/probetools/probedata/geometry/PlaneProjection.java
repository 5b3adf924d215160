package io.probetools.probedata.geometry;

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

/// Cell-edge coordinates of a two-axis probe in the plane of the probe itself, for plotting.
///
/// Both meshes have one more point than the grid along each axis: `x[i][j]` and `y[i][j]`
/// locate the corner of cell `(i, j)`.
/// @param x
///     first plane coordinate of every cell corner
/// @param y
///     second plane coordinate of every cell corner
/// @param xRange
///     `[min, max]` of `x`
/// @param yRange
///     `[min, max]` of `y`
public record PlaneProjection(double[][] x, double[][] y, double[] xRange, double[] yRange) {

  /// @return the number of corners along the first axis
  public int rows() {
    return x.length;
  }

  /// @return the number of corners along the second axis
  public int columns() {
    return x.length == 0 ? 0 : x[0].length;
  }
}
