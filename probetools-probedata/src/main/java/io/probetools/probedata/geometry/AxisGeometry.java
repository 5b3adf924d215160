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

/// Grid point coordinates along one probe axis.
/// @param index
///     zero-based axis index
/// @param label
///     the axis label, `axis1` to `axis3`
/// @param units
///     the unit tag of the axis coordinates
/// @param centers
///     one coordinate vector per grid point, from `p0` to the axis endpoint inclusive
/// @param displacement
///     `endpoint - p0`
public record AxisGeometry(int index, String label, String units, double[][] centers, double[] displacement) {

  /// @return the number of grid points along this axis
  public int length() {
    return centers.length;
  }

  /// @return the euclidean distance of every grid point from the first one
  public double[] distances() {
    return distancesFromFirst(centers);
  }

  /// Euclidean distances of a list of points from the first one.
  /// @param points
  ///     the points, all of the same dimensionality
  /// @return one distance per point, the first being zero
  public static double[] distancesFromFirst(double[][] points) {
    double[] distances = new double[points.length];
    if (points.length == 0) {
      return distances;
    }
    double[] first = points[0];
    for (int i = 0; i < points.length; i++) {
      double sum = 0.0d;
      for (int c = 0; c < first.length; c++) {
        double delta = points[i][c] - first[c];
        sum += delta * delta;
      }
      distances[i] = Math.sqrt(sum);
    }
    return distances;
  }
}
