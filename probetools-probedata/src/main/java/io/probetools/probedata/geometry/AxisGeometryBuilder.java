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

import java.util.ArrayList;
import java.util.List;

/// Builds the grid point coordinates of every axis of a probe by linear interpolation between
/// the reference point and the axis endpoint.
public class AxisGeometryBuilder {

  /// the unit tag of probe lengths, the reference length of the simulation
  public static final String LENGTH_UNITS = "L_r";

  private AxisGeometryBuilder() {
  }

  /// the label of an axis
  /// @param axis
  ///     the zero-based axis index
  /// @return `axis1`, `axis2` or `axis3`
  public static String label(int axis) {
    return "axis" + (axis + 1);
  }

  /// build all axes of a probe
  /// @param geometry
  ///     the probe geometry
  /// @return one [AxisGeometry] per axis, empty for a point probe
  public static List<AxisGeometry> build(ProbeGeometry geometry) {
    List<AxisGeometry> axes = new ArrayList<>(geometry.naxes());
    for (int axis = 0; axis < geometry.naxes(); axis++) {
      double[] displacement = geometry.displacement(axis);
      double[][] centers = linspace(geometry.p0(), geometry.endpoints()[axis], geometry.initialShape()[axis]);
      axes.add(new AxisGeometry(axis, label(axis), LENGTH_UNITS, centers, displacement));
    }
    return axes;
  }

  /// evenly spaced points from `start` to `end`, both included
  /// @param start
  ///     the first point
  /// @param end
  ///     the last point
  /// @param count
  ///     the number of points; a single point sits at `start`
  /// @return `count` points
  static double[][] linspace(double[] start, double[] end, int count) {
    double[][] points = new double[count][start.length];
    for (int k = 0; k < count; k++) {
      for (int c = 0; c < start.length; c++) {
        if (count == 1) {
          points[k][c] = start[c];
        } else if (k == count - 1) {
          points[k][c] = end[c];
        } else {
          points[k][c] = start[c] + (end[c] - start[c]) * k / (count - 1);
        }
      }
    }
    return points;
  }
}
