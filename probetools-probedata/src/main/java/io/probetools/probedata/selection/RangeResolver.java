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

import io.probetools.probedata.ProbeConfigurationException;
import io.probetools.probedata.geometry.AxisGeometry;

/// Resolves a [RangeRequest] on one axis into a concrete [AxisSlice].
///
/// Physical requests are matched against the distance of every grid point from the first grid
/// point of the axis. A single location picks the nearest grid point, an interval picks every
/// grid point whose distance lies inside it. A request that selects no grid point at all is
/// rejected.
public class RangeResolver {

  /// the operation name used in descriptions of averaged axes
  public static final String AVERAGE = "average";
  /// the operation name used in descriptions of subset axes
  public static final String SUBSET = "subset";

  private RangeResolver() {
  }

  /// resolve a request against an axis
  /// @param request
  ///     the request
  /// @param axis
  ///     the axis geometry
  /// @param operation
  ///     [#AVERAGE] or [#SUBSET], used in descriptions and error messages
  /// @return the resolved range
  public static ResolvedRange resolve(RangeRequest request, AxisGeometry axis, String operation) {
    int length = axis.length();
    String label = axis.label();
    String units = axis.units();

    if (request instanceof RangeRequest.All) {
      return new ResolvedRange(AxisSlice.full(length), false, operation + " for all " + label);
    }

    double[] distances = axis.distances();

    if (request instanceof RangeRequest.At at) {
      int nearest = nearestIndex(distances, at.location());
      return new ResolvedRange(AxisSlice.single(nearest), true,
          operation + " for " + label + " = " + distances[nearest] + " " + units);
    }

    if (request instanceof RangeRequest.Between between) {
      int first = -1;
      int last = -1;
      for (int i = 0; i < distances.length; i++) {
        if (distances[i] >= between.from() && distances[i] <= between.to()) {
          if (first < 0) {
            first = i;
          }
          last = i;
        }
      }
      if (first < 0) {
        throw new ProbeConfigurationException(
            "empty selection: `" + operation + "` along " + label + " from " + between.from() + " to "
                + between.to() + " " + units + " contains no grid point (axis spans 0.0 to "
                + distances[distances.length - 1] + " " + units + ")");
      }
      AxisSlice slice = new AxisSlice(first, last + 1, between.step());
      String description = operation + " for " + label + " from " + distances[first] + " to "
          + distances[last] + " " + units;
      if (between.step() > 1) {
        description += " every " + between.step() + " points";
      }
      return new ResolvedRange(slice, false, description);
    }

    if (request instanceof RangeRequest.Indices indices) {
      int stop = Math.min(indices.stop(), length);
      if (indices.start() >= stop) {
        throw new ProbeConfigurationException(
            "empty selection: `" + operation + "` along " + label + " with indices " + indices
                + " selects no grid point of " + length);
      }
      AxisSlice slice = new AxisSlice(indices.start(), stop, indices.step());
      return new ResolvedRange(slice, false, operation + " for " + label + " indices " + slice);
    }

    throw new IllegalArgumentException("unknown range request type: " + request.getClass().getName());
  }

  static int nearestIndex(double[] distances, double location) {
    int nearest = 0;
    double best = Double.POSITIVE_INFINITY;
    for (int i = 0; i < distances.length; i++) {
      double gap = Math.abs(distances[i] - location);
      if (gap < best) {
        best = gap;
        nearest = i;
      }
    }
    return nearest;
  }
}
