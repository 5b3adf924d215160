package io.probetools.probedata.storage;

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

import io.probetools.probedata.geometry.ProbeGeometry;

import java.util.Arrays;
import java.util.List;

/// What a probe file declares about itself.
/// @param probeNumber
///     the probe number
/// @param dimension
///     the declared number of axes
/// @param shape
///     the declared number of points along each axis
/// @param vertices
///     `p0` followed by one endpoint per axis
/// @param fields
///     the recorded field names, in storage order
/// @param timeIntegrated
///     true if values are integrated over time
/// @param numpoints
///     the number of recorded points
public record ProbeMetadata(
    int probeNumber,
    int dimension,
    int[] shape,
    double[][] vertices,
    List<String> fields,
    boolean timeIntegrated,
    long numpoints
) {

  /// @return the sampling geometry, with no axes for a single-point probe
  public ProbeGeometry geometry() {
    int naxes = Math.min(shape.length, vertices.length - 1);
    double[][] endpoints = Arrays.copyOfRange(vertices, 1, 1 + naxes);
    return ProbeGeometry.of(vertices[0], endpoints, Arrays.copyOf(shape, naxes), numpoints);
  }

  /// @return a multi-line summary of the probe
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("Probe #").append(probeNumber).append(": ")
        .append(dimension).append("-dimensional, with fields ").append(String.join(",", fields));
    for (int i = 0; i < vertices.length; i++) {
      sb.append("\n\tp").append(i).append(" = ").append(join(vertices[i]));
    }
    if (shape.length > 0) {
      sb.append("\n\tnumber = ");
      for (int i = 0; i < shape.length; i++) {
        if (i > 0) {
          sb.append(' ');
        }
        sb.append(shape[i]);
      }
    }
    return sb.toString();
  }

  private static String join(double[] values) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.length; i++) {
      if (i > 0) {
        sb.append(' ');
      }
      sb.append(values[i]);
    }
    return sb.toString();
  }
}
