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

import io.probetools.probedata.ProbeConfigurationException;

import java.util.Arrays;

/// The declared sampling grid of a probe: a reference point `p0`, one endpoint per axis, the
/// number of grid points along each axis, and the number of points recorded in storage.
///
/// The number of axes is between 0 and 3. The ambient dimensionality is the length of `p0`,
/// which may exceed the number of axes (a 2D sampling plane inside a 3D simulation).
/// @param p0
///     the reference point, first grid point of every axis
/// @param endpoints
///     one endpoint per axis, each of the ambient dimensionality
/// @param initialShape
///     the declared number of points along each axis
/// @param numpoints
///     the number of points written to storage
public record ProbeGeometry(double[] p0, double[][] endpoints, int[] initialShape, long numpoints) {

  /// the largest number of sampling axes a probe may declare
  public static final int MAX_AXES = 3;

  public ProbeGeometry {
    if (p0 == null || p0.length == 0) {
      throw new ProbeConfigurationException("probe reference point p0 must have at least one coordinate");
    }
    if (endpoints.length != initialShape.length) {
      throw new ProbeConfigurationException(
          "probe declares " + initialShape.length + " axis sizes but " + endpoints.length + " endpoints");
    }
    if (initialShape.length > MAX_AXES) {
      throw new ProbeConfigurationException(
          "probe declares " + initialShape.length + " axes, at most " + MAX_AXES + " are supported");
    }
    for (int i = 0; i < endpoints.length; i++) {
      if (endpoints[i].length != p0.length) {
        throw new ProbeConfigurationException(
            "endpoint p" + (i + 1) + " has " + endpoints[i].length + " coordinates, expected " + p0.length);
      }
      if (initialShape[i] < 1) {
        throw new ProbeConfigurationException(
            "axis" + (i + 1) + " declares " + initialShape[i] + " points, at least 1 is required");
      }
    }
    if (numpoints < 0) {
      throw new ProbeConfigurationException("point count must be non-negative: " + numpoints);
    }
  }

  /// Build a geometry from declared probe metadata. A probe whose declared shape holds a
  /// single point in total is a point probe and gets no axes at all.
  /// @param p0
  ///     the reference point
  /// @param endpoints
  ///     the per-axis endpoints
  /// @param declaredShape
  ///     the declared number of points along each axis
  /// @param numpoints
  ///     the number of points written to storage
  /// @return the normalized geometry
  public static ProbeGeometry of(double[] p0, double[][] endpoints, int[] declaredShape, long numpoints) {
    long total = 1;
    for (int n : declaredShape) {
      total *= n;
    }
    if (total == 1) {
      return new ProbeGeometry(p0, new double[0][], new int[0], numpoints);
    }
    return new ProbeGeometry(p0, endpoints, declaredShape, numpoints);
  }

  /// @return the number of sampling axes
  public int naxes() {
    return initialShape.length;
  }

  /// @return the number of spatial dimensions of the simulation
  public int ambientDimensions() {
    return p0.length;
  }

  /// @return true if this probe samples a single point
  public boolean isPointProbe() {
    return initialShape.length == 0;
  }

  /// get the displacement vector of an axis
  /// @param axis
  ///     the zero-based axis index
  /// @return `endpoint - p0`
  public double[] displacement(int axis) {
    double[] end = endpoints[axis];
    double[] d = new double[p0.length];
    for (int i = 0; i < d.length; i++) {
      d[i] = end[i] - p0[i];
    }
    return d;
  }

  @Override
  public String toString() {
    return "ProbeGeometry{p0=" + Arrays.toString(p0) + ", shape=" + Arrays.toString(initialShape)
        + ", numpoints=" + numpoints + "}";
  }
}
