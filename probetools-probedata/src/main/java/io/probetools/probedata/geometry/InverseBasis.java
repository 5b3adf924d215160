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
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// The inverse of a probe's axis basis, used to turn a position relative to `p0` back into
/// continuous grid coordinates.
///
/// Solving `position = Σ index_i · p_i / (n_i - 1)` for the indices needs a square basis:
/// - one axis degenerates to the scalar length `|p_1|`, applied to the distance of a point
///   from `p0`
/// - two axes in a 3D simulation get a third, unit, vector normal to the sampling plane, with
///   a logical length of 1 so that its index is always 0
/// - otherwise the number of axes must equal the ambient dimensionality
///
/// A degenerate basis (coincident endpoints, collinear axes) is rejected with a
/// [ProbeConfigurationException].
public final class InverseBasis {

  /// relative volume under which a basis is treated as singular
  static final double SINGULARITY_TOLERANCE = 1e-12;

  private final double[][] inverse;
  private final int[] logicalShape;
  private final boolean scalar;

  private InverseBasis(double[][] inverse, int[] logicalShape, boolean scalar) {
    this.inverse = inverse;
    this.logicalShape = logicalShape;
    this.scalar = scalar;
  }

  /// invert the basis of a probe
  /// @param geometry
  ///     the probe geometry, with at least one axis
  /// @return the inverse basis
  public static InverseBasis of(ProbeGeometry geometry) {
    int naxes = geometry.naxes();
    if (naxes == 0) {
      throw new IllegalArgumentException("a point probe has no basis to invert");
    }
    int ambient = geometry.ambientDimensions();

    if (naxes == 1) {
      double length = norm(geometry.displacement(0));
      if (!(length > 0.0d) || !Double.isFinite(length)) {
        throw new ProbeConfigurationException(
            "degenerate probe basis: axis1 endpoint coincides with p0 " + Arrays.toString(geometry.p0()));
      }
      return new InverseBasis(new double[][]{{1.0d / length}}, geometry.initialShape().clone(), true);
    }

    List<double[]> vectors = new ArrayList<>();
    for (int axis = 0; axis < naxes; axis++) {
      vectors.add(geometry.displacement(axis));
    }
    int[] logicalShape = geometry.initialShape().clone();
    if (naxes == 2 && ambient == 3) {
      Vector3D v1 = new Vector3D(vectors.get(0));
      Vector3D v2 = new Vector3D(vectors.get(1));
      Vector3D normal = v1.crossProduct(v2);
      double normalLength = normal.getNorm();
      if (!(normalLength > 0.0d)) {
        throw new ProbeConfigurationException("degenerate probe basis: axis1 and axis2 are collinear");
      }
      vectors.add(normal.scalarMultiply(1.0d / normalLength).toArray());
      logicalShape = Arrays.copyOf(logicalShape, 3);
      logicalShape[2] = 1;
    }
    if (vectors.size() != ambient) {
      throw new ProbeConfigurationException(
          "a " + naxes + "-axis probe cannot be located in a " + ambient + "-dimensional simulation");
    }

    // columns are the basis vectors
    double[][] columns = new double[ambient][ambient];
    double volumeScale = 1.0d;
    for (int c = 0; c < ambient; c++) {
      double[] v = vectors.get(c);
      volumeScale *= norm(v);
      for (int r = 0; r < ambient; r++) {
        columns[r][c] = v[r];
      }
    }
    RealMatrix basis = MatrixUtils.createRealMatrix(columns);
    LUDecomposition lu = new LUDecomposition(basis);
    double determinant = lu.getDeterminant();
    if (!(volumeScale > 0.0d) || !(Math.abs(determinant) > SINGULARITY_TOLERANCE * volumeScale)) {
      throw new ProbeConfigurationException(
          "degenerate probe basis: axis vectors " + describe(vectors) + " do not span the sampling space");
    }
    try {
      RealMatrix inverse = lu.getSolver().getInverse();
      return new InverseBasis(inverse.getData(), logicalShape, false);
    } catch (SingularMatrixException e) {
      throw new ProbeConfigurationException(
          "degenerate probe basis: axis vectors " + describe(vectors) + " cannot be inverted", e);
    }
  }

  /// @return the number of logical axes, including a synthesized normal axis
  public int logicalAxes() {
    return logicalShape.length;
  }

  /// @return the point count per logical axis, including a synthesized normal axis of length 1
  public int[] logicalShape() {
    return logicalShape.clone();
  }

  /// Map a position relative to `p0` onto continuous grid coordinates. Rounding the result to
  /// the nearest integer gives the grid index along each logical axis.
  /// @param local
  ///     the position minus `p0`, of the ambient dimensionality
  /// @param gridCoordinates
  ///     receives one coordinate per logical axis
  public void locate(double[] local, double[] gridCoordinates) {
    if (scalar) {
      gridCoordinates[0] = norm(local) * inverse[0][0] * (logicalShape[0] - 1);
      return;
    }
    for (int r = 0; r < inverse.length; r++) {
      double sum = 0.0d;
      double[] row = inverse[r];
      for (int c = 0; c < row.length; c++) {
        sum += row[c] * local[c];
      }
      gridCoordinates[r] = sum * (logicalShape[r] - 1);
    }
  }

  static double norm(double[] v) {
    double sum = 0.0d;
    for (double x : v) {
      sum += x * x;
    }
    return Math.sqrt(sum);
  }

  private static String describe(List<double[]> vectors) {
    StringBuilder sb = new StringBuilder();
    for (double[] v : vectors) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(Arrays.toString(v));
    }
    return sb.toString();
  }
}
