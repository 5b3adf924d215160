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

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/// Builds plotting coordinates for a probe with two visible axes.
///
/// The grid points of each axis are turned into cell edges: one more point is appended past
/// the end, and all edges are shifted back by half a cell in both directions. In a 3D
/// simulation the plane of the probe may be tilted, so edges are re-expressed in the unit
/// vectors `u1`, `u2` of the two axes, relative to the projection of the box origin onto the
/// plane. In a 2D simulation the meshes are clamped to the simulation box when its size is
/// known.
public class PlaneProjector {

  private PlaneProjector() {
  }

  /// project two visible axes
  /// @param first
  ///     the first visible axis, with at least two grid points
  /// @param second
  ///     the second visible axis, with at least two grid points
  /// @param ambientDimensions
  ///     the number of spatial dimensions of the simulation
  /// @param boxSize
  ///     the extent of the simulation box per dimension, or null if unknown
  /// @return the cell-edge meshes
  public static PlaneProjection project(AxisGeometry first, AxisGeometry second, int ambientDimensions, double[] boxSize) {
    double[][] p1 = first.centers();
    double[][] p2 = second.centers();
    if (p1.length < 2 || p2.length < 2) {
      throw new IllegalArgumentException(
          "plane projection needs two points per axis, got " + p1.length + " and " + p2.length);
    }
    int dims = p1[0].length;
    double[] d1 = difference(p1[1], p1[0]);
    double[] d2 = difference(p2[1], p2[0]);

    double[][] edges1 = edges(p1, d1, d2);
    double[][] edges2 = edges(p2, d1, d2);

    // plane coordinates (x, y) of every edge
    double[][] e1 = new double[edges1.length][2];
    double[][] e2 = new double[edges2.length][2];

    if (ambientDimensions == 3) {
      Vector3D u1 = new Vector3D(first.displacement()).normalize();
      Vector3D u2 = new Vector3D(second.displacement()).normalize();
      double[] origin = originOffset(new Vector3D(edges1[0]), u1, u2);
      double ox = origin[0];
      double oy = origin[1];
      Vector3D start1 = new Vector3D(edges1[0]);
      for (int i = 0; i < edges1.length; i++) {
        Vector3D rel = new Vector3D(edges1[i]).subtract(start1);
        e1[i][0] = rel.dotProduct(u1) + ox;
        e1[i][1] = oy;
      }
      Vector3D start2 = new Vector3D(edges2[0]);
      for (int j = 0; j < edges2.length; j++) {
        Vector3D rel = new Vector3D(edges2[j]).subtract(start2);
        e2[j][0] = rel.dotProduct(u1) + ox;
        e2[j][1] = rel.dotProduct(u2) + oy;
      }
    } else {
      for (int i = 0; i < edges1.length; i++) {
        e1[i][0] = edges1[i][0];
        e1[i][1] = dims > 1 ? edges1[i][1] : 0.0d;
      }
      for (int j = 0; j < edges2.length; j++) {
        e2[j][0] = edges2[j][0];
        e2[j][1] = dims > 1 ? edges2[j][1] : 0.0d;
      }
    }

    double[][] x = new double[e1.length][e2.length];
    double[][] y = new double[e1.length][e2.length];
    for (int i = 0; i < e1.length; i++) {
      for (int j = 0; j < e2.length; j++) {
        x[i][j] = e1[i][0] + (e2[j][0] - e2[0][0]);
        y[i][j] = e1[i][1] + (e2[j][1] - e2[0][1]);
      }
    }

    if (ambientDimensions == 2 && boxSize != null && boxSize.length >= 2) {
      clamp(x, boxSize[0]);
      clamp(y, boxSize[1]);
    }

    return new PlaneProjection(x, y, range(x), range(y));
  }

  /// The projection of the box origin onto the plane of the probe, in the possibly
  /// non-orthogonal basis `(u1, u2)`.
  /// @param firstEdge
  ///     the first edge point of the probe
  /// @param u1
  ///     unit vector of the first axis
  /// @param u2
  ///     unit vector of the second axis
  /// @return `{Ox, Oy}`
  public static double[] originOffset(Vector3D firstEdge, Vector3D u1, Vector3D u2) {
    double u1u2 = u1.dotProduct(u2);
    double ox = firstEdge.dotProduct(u1);
    double oy = (firstEdge.dotProduct(u2) - ox * u1u2) / (1.0d - u1u2 * u1u2);
    return new double[]{ox, oy};
  }

  private static double[][] edges(double[][] centers, double[] d1, double[] d2) {
    int dims = centers[0].length;
    double[] last = centers[centers.length - 1];
    double[] along = difference(centers[1], centers[0]);
    double[][] edges = new double[centers.length + 1][dims];
    for (int i = 0; i <= centers.length; i++) {
      for (int c = 0; c < dims; c++) {
        double value = i < centers.length ? centers[i][c] : last[c] + along[c];
        edges[i][c] = value - 0.5d * (d1[c] + d2[c]);
      }
    }
    return edges;
  }

  private static double[] difference(double[] a, double[] b) {
    double[] d = new double[a.length];
    for (int i = 0; i < d.length; i++) {
      d[i] = a[i] - b[i];
    }
    return d;
  }

  private static void clamp(double[][] mesh, double upper) {
    for (double[] row : mesh) {
      for (int j = 0; j < row.length; j++) {
        row[j] = Math.min(Math.max(row[j], 0.0d), upper);
      }
    }
  }

  private static double[] range(double[][] mesh) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double[] row : mesh) {
      for (double v : row) {
        min = Math.min(min, v);
        max = Math.max(max, v);
      }
    }
    return new double[]{min, max};
  }
}
