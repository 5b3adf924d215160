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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PlaneProjector")
class PlaneProjectorTest {

  private static List<AxisGeometry> axes(double[] p0, double[][] endpoints, int[] shape) {
    return AxisGeometryBuilder.build(ProbeGeometry.of(p0, endpoints, shape, 0));
  }

  @Test
  @DisplayName("builds a mesh of cell edges one larger than the grid in 2D")
  void edgesIn2d() {
    List<AxisGeometry> axes = axes(new double[]{0, 0}, new double[][]{{3, 0}, {0, 2}}, new int[]{4, 3});

    PlaneProjection plane = PlaneProjector.project(axes.get(0), axes.get(1), 2, null);

    assertThat(plane.rows()).isEqualTo(5);
    assertThat(plane.columns()).isEqualTo(4);
    assertThat(plane.x()[0][0]).isCloseTo(-0.5, within(1e-12));
    assertThat(plane.y()[0][3]).isCloseTo(2.5, within(1e-12));
    assertThat(plane.xRange()).containsExactly(-0.5, 3.5);
    assertThat(plane.yRange()).containsExactly(-0.5, 2.5);
  }

  @Test
  @DisplayName("clamps a 2D mesh to the simulation box when its size is known")
  void clampsToBox() {
    List<AxisGeometry> axes = axes(new double[]{0, 0}, new double[][]{{3, 0}, {0, 2}}, new int[]{4, 3});

    PlaneProjection plane = PlaneProjector.project(axes.get(0), axes.get(1), 2, new double[]{3, 2});

    assertThat(plane.xRange()).containsExactly(0.0, 3.0);
    assertThat(plane.yRange()).containsExactly(0.0, 2.0);
  }

  @Test
  @DisplayName("projects a plane perpendicular to z onto its own coordinates")
  void perpendicularPlaneIn3d() {
    List<AxisGeometry> axes = axes(new double[]{1, 2, 3},
        new double[][]{{4, 2, 3}, {1, 4, 3}}, new int[]{4, 3});

    PlaneProjection plane = PlaneProjector.project(axes.get(0), axes.get(1), 3, null);

    assertThat(plane.rows()).isEqualTo(5);
    assertThat(plane.columns()).isEqualTo(4);
    assertThat(plane.xRange()[0]).isCloseTo(0.5, within(1e-9));
    assertThat(plane.xRange()[1]).isCloseTo(4.5, within(1e-9));
    assertThat(plane.yRange()[0]).isCloseTo(1.5, within(1e-9));
    assertThat(plane.yRange()[1]).isCloseTo(4.5, within(1e-9));
  }

  @Test
  @DisplayName("does not clamp a plane of a 3D simulation")
  void noClampIn3d() {
    List<AxisGeometry> axes = axes(new double[]{0, 0, 0},
        new double[][]{{3, 0, 0}, {0, 2, 0}}, new int[]{4, 3});

    PlaneProjection plane = PlaneProjector.project(axes.get(0), axes.get(1), 3, new double[]{3, 2, 1});

    assertThat(plane.xRange()[0]).isCloseTo(-0.5, within(1e-9));
  }

  @Test
  @DisplayName("gives the oblique coordinates of the origin in a tilted basis")
  void obliqueOrigin() {
    Vector3D u1 = new Vector3D(1, 0, 0);
    Vector3D u2 = new Vector3D(1, 1, 0).normalize();
    Vector3D edge = u1.scalarMultiply(2).add(u2.scalarMultiply(3));

    double[] origin = PlaneProjector.originOffset(edge, u1, u2);

    assertThat(origin[0]).isCloseTo(2 + 3 / Math.sqrt(2), within(1e-9));
    assertThat(origin[1]).isCloseTo(3.0, within(1e-9));
  }

  @Test
  @DisplayName("needs at least two points per axis")
  void rejectsSinglePointAxes() {
    List<AxisGeometry> axes = axes(new double[]{0, 0}, new double[][]{{3, 0}, {0, 2}}, new int[]{4, 1});

    assertThatThrownBy(() -> PlaneProjector.project(axes.get(0), axes.get(1), 2, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
