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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProbeGeometry")
class ProbeGeometryTest {

  @Test
  @DisplayName("keeps axes of length 1 when the probe has more than one point")
  void keepsDegenerateAxesOfAGrid() {
    ProbeGeometry geometry = ProbeGeometry.of(new double[]{0, 0, 0},
        new double[][]{{3, 0, 0}, {0, 1, 0}, {0, 0, 1}}, new int[]{4, 1, 1}, 4);

    assertThat(geometry.naxes()).isEqualTo(3);
    assertThat(geometry.ambientDimensions()).isEqualTo(3);
    assertThat(geometry.displacement(0)).containsExactly(3.0, 0.0, 0.0);
  }

  @Test
  @DisplayName("rejects more than three axes")
  void rejectsTooManyAxes() {
    assertThatThrownBy(() -> ProbeGeometry.of(new double[]{0, 0},
        new double[][]{{1, 0}, {0, 1}, {1, 1}, {2, 2}}, new int[]{2, 2, 2, 2}, 16))
        .isInstanceOf(ProbeConfigurationException.class)
        .hasMessageContaining("at most 3");
  }

  @Test
  @DisplayName("rejects endpoints of another dimensionality than p0")
  void rejectsMismatchedEndpoints() {
    assertThatThrownBy(() -> ProbeGeometry.of(new double[]{0, 0},
        new double[][]{{1, 0, 0}}, new int[]{2}, 2))
        .isInstanceOf(ProbeConfigurationException.class)
        .hasMessageContaining("endpoint p1");
  }

  @Test
  @DisplayName("rejects axes with no point")
  void rejectsEmptyAxes() {
    assertThatThrownBy(() -> ProbeGeometry.of(new double[]{0, 0},
        new double[][]{{1, 0}, {0, 1}}, new int[]{0, 3}, 0))
        .isInstanceOf(ProbeConfigurationException.class)
        .hasMessageContaining("axis1 declares 0 points");
  }
}
