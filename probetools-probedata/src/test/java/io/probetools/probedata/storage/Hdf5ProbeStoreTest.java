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

import io.probetools.probedata.ProbeStorageException;
import io.probetools.probedata.SyntheticProbe;
import io.probetools.probedata.diagnostic.ProbeDiagnostic;
import io.probetools.probedata.diagnostic.ProbeOptions;
import io.probetools.probedata.extract.ProbeFrame;
import io.probetools.probedata.selection.RangeRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Hdf5ProbeStore")
class Hdf5ProbeStoreTest {

  private static final List<String> FIELDS = List.of("Ex", "Ey", "Rho");

  private static SyntheticProbe plane() {
    return SyntheticProbe.grid(new double[]{0, 0}, new double[][]{{3, 0}, {0, 2}}, new int[]{4, 3}, FIELDS,
        new long[]{0, 100, 200}, 31, SyntheticProbe.LINEAR);
  }

  @Test
  @DisplayName("reads the probe metadata")
  void metadata(@TempDir Path results) {
    ProbeFiles.write(results, 2, plane(), true, 0, 100);

    try (Hdf5ProbeStore store = Hdf5ProbeStore.open(2, List.of(results))) {
      ProbeMetadata metadata = store.metadata();
      assertThat(metadata.probeNumber()).isEqualTo(2);
      assertThat(metadata.dimension()).isEqualTo(2);
      assertThat(metadata.fields()).containsExactly("Ex", "Ey", "Rho");
      assertThat(metadata.timeIntegrated()).isTrue();
      assertThat(metadata.shape()).containsExactly(4, 3);
      assertThat(metadata.numpoints()).isEqualTo(12);
      assertThat(metadata.vertices()[1]).containsExactly(3.0, 0.0);
      assertThat(store.timesteps()).containsExactly(0L, 100L);
      assertThat(metadata.describe()).startsWith("Probe #2: 2-dimensional, with fields Ex,Ey,Rho")
          .contains("number = 4 3");
    }
  }

  @Test
  @DisplayName("reads slices of positions and field values")
  void slices(@TempDir Path results) {
    SyntheticProbe probe = plane();
    ProbeFiles.write(results, 0, probe, false, 0, 100);

    try (Hdf5ProbeStore store = Hdf5ProbeStore.open(0, List.of(results))) {
      double[][] positions = store.readPositions(5, 4);
      assertThat(positions).hasDimensions(4, 2);
      assertThat(positions[0]).containsExactly(probe.readPositions(5, 1)[0]);

      assertThat(store.readField(100, 2, 3, 6)).containsExactly(probe.readField(100, 2, 3, 6));
      assertThat(store.xMoved(100)).hasValue(50.0);
    }
  }

  @Test
  @DisplayName("merges timesteps of several results directories")
  void severalResultsPaths(@TempDir Path results) throws IOException {
    Path first = Files.createDirectory(results.resolve("run1"));
    Path second = Files.createDirectory(results.resolve("run2"));
    SyntheticProbe probe = plane();
    ProbeFiles.write(first, 1, probe, false, 0, 100);
    ProbeFiles.write(second, 1, probe, false, 200);

    try (Hdf5ProbeStore store = Hdf5ProbeStore.open(1, List.of(first, second))) {
      assertThat(store.timesteps()).containsExactly(0L, 100L, 200L);
      assertThat(store.readField(200, 0, 0, 1)).containsExactly(probe.readField(200, 0, 0, 1));
    }
  }

  @Test
  @DisplayName("fails when no probe file can be opened")
  void missingFile(@TempDir Path results) throws IOException {
    byte[] garbage = new byte[4096];
    Arrays.fill(garbage, (byte) 7);
    Files.write(results.resolve(Hdf5ProbeStore.fileName(4)), garbage);

    assertThatThrownBy(() -> Hdf5ProbeStore.open(5, List.of(results)))
        .isInstanceOf(ProbeStorageException.class)
        .hasMessageContaining("Cannot open any file Probes5.h5");
    assertThatThrownBy(() -> Hdf5ProbeStore.open(4, List.of(results)))
        .isInstanceOf(ProbeStorageException.class)
        .hasMessageContaining("Cannot open any file Probes4.h5");
  }

  @Test
  @DisplayName("fails when the probe recorded no timestep")
  void noTimesteps(@TempDir Path results) {
    ProbeFiles.write(results, 0, plane(), false);

    assertThatThrownBy(() -> Hdf5ProbeStore.open(0, List.of(results)))
        .isInstanceOf(ProbeStorageException.class)
        .hasMessageContaining("No timesteps found");
  }

  @Test
  @DisplayName("reconstructs grid data from a probe file")
  void endToEnd(@TempDir Path results) {
    SyntheticProbe probe = plane();
    ProbeFiles.write(results, 0, probe, false, 0, 100, 200);
    ProbeOptions options = ProbeOptions.builder().probe(0).field("Ex+Rho")
        .average("axis1", RangeRequest.all()).chunkSize(5).build();

    try (ProbeDiagnostic diagnostic = ProbeDiagnostic.open(new ProbeCatalog(List.of(results)), options)) {
      ProbeFrame frame = diagnostic.dataAt(200).orElseThrow();

      assertThat(frame.shape()).containsExactly(3);
      for (int j = 0; j < 3; j++) {
        double expected = 0;
        for (int i = 0; i < 4; i++) {
          int[] index = {i, j};
          expected += probe.expected(200, 0, index) + probe.expected(200, 2, index);
        }
        assertThat(frame.get(j)).isCloseTo(expected / 4, within(1e-9));
      }
      assertThat(frame.units()).isEqualTo("E_r");
    }
  }
}
