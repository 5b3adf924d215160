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

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.WritableDataset;
import io.probetools.probedata.SyntheticProbe;

import java.nio.file.Path;

/// Writes probe files in the layout of the simulation code, from a [SyntheticProbe].
final class ProbeFiles {

  private ProbeFiles() {
  }

  static Path write(Path dir, int probeNumber, SyntheticProbe probe, boolean timeIntegrated, long... timesteps) {
    ProbeMetadata metadata = probe.metadata();
    int numpoints = (int) metadata.numpoints();
    Path file = dir.resolve(Hdf5ProbeStore.fileName(probeNumber));

    WritableHdfFile writable = HdfFile.write(file);
    writable.putAttribute("dimension", new int[]{metadata.dimension()});
    writable.putAttribute("fields", String.join(",", metadata.fields()));
    writable.putAttribute("time_integral", new int[]{timeIntegrated ? 1 : 0});
    writable.putDataset("number", metadata.shape());
    for (int i = 0; i < metadata.vertices().length; i++) {
      writable.putDataset("p" + i, metadata.vertices()[i]);
    }
    writable.putDataset("positions", probe.readPositions(0, numpoints));
    for (long timestep : timesteps) {
      double[][] data = new double[metadata.fields().size()][];
      for (int field = 0; field < data.length; field++) {
        data[field] = probe.readField(timestep, field, 0, numpoints);
      }
      WritableDataset dataset = writable.putDataset(String.format("%010d", timestep), data);
      dataset.putAttribute("x_moved", new double[]{timestep * 0.5d});
    }
    writable.close();
    return file;
  }
}
