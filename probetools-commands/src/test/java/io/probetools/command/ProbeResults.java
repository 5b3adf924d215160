package io.probetools.command;

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

import java.nio.file.Path;

/// Writes a small probe file for command tests.
///
/// The probe is a 3 x 2 plane with `p0 = (0, 0)`, `p1 = (2, 0)` and `p2 = (0, 1)`, so the grid
/// point `(i, j)` sits at `(i, j)`. Points are stored out of grid order. At timestep `t`, field
/// `Ex` holds `t + 10 i + j` and `Ey` holds the negation.
public final class ProbeResults {

    public static final long[] TIMESTEPS = {100, 200, 300};

    // storage order of the grid points
    private static final int[][] STORED = {{2, 1}, {0, 0}, {1, 1}, {2, 0}, {0, 1}, {1, 0}};

    private ProbeResults() {
    }

    public static double ex(long timestep, int i, int j) {
        return timestep + 10 * i + j;
    }

    public static Path writePlane(Path dir, int probeNumber) {
        Path file = dir.resolve("Probes" + probeNumber + ".h5");
        WritableHdfFile writable = HdfFile.write(file);
        writable.putAttribute("dimension", new int[]{2});
        writable.putAttribute("fields", "Ex,Ey");
        writable.putAttribute("time_integral", new int[]{0});
        writable.putDataset("number", new int[]{3, 2});
        writable.putDataset("p0", new double[]{0, 0});
        writable.putDataset("p1", new double[]{2, 0});
        writable.putDataset("p2", new double[]{0, 1});

        double[][] positions = new double[STORED.length][];
        for (int k = 0; k < STORED.length; k++) {
            positions[k] = new double[]{STORED[k][0], STORED[k][1]};
        }
        writable.putDataset("positions", positions);

        for (long timestep : TIMESTEPS) {
            double[][] data = new double[2][STORED.length];
            for (int k = 0; k < STORED.length; k++) {
                data[0][k] = ex(timestep, STORED[k][0], STORED[k][1]);
                data[1][k] = -data[0][k];
            }
            WritableDataset dataset = writable.putDataset(String.format("%010d", timestep), data);
            dataset.putAttribute("x_moved", new double[]{timestep * 0.5d});
        }
        writable.close();
        return file;
    }
}
