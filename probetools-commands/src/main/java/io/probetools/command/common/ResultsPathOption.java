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

package io.probetools.command.common;

import io.probetools.probedata.storage.ProbeCatalog;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Option for the results directories of a simulation.
///
/// A simulation restarted several times writes one results directory per run. Timesteps found
/// in a later directory replace those of an earlier one.
public class ResultsPathOption {

    @CommandLine.Option(
        names = {"-r", "--results"},
        split = ",",
        paramLabel = "DIR",
        description = "Results directories, in simulation order (default: ${DEFAULT-VALUE})",
        defaultValue = "."
    )
    private List<Path> resultsPaths = new ArrayList<>(List.of(Path.of(".")));

    /// @return a catalog over the results directories
    public ProbeCatalog catalog() {
        return new ProbeCatalog(resultsPaths);
    }

    @Override
    public String toString() {
        return resultsPaths.toString();
    }
}
