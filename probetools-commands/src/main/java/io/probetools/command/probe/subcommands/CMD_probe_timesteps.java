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

package io.probetools.command.probe.subcommands;

import io.probetools.command.common.DiagnosticOption;
import io.probetools.command.common.ResultsPathOption;
import io.probetools.command.common.VerbosityOption;
import io.probetools.probedata.ProbeConfigurationException;
import io.probetools.probedata.ProbeStorageException;
import io.probetools.probedata.storage.ProbeCatalog;
import io.probetools.probedata.storage.ProbeStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;

/// List the timesteps a probe recorded, one per line, with the moving window shift when known.
///
/// ```bash
/// probetools probe timesteps -p 0 -t 1000:5000
/// ```
@CommandLine.Command(
    name = "timesteps",
    header = "List the timesteps of a probe",
    description = "Prints the recorded timesteps matching a selection.",
    exitCodeList = {
        "0: Success",
        "1: Invalid options",
        "2: Error reading results"
    }
)
public class CMD_probe_timesteps implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_probe_timesteps.class);

    @CommandLine.Mixin
    private ResultsPathOption resultsPathOption = new ResultsPathOption();

    @CommandLine.Mixin
    private DiagnosticOption diagnosticOption = new DiagnosticOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            verbosityOption.apply();
            ProbeCatalog catalog = resultsPathOption.catalog();
            Integer probe = diagnosticOption.getProbe();
            if (probe == null) {
                throw new ProbeConfigurationException("Argument `probe` not provided\n" + catalog.availableProbes());
            }
            try (ProbeStore store = catalog.open(probe)) {
                long[] available = store.timesteps().stream().mapToLong(Long::longValue).toArray();
                long[] selected = diagnosticOption.getTimestepOption().getTimesteps().select(available);
                if (selected.length == 0) {
                    throw new ProbeStorageException("Timesteps not found");
                }
                PrintWriter out = spec.commandLine().getOut();
                for (long timestep : selected) {
                    OptionalDouble moved = store.xMoved(timestep);
                    if (moved.isPresent()) {
                        out.println(timestep + "\t" + moved.getAsDouble());
                    } else {
                        out.println(timestep);
                    }
                }
            }
            return ProbeCommandSupport.EXIT_SUCCESS;
        } catch (RuntimeException e) {
            return ProbeCommandSupport.fail(spec, logger, e);
        }
    }
}
