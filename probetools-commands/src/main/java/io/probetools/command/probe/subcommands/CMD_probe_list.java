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

import io.probetools.command.common.ResultsPathOption;
import io.probetools.command.common.VerbosityOption;
import io.probetools.probedata.storage.ProbeCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// List the probes of a simulation.
///
/// ```bash
/// probetools probe list --results run1,run2
/// ```
@CommandLine.Command(
    name = "list",
    header = "List available probes",
    description = "Describes every probe found in the results directories.",
    exitCodeList = {
        "0: Success",
        "1: Invalid options",
        "2: Error reading results"
    }
)
public class CMD_probe_list implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_probe_list.class);

    @CommandLine.Mixin
    private ResultsPathOption resultsPathOption = new ResultsPathOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            verbosityOption.apply();
            ProbeCatalog catalog = resultsPathOption.catalog();
            logger.debug("listing probes in {}", resultsPathOption);
            spec.commandLine().getOut().println(catalog.availableProbes());
            return ProbeCommandSupport.EXIT_SUCCESS;
        } catch (RuntimeException e) {
            return ProbeCommandSupport.fail(spec, logger, e);
        }
    }
}
