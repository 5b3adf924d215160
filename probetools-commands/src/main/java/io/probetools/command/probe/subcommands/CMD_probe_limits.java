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
import io.probetools.probedata.diagnostic.ProbeDiagnostic;
import io.probetools.probedata.geometry.AxisGeometryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/// Print the coordinate ranges of the data a selection would extract.
///
/// A single visible axis is bounded by the distances of its points from `p0`; a plane by the
/// ranges of its projected cell edges.
///
/// ```bash
/// probetools probe limits -p 1 -f Ex --box-size 20,10
/// ```
@CommandLine.Command(
    name = "limits",
    header = "Show the coordinate limits of a selection",
    description = "Prints the plotting limits of the visible axes of a probe selection.",
    exitCodeList = {
        "0: Success",
        "1: Invalid options",
        "2: Error reading results"
    }
)
public class CMD_probe_limits implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_probe_limits.class);

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
            try (ProbeDiagnostic diagnostic = ProbeDiagnostic.open(resultsPathOption.catalog(),
                diagnosticOption.toProbeOptions())) {
                PrintWriter out = spec.commandLine().getOut();
                List<double[]> limits = diagnostic.limits();
                if (limits.isEmpty()) {
                    out.println("no visible axis");
                } else if (limits.size() == 1) {
                    String label = diagnostic.selection().visibleAxes().get(0).label();
                    out.printf("%s: %s %s %s%n", label, limits.get(0)[0], limits.get(0)[1],
                        AxisGeometryBuilder.LENGTH_UNITS);
                } else {
                    out.printf("x: %s %s %s%n", limits.get(0)[0], limits.get(0)[1], AxisGeometryBuilder.LENGTH_UNITS);
                    out.printf("y: %s %s %s%n", limits.get(1)[0], limits.get(1)[1], AxisGeometryBuilder.LENGTH_UNITS);
                }
            }
            return ProbeCommandSupport.EXIT_SUCCESS;
        } catch (RuntimeException e) {
            return ProbeCommandSupport.fail(spec, logger, e);
        }
    }
}
