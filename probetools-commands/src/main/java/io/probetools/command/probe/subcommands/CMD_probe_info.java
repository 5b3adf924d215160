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
import io.probetools.probedata.diagnostic.ProbeDiagnostic;
import io.probetools.probedata.geometry.AxisGeometry;
import io.probetools.probedata.ordering.Ordering;
import io.probetools.probedata.storage.ProbeCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.concurrent.Callable;

/// Describe one probe.
///
/// Without a field, prints what the probe file declares. With a field, also resolves the axis
/// selection and reports the reconstructed grid.
///
/// ```bash
/// probetools probe info -p 0
/// probetools probe info -p 0 -f Ex --subset axis1=0:10
/// ```
@CommandLine.Command(
    name = "info",
    header = "Describe a probe",
    description = "Shows the geometry and fields of a probe, and the grid of a selection on it.",
    exitCodeList = {
        "0: Success",
        "1: Invalid options",
        "2: Error reading results"
    }
)
public class CMD_probe_info implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_probe_info.class);

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
            PrintWriter out = spec.commandLine().getOut();
            Integer probe = diagnosticOption.getProbe();
            if (probe == null) {
                throw new ProbeConfigurationException("Argument `probe` not provided\n" + catalog.availableProbes());
            }
            if (diagnosticOption.getField() == null) {
                out.println(catalog.describe(probe));
                return ProbeCommandSupport.EXIT_SUCCESS;
            }
            try (ProbeDiagnostic diagnostic = ProbeDiagnostic.open(catalog, diagnosticOption.toProbeOptions())) {
                out.println(diagnostic.info());
                out.println("Axes:");
                for (AxisGeometry axis : diagnostic.axes()) {
                    double[] distances = axis.distances();
                    out.printf("  %s: %d points, %s to %s %s%n", axis.label(), axis.length(), distances[0],
                        distances[distances.length - 1], axis.units());
                }
                Ordering ordering = diagnostic.ordering();
                out.printf("Grid: %s of %d points, %d filled, %d absent%n",
                    Arrays.toString(diagnostic.selection().outputShape()), ordering.size(),
                    ordering.filledSlots(), ordering.absentSlots());
                out.printf("Quantity: %s [%s]%n", diagnostic.expression().title(), diagnostic.expression().units());
                out.printf("Timesteps: %d selected of %d%n", diagnostic.timesteps().length,
                    diagnostic.availableTimesteps().length);
            }
            return ProbeCommandSupport.EXIT_SUCCESS;
        } catch (RuntimeException e) {
            return ProbeCommandSupport.fail(spec, logger, e);
        }
    }
}
