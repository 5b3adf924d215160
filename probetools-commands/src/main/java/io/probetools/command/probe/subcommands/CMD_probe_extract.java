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
import io.probetools.command.common.OutputFileOption;
import io.probetools.command.common.ResultsPathOption;
import io.probetools.command.common.VerbosityOption;
import io.probetools.command.probe.output.FrameFormat;
import io.probetools.command.probe.output.FrameWriter;
import io.probetools.probedata.diagnostic.ProbeDiagnostic;
import io.probetools.probedata.extract.ProbeFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

/// Extract probe data on its grid.
///
/// Reads the raw points of the probe once to order them on the grid, then gathers the selected
/// field expression at every selected timestep.
///
/// ## Usage
///
/// ```bash
/// probetools probe extract -p 0 -f Ex
/// probetools probe extract -p 2 -f "sqrt(Ex^2+Ey^2)" -t 1000:2000 --average axis2=all --format json -o e.json
/// ```
@CommandLine.Command(
    name = "extract",
    header = "Extract probe data on its grid",
    description = "Writes a field expression of a probe, reordered on the probe grid, for selected timesteps.",
    exitCodeList = {
        "0: Success",
        "1: Invalid options",
        "2: Error reading results or writing output"
    }
)
public class CMD_probe_extract implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_probe_extract.class);

    @CommandLine.Mixin
    private ResultsPathOption resultsPathOption = new ResultsPathOption();

    @CommandLine.Mixin
    private DiagnosticOption diagnosticOption = new DiagnosticOption();

    @CommandLine.Option(
        names = {"--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "csv"
    )
    private FrameFormat format = FrameFormat.csv;

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            verbosityOption.apply();
            outputFileOption.validate();
            try (ProbeDiagnostic diagnostic = ProbeDiagnostic.open(resultsPathOption.catalog(),
                diagnosticOption.toProbeOptions())) {
                List<ProbeFrame> frames = diagnostic.data();
                logger.info("extracted {} timestep(s) of {} over {}", frames.size(), diagnostic.expression(),
                    diagnostic.ordering());
                write(diagnostic, frames);
            }
            return ProbeCommandSupport.EXIT_SUCCESS;
        } catch (RuntimeException e) {
            return ProbeCommandSupport.fail(spec, logger, e);
        }
    }

    private void write(ProbeDiagnostic diagnostic, List<ProbeFrame> frames) {
        FrameWriter writer = new FrameWriter(format);
        try {
            if (outputFileOption.isFile()) {
                try (Writer out = Files.newBufferedWriter(outputFileOption.getOutputPath(), StandardCharsets.UTF_8)) {
                    writer.write(diagnostic, frames, out);
                }
                logger.info("wrote {}", outputFileOption);
            } else {
                writer.write(diagnostic, frames, spec.commandLine().getOut());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + outputFileOption, e);
        }
    }
}
