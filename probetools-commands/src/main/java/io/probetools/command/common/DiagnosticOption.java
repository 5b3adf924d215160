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

import io.probetools.probedata.diagnostic.ProbeOptions;
import io.probetools.probedata.ordering.OrderingBuilder;
import picocli.CommandLine;

/// Options configuring a probe diagnostic: the probe, the field expression, the timesteps and the
/// axis selection.
public class DiagnosticOption {

    @CommandLine.Option(
        names = {"-p", "--probe"},
        paramLabel = "N",
        description = "The probe number"
    )
    private Integer probe;

    @CommandLine.Option(
        names = {"-f", "--field"},
        paramLabel = "EXPR",
        description = "A field, or an expression over fields such as Ex^2+Ey^2"
    )
    private String field;

    @CommandLine.Mixin
    private TimestepOption timestepOption = new TimestepOption();

    @CommandLine.Mixin
    private AxisSelectionOption axisSelectionOption = new AxisSelectionOption();

    @CommandLine.Option(
        names = {"--chunk-size"},
        paramLabel = "POINTS",
        description = "Number of probe points read at once (default: ${DEFAULT-VALUE})",
        defaultValue = "" + OrderingBuilder.DEFAULT_CHUNK_SIZE
    )
    private int chunkSize = OrderingBuilder.DEFAULT_CHUNK_SIZE;

    @CommandLine.Option(
        names = {"--box-size"},
        split = ",",
        paramLabel = "LENGTH",
        description = "Size of a 2D simulation box, to clamp plane limits to it"
    )
    private double[] boxSize;

    @CommandLine.Option(
        names = {"--log"},
        description = "Report the base-10 logarithm of the data"
    )
    private boolean dataLog = false;

    /// @return the probe number, or null if not given
    public Integer getProbe() {
        return probe;
    }

    /// @return the field expression, or null if not given
    public String getField() {
        return field;
    }

    /// @return the timestep option
    public TimestepOption getTimestepOption() {
        return timestepOption;
    }

    /// @return the diagnostic options
    public ProbeOptions toProbeOptions() {
        ProbeOptions.Builder builder = ProbeOptions.builder()
            .field(field)
            .timesteps(timestepOption.getTimesteps())
            .subset(axisSelectionOption.getSubset())
            .average(axisSelectionOption.getAverage())
            .chunkSize(chunkSize)
            .boxSize(boxSize)
            .dataLog(dataLog);
        if (probe != null) {
            builder.probe(probe);
        }
        return builder.build();
    }
}
