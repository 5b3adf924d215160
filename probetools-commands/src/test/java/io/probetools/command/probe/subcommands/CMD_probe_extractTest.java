package io.probetools.command.probe.subcommands;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.probetools.command.CommandRun;
import io.probetools.command.ProbeResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("probe extract")
class CMD_probe_extractTest {

    @TempDir
    Path results;

    @BeforeEach
    void writeProbe() {
        ProbeResults.writePlane(results, 0);
    }

    private CommandRun extract(String... args) {
        String[] all = new String[args.length + 2];
        all[0] = "--results";
        all[1] = results.toString();
        System.arraycopy(args, 0, all, 2, args.length);
        return CommandRun.execute(new CMD_probe_extract(), all);
    }

    @Nested
    @DisplayName("CSV output")
    class Csv {

        @Test
        @DisplayName("writes every grid point of a timestep in grid order")
        void gridOrder() {
            CommandRun run = extract("-p", "0", "-f", "Ex", "-t", "200");

            assertThat(run.exitCode()).isEqualTo(0);
            assertThat(run.lines()).containsExactly(
                "timestep,axis1,axis1_distance,axis2,axis2_distance,Ex [E_r]",
                "200,0,0.0,0,0.0,200.0",
                "200,0,0.0,1,1.0,201.0",
                "200,1,1.0,0,0.0,210.0",
                "200,1,1.0,1,1.0,211.0",
                "200,2,2.0,0,0.0,220.0",
                "200,2,2.0,1,1.0,221.0");
        }

        @Test
        @DisplayName("writes one block per selected timestep")
        void timestepRange() {
            CommandRun run = extract("-p", "0", "-f", "Ex", "-t", "150:300", "--subset", "axis1=2", "--subset",
                "axis2=1");

            assertThat(run.exitCode()).isEqualTo(0);
            assertThat(run.lines()).containsExactly("timestep,Ex [E_r]", "200,221.0", "300,321.0");
        }

        @Test
        @DisplayName("averages over an axis")
        void average() {
            CommandRun run = extract("-p", "0", "-f", "Ex", "-t", "100", "--average", "axis2=all");

            assertThat(run.exitCode()).isEqualTo(0);
            assertThat(run.lines()).containsExactly(
                "timestep,axis1,axis1_distance,Ex [E_r]",
                "100,0,0.0,100.5",
                "100,1,1.0,110.5",
                "100,2,2.0,120.5");
        }

        @Test
        @DisplayName("evaluates field expressions")
        void expression() {
            CommandRun run = extract("-p", "0", "-f", "Ex+Ey", "-t", "100", "-s", "axis1=0", "-s", "axis2=0");

            assertThat(run.exitCode()).isEqualTo(0);
            assertThat(run.lines()[1]).isEqualTo("100,0.0");
        }
    }

    @Test
    @DisplayName("writes JSON to an output file")
    void jsonFile() throws IOException {
        Path output = results.resolve("ex.json");

        CommandRun run = extract("-p", "0", "-f", "Ex", "-t", "#0:2", "--format", "JSON", "-o", output.toString());

        assertThat(run.exitCode()).isEqualTo(0);
        assertThat(run.out()).isEmpty();
        JsonObject document = JsonParser.parseString(Files.readString(output)).getAsJsonObject();
        assertThat(document.get("probe").getAsInt()).isEqualTo(0);
        assertThat(document.get("units").getAsString()).isEqualTo("E_r");
        assertThat(document.getAsJsonArray("axes")).hasSize(2);

        JsonArray frames = document.getAsJsonArray("frames");
        assertThat(frames).hasSize(2);
        JsonObject second = frames.get(1).getAsJsonObject();
        assertThat(second.get("timestep").getAsLong()).isEqualTo(200);
        assertThat(second.get("x_moved").getAsDouble()).isCloseTo(100.0, within(1e-12));
        assertThat(second.getAsJsonArray("values").get(5).getAsDouble()).isCloseTo(221.0, within(1e-12));
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("lists the fields when none is given")
        void missingField() {
            CommandRun run = extract("-p", "0");

            assertThat(run.exitCode()).isEqualTo(ProbeCommandSupport.EXIT_CONFIGURATION);
            assertThat(run.err()).contains("Argument `field` not provided").contains("Ex, Ey");
        }

        @Test
        @DisplayName("lists the probes when none is given")
        void missingProbe() {
            CommandRun run = extract("-f", "Ex");

            assertThat(run.exitCode()).isEqualTo(ProbeCommandSupport.EXIT_CONFIGURATION);
            assertThat(run.err()).contains("Argument `probe` not provided").contains("Probe #0");
        }

        @Test
        @DisplayName("rejects an unknown axis")
        void unknownAxis() {
            CommandRun run = extract("-p", "0", "-f", "Ex", "--subset", "axis3=0");

            assertThat(run.exitCode()).isEqualTo(ProbeCommandSupport.EXIT_CONFIGURATION);
            assertThat(run.err()).contains("axis3");
        }

        @Test
        @DisplayName("reports timesteps that match nothing as a storage error")
        void noTimesteps() {
            CommandRun run = extract("-p", "0", "-f", "Ex", "-t", "1000:2000");

            assertThat(run.exitCode()).isEqualTo(ProbeCommandSupport.EXIT_STORAGE);
            assertThat(run.err()).contains("Timesteps not found");
        }

        @Test
        @DisplayName("refuses to overwrite an output file without --force")
        void existingOutput() throws IOException {
            Path output = Files.writeString(results.resolve("taken.csv"), "keep");

            CommandRun refused = extract("-p", "0", "-f", "Ex", "-o", output.toString());
            assertThat(refused.exitCode()).isEqualTo(ProbeCommandSupport.EXIT_CONFIGURATION);
            assertThat(Files.readString(output)).isEqualTo("keep");

            CommandRun forced = extract("-p", "0", "-f", "Ex", "-o", output.toString(), "--force");
            assertThat(forced.exitCode()).isEqualTo(0);
            assertThat(Files.readString(output)).startsWith("timestep,");
        }
    }
}
