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

package io.probetools.command.probe;

import io.probetools.command.probe.subcommands.CMD_probe_extract;
import io.probetools.command.probe.subcommands.CMD_probe_info;
import io.probetools.command.probe.subcommands.CMD_probe_limits;
import io.probetools.command.probe.subcommands.CMD_probe_list;
import io.probetools.command.probe.subcommands.CMD_probe_timesteps;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The probe command contains subcommands to inspect probe files and extract their data on the
/// probe grid.
///
/// This is an umbrella command for the probe subcommands.
@CommandLine.Command(name = "probe",
    header = "Inspect probes and extract their data",
    description = "Contains subcommands to list probes, describe them and extract gridded data",
    subcommands = {
        CMD_probe_list.class,
        CMD_probe_info.class,
        CMD_probe_timesteps.class,
        CMD_probe_limits.class,
        CMD_probe_extract.class
    })
public class CMD_probe implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Run CMD_probe
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_probe()).execute(args));
    }

    /// Print help information, as no subcommand was given
    ///
    /// @return 0
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
