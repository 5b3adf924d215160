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

package io.probetools.command;

import io.probetools.command.probe.CMD_probe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Tools for reading the probe diagnostics of particle-in-cell simulations
@CommandLine.Command(name = "probetools",
    header = "Read and reconstruct simulation probe data",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_probe.class
    })
public class ProbeTools implements Runnable {
    private static final Logger logger = LogManager.getLogger(ProbeTools.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// run a probetools command
    /// @param args command line args
    public static void main(String[] args) {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
        System.exit(commandLine().execute(args));
    }

    /// @return the command line of all probetools commands
    public static CommandLine commandLine() {
        return new CommandLine(new ProbeTools())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public void run() {
        logger.debug("no subcommand given");
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
