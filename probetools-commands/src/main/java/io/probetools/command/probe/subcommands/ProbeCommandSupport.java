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

import io.probetools.probedata.ProbeConfigurationException;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;

/// Exit codes and error reporting shared by the probe subcommands.
final class ProbeCommandSupport {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_CONFIGURATION = 1;
    static final int EXIT_STORAGE = 2;

    private ProbeCommandSupport() {
    }

    /// report a failure to the log and to the error stream of a command
    ///
    /// Invalid requests map to [#EXIT_CONFIGURATION]. Everything else, including failures of the
    /// HDF5 reader or of the output, maps to [#EXIT_STORAGE].
    /// @return the exit code of the failure
    static int fail(CommandLine.Model.CommandSpec spec, Logger logger, RuntimeException e) {
        int exitCode;
        if (e instanceof ProbeConfigurationException
            || e instanceof IllegalStateException
            || e instanceof IllegalArgumentException) {
            logger.error(e.getMessage());
            exitCode = EXIT_CONFIGURATION;
        } else {
            logger.error("storage error: {}", e.getMessage(), e);
            exitCode = EXIT_STORAGE;
        }
        PrintWriter err = spec.commandLine().getErr();
        err.println("Error: " + describe(e));
        err.flush();
        return exitCode;
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
