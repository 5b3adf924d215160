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

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

/// Optional output file; commands write to standard output when none is given.
public class OutputFileOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "FILE",
        description = "The output file path (default: standard output)"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    /// @return the output file, or null for standard output
    public Path getOutputPath() {
        return outputPath;
    }

    /// @return true if writing to a file
    public boolean isFile() {
        return outputPath != null;
    }

    /**
     * Checks that the output file does not exist, unless overwriting is forced.
     *
     * @throws IllegalStateException if the file exists and --force was not given
     */
    public void validate() {
        if (outputPath != null && Files.exists(outputPath) && !force) {
            throw new IllegalStateException(
                "Output file already exists: " + outputPath + ". Use --force to overwrite."
            );
        }
    }

    @Override
    public String toString() {
        if (outputPath == null) {
            return "stdout";
        }
        return force ? outputPath + " (force)" : outputPath.toString();
    }
}
