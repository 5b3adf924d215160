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

import io.probetools.probedata.ProbeConfigurationException;
import io.probetools.probedata.diagnostic.TimestepSelection;
import picocli.CommandLine;

/// Option selecting the timesteps a command works on.
///
/// Supported forms:
/// - `all` - every recorded timestep
/// - `t` - the recorded timestep nearest to `t`
/// - `a:b` - recorded timesteps between `a` and `b`, inclusive
/// - `#i` or `#i:j` - recorded timesteps by position
public class TimestepOption {

    @CommandLine.Option(
        names = {"-t", "--timesteps"},
        paramLabel = "SELECTION",
        description = "Timesteps to use: all, t, a:b, #i or #i:j (default: ${DEFAULT-VALUE})",
        defaultValue = "all",
        converter = TimestepConverter.class
    )
    private TimestepSelection timesteps = TimestepSelection.all();

    /// @return the timestep selection
    public TimestepSelection getTimesteps() {
        return timesteps;
    }

    /// Picocli type converter for [TimestepSelection] specifications.
    public static class TimestepConverter implements CommandLine.ITypeConverter<TimestepSelection> {

        @Override
        public TimestepSelection convert(String value) {
            try {
                return TimestepSelection.parse(value);
            } catch (ProbeConfigurationException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
