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
import io.probetools.probedata.selection.RangeRequest;
import picocli.CommandLine;

import java.util.LinkedHashMap;
import java.util.Map;

/// Options restricting or averaging the probe axes.
///
/// Each option takes `axisN=RANGE`, where `RANGE` is one of:
/// - `all` - the whole axis
/// - `x` - the grid point nearest to the distance `x` from `p0`
/// - `a:b` or `a:b:step` - grid points between distances `a` and `b`
/// - `[m,n)`, `[m,n):step` or `m..n` - grid points by index
///
/// ```bash
/// probetools probe extract -p 0 -f Ex --subset axis1=0:20 --average axis2=all
/// ```
public class AxisSelectionOption {

    @CommandLine.Option(
        names = {"-s", "--subset"},
        paramLabel = "AXIS=RANGE",
        description = "Restrict an axis to a range of its grid points"
    )
    private Map<String, String> subset = new LinkedHashMap<>();

    @CommandLine.Option(
        names = {"-a", "--average"},
        paramLabel = "AXIS=RANGE",
        description = "Average the data over a range of an axis"
    )
    private Map<String, String> average = new LinkedHashMap<>();

    /// @return the subset requests by axis label
    /// @throws ProbeConfigurationException if a range is malformed
    public Map<String, RangeRequest> getSubset() {
        return parse(subset, "subset");
    }

    /// @return the average requests by axis label
    /// @throws ProbeConfigurationException if a range is malformed
    public Map<String, RangeRequest> getAverage() {
        return parse(average, "average");
    }

    private static Map<String, RangeRequest> parse(Map<String, String> specs, String option) {
        Map<String, RangeRequest> requests = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : specs.entrySet()) {
            try {
                requests.put(entry.getKey().trim(), RangeRequest.parse(entry.getValue()));
            } catch (ProbeConfigurationException e) {
                throw new ProbeConfigurationException("--" + option + " " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        return requests;
    }
}
