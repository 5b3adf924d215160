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

package io.probetools.command.probe.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.probetools.probedata.diagnostic.ProbeDiagnostic;
import io.probetools.probedata.extract.ProbeFrame;
import io.probetools.probedata.geometry.AxisGeometry;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/// Writes extracted frames in one of the [FrameFormat]s.
///
/// ## CSV
///
/// A header names the timestep, the index and distance along every visible axis, and the
/// quantity with its units. Each following row holds one grid point of one timestep.
///
/// ```
/// timestep,axis1,axis1_distance,Ex [E_r]
/// 100,0,0.0,0.25
/// ```
///
/// ## JSON
///
/// A single document with the probe, the quantity, the visible axes and one entry per frame.
/// Frame values are flattened row-major; absent grid points are written as `NaN`.
public class FrameWriter {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .create();

    private final FrameFormat format;

    /// create a writer
    /// @param format
    ///     the output format
    public FrameWriter(FrameFormat format) {
        this.format = format;
    }

    /// write frames of a diagnostic
    /// @param diagnostic
    ///     the diagnostic the frames were extracted from
    /// @param frames
    ///     the frames
    /// @param out
    ///     the destination
    /// @throws IOException
    ///     if the destination cannot be written
    public void write(ProbeDiagnostic diagnostic, List<ProbeFrame> frames, Writer out) throws IOException {
        switch (format) {
            case csv:
                writeCsv(diagnostic, frames, out);
                break;
            case json:
                writeJson(diagnostic, frames, out);
                break;
            default:
                throw new IllegalStateException("unhandled format " + format);
        }
        out.flush();
    }

    private void writeCsv(ProbeDiagnostic diagnostic, List<ProbeFrame> frames, Writer out) throws IOException {
        List<AxisGeometry> axes = diagnostic.selection().visibleAxes();
        double[][] distances = new double[axes.size()][];
        StringBuilder header = new StringBuilder("timestep");
        for (int a = 0; a < axes.size(); a++) {
            AxisGeometry axis = axes.get(a);
            distances[a] = axis.distances();
            header.append(',').append(axis.label()).append(',').append(axis.label()).append("_distance");
        }
        header.append(',').append(quantity(diagnostic.expression().title(), diagnostic.expression().units()));
        out.write(header.toString());
        out.write('\n');

        for (ProbeFrame frame : frames) {
            int[] shape = frame.shape();
            int[] index = new int[shape.length];
            for (double value : frame.values()) {
                StringBuilder row = new StringBuilder().append(frame.timestep());
                for (int a = 0; a < shape.length; a++) {
                    row.append(',').append(index[a]).append(',').append(distances[a][index[a]]);
                }
                row.append(',').append(value);
                out.write(row.toString());
                out.write('\n');
                increment(index, shape);
            }
        }
    }

    private void writeJson(ProbeDiagnostic diagnostic, List<ProbeFrame> frames, Writer out) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("probe", diagnostic.metadata().probeNumber());
        document.put("field", diagnostic.expression().toString());
        document.put("title", diagnostic.expression().title());
        document.put("units", diagnostic.expression().units());
        document.put("selection", diagnostic.selection().descriptions());

        List<Map<String, Object>> axes = new ArrayList<>();
        for (AxisGeometry axis : diagnostic.selection().visibleAxes()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("label", axis.label());
            entry.put("units", axis.units());
            entry.put("distances", axis.distances());
            axes.add(entry);
        }
        document.put("axes", axes);

        List<Map<String, Object>> entries = new ArrayList<>();
        for (ProbeFrame frame : frames) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("timestep", frame.timestep());
            OptionalDouble moved = diagnostic.xMoved(frame.timestep());
            if (moved.isPresent()) {
                entry.put("x_moved", moved.getAsDouble());
            }
            entry.put("shape", frame.shape());
            entry.put("values", frame.values());
            entries.add(entry);
        }
        document.put("frames", entries);
        GSON.toJson(document, out);
    }

    static String quantity(String title, String units) {
        return units.isEmpty() ? title : title + " [" + units + "]";
    }

    // row-major odometer
    private static void increment(int[] index, int[] shape) {
        for (int d = shape.length - 1; d >= 0; d--) {
            if (++index[d] < shape[d]) {
                return;
            }
            index[d] = 0;
        }
    }
}
