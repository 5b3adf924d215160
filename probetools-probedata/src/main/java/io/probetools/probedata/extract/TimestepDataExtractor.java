package io.probetools.probedata.extract;

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

import io.probetools.probedata.expression.EvaluatedField;
import io.probetools.probedata.expression.FieldExpression;
import io.probetools.probedata.ordering.ChunkedRange;
import io.probetools.probedata.ordering.Ordering;
import io.probetools.probedata.selection.ProbeSelection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Gathers the values of a [FieldExpression] at one timestep onto the probe grid.
///
/// For every field the expression reads, raw values are read chunk by chunk, in the same chunk
/// size the ordering was built with, and scattered into a grid buffer through the [Ordering].
/// Slots with no recorded point read as `NaN`. The expression is evaluated over the buffers,
/// then averaged axes are reduced by their arithmetic mean and non-visible axes squeezed out.
public class TimestepDataExtractor {
  private static final Logger logger = LogManager.getLogger(TimestepDataExtractor.class);

  private final Ordering ordering;
  private final ProbeSelection selection;
  private final long numpoints;
  private final int chunkSize;

  /// create an extractor
  /// @param ordering
  ///     the ordering of the probe points
  /// @param selection
  ///     the selection the ordering was built for
  /// @param numpoints
  ///     the number of points recorded in storage
  /// @param chunkSize
  ///     the number of raw values read at once
  public TimestepDataExtractor(Ordering ordering, ProbeSelection selection, long numpoints, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunk size must be positive: " + chunkSize);
    }
    if (!selection.isPointProbe() && ordering.size() != selection.size()) {
      throw new IllegalArgumentException(
          "ordering of " + ordering.size() + " slots does not match a selection of " + selection.size());
    }
    this.ordering = ordering;
    this.selection = selection;
    this.numpoints = numpoints;
    this.chunkSize = chunkSize;
  }

  /// extract one timestep
  /// @param timestep
  ///     the timestep, known to the reader
  /// @param expression
  ///     the quantity to compute
  /// @param fields
  ///     the names of the probe fields, in storage order
  /// @param reader
  ///     reader of raw field values
  /// @return the frame over the visible axes
  public ProbeFrame extract(long timestep, FieldExpression expression, List<String> fields, FieldReader reader) {
    Map<String, double[]> buffers = new LinkedHashMap<>();
    for (String variable : expression.variables()) {
      int fieldIndex = fields.indexOf(variable);
      if (fieldIndex < 0) {
        throw new IllegalArgumentException("field " + variable + " is not recorded by this probe: " + fields);
      }
      buffers.put(variable, gather(timestep, fieldIndex, reader));
    }

    EvaluatedField evaluated = expression.evaluate(buffers);
    double[] values = evaluated.values();
    if (values.length != ordering.size()) {
      throw new IllegalStateException(
          "expression returned " + values.length + " values for " + ordering.size() + " grid slots");
    }

    int[] shape = selection.selectedShape();
    for (int axis = 0; axis < selection.naxes(); axis++) {
      if (selection.isAveraged(axis)) {
        values = GridReductions.meanAlongAxis(values, shape, axis);
        shape[axis] = 1;
      }
    }
    int[] outputShape = selection.outputShape();
    logger.debug("timestep {}: {} over shape {} -> {}", timestep, evaluated.title(),
        Arrays.toString(selection.selectedShape()), Arrays.toString(outputShape));
    return new ProbeFrame(timestep, values, outputShape, evaluated.title(), evaluated.units());
  }

  private double[] gather(long timestep, int fieldIndex, FieldReader reader) {
    double[] buffer = new double[ordering.size()];
    Arrays.fill(buffer, Double.NaN);
    for (ChunkedRange.Chunk chunk : new ChunkedRange(numpoints, chunkSize)) {
      double[] data = null;
      for (int slot = 0; slot < buffer.length; slot++) {
        long raw = ordering.rawIndexAt(slot);
        if (raw == Ordering.ABSENT || !chunk.contains(raw)) {
          continue;
        }
        if (data == null) {
          data = reader.readField(timestep, fieldIndex, chunk.first(), chunk.count());
        }
        buffer[slot] = data[(int) (raw - chunk.first())];
      }
    }
    return buffer;
  }
}
