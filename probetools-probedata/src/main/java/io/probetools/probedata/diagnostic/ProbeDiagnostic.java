package io.probetools.probedata.diagnostic;

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

import io.probetools.probedata.ProbeConfigurationException;
import io.probetools.probedata.ProbeStorageException;
import io.probetools.probedata.expression.FieldOperation;
import io.probetools.probedata.extract.GridReductions;
import io.probetools.probedata.extract.ProbeFrame;
import io.probetools.probedata.extract.TimestepDataExtractor;
import io.probetools.probedata.geometry.AxisGeometry;
import io.probetools.probedata.geometry.AxisGeometryBuilder;
import io.probetools.probedata.geometry.PlaneProjection;
import io.probetools.probedata.geometry.PlaneProjector;
import io.probetools.probedata.geometry.ProbeGeometry;
import io.probetools.probedata.ordering.Ordering;
import io.probetools.probedata.ordering.OrderingBuilder;
import io.probetools.probedata.selection.ProbeSelection;
import io.probetools.probedata.selection.RangeRequest;
import io.probetools.probedata.selection.SelectionAssembler;
import io.probetools.probedata.storage.ProbeCatalog;
import io.probetools.probedata.storage.ProbeMetadata;
import io.probetools.probedata.storage.ProbeStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;

/// A probe diagnostic: one field expression of one probe, over a selection of its grid and of
/// its timesteps.
///
/// Opening a diagnostic resolves the selection and builds the point ordering once. Each call to
/// [#dataAt(long)] then reads only the raw values of one timestep. Changing the field keeps the
/// ordering; changing the subset or average rebuilds it.
public class ProbeDiagnostic implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(ProbeDiagnostic.class);

  private final ProbeStore store;
  private final ProbeMetadata metadata;
  private final ProbeGeometry geometry;
  private final List<AxisGeometry> axes;
  private final long[] availableTimesteps;

  private ProbeOptions options;
  private FieldOperation expression;
  private long[] timesteps;
  private ProbeSelection selection;
  private Ordering ordering;
  private PlaneProjection projection;
  private TimestepDataExtractor extractor;

  private ProbeDiagnostic(ProbeStore store, ProbeOptions options) {
    this.store = store;
    this.metadata = store.metadata();
    this.geometry = metadata.geometry();
    this.axes = AxisGeometryBuilder.build(geometry);
    this.availableTimesteps = store.timesteps().stream().mapToLong(Long::longValue).toArray();
    this.options = options;
    this.expression = parseField(options.field());
    this.timesteps = selectTimesteps(options.timesteps());
    rebuildSelection();
  }

  /// open a diagnostic over an already opened probe
  /// @param store
  ///     the probe store, closed with the diagnostic
  /// @param options
  ///     the diagnostic options
  /// @return the diagnostic
  public static ProbeDiagnostic open(ProbeStore store, ProbeOptions options) {
    try {
      return new ProbeDiagnostic(store, options);
    } catch (RuntimeException e) {
      store.close();
      throw e;
    }
  }

  /// open a diagnostic over a probe of a catalog
  /// @param catalog
  ///     the catalog of probe files
  /// @param options
  ///     the diagnostic options, which must name a probe
  /// @return the diagnostic
  public static ProbeDiagnostic open(ProbeCatalog catalog, ProbeOptions options) {
    if (options.probeNumber() == null) {
      throw new ProbeConfigurationException("Argument `probe` not provided\n" + catalog.availableProbes());
    }
    return open(catalog.open(options.probeNumber()), options);
  }

  private FieldOperation parseField(String field) {
    if (field == null || field.isBlank()) {
      throw new ProbeConfigurationException(
          "Argument `field` not provided\nPrinting available fields for probe #" + metadata.probeNumber()
              + ":\n----------------------------------------\n" + String.join(", ", metadata.fields()));
    }
    return FieldOperation.parse(field, metadata.fields(), metadata.timeIntegrated());
  }

  private long[] selectTimesteps(TimestepSelection selection) {
    long[] selected = selection.select(availableTimesteps);
    if (selected.length == 0) {
      throw new ProbeStorageException("Timesteps not found for selection " + selection);
    }
    return selected;
  }

  private void rebuildSelection() {
    ProbeSelection assembled = SelectionAssembler.assemble(axes, options.subset(), options.average());
    Ordering built = assembled.isPointProbe()
        ? Ordering.pointProbe()
        : new OrderingBuilder(geometry, assembled, options.chunkSize()).build(store);
    PlaneProjection plane = null;
    if (assembled.visibleAxes().size() == 2) {
      plane = PlaneProjector.project(assembled.visibleAxes().get(0), assembled.visibleAxes().get(1),
          geometry.ambientDimensions(), options.boxSize());
    }
    this.selection = assembled;
    this.ordering = built;
    this.projection = plane;
    this.extractor = new TimestepDataExtractor(built, assembled, geometry.numpoints(), options.chunkSize());
    logger.debug("probe #{} selection {} ordered as {}", metadata.probeNumber(),
        Arrays.toString(assembled.selectedShape()), built);
  }

  /// change the field expression, keeping the selection and ordering
  /// @param field
  ///     the new field expression
  public void changeField(String field) {
    this.expression = parseField(field);
    this.options = options.toBuilder().field(field).build();
  }

  /// change the timestep selection
  /// @param selection
  ///     the new timestep selection
  public void changeTimesteps(TimestepSelection selection) {
    this.timesteps = selectTimesteps(selection);
    this.options = options.toBuilder().timesteps(selection).build();
  }

  /// change the subset and average requests, rebuilding the ordering
  /// @param subset
  ///     subset requests by axis label
  /// @param average
  ///     average requests by axis label
  public void reconfigure(Map<String, RangeRequest> subset, Map<String, RangeRequest> average) {
    ProbeOptions previous = options;
    this.options = options.toBuilder().subset(subset).average(average).build();
    try {
      rebuildSelection();
    } catch (RuntimeException e) {
      this.options = previous;
      throw e;
    }
  }

  /// @return the probe metadata
  public ProbeMetadata metadata() {
    return metadata;
  }

  /// @return the options in effect
  public ProbeOptions options() {
    return options;
  }

  /// @return every recorded timestep, ascending
  public long[] availableTimesteps() {
    return availableTimesteps.clone();
  }

  /// @return the selected timesteps, ascending
  public long[] timesteps() {
    return timesteps.clone();
  }

  /// @return the field names recorded by the probe
  public List<String> fields() {
    return metadata.fields();
  }

  /// @return the field expression
  public FieldOperation expression() {
    return expression;
  }

  /// @return the resolved selection
  public ProbeSelection selection() {
    return selection;
  }

  /// @return the point ordering of the current selection
  public Ordering ordering() {
    return ordering;
  }

  /// @return the geometry of every probe axis
  public List<AxisGeometry> axes() {
    return axes;
  }

  /// @return the plane projection, present when exactly two axes are visible
  public Optional<PlaneProjection> projection() {
    return Optional.ofNullable(projection);
  }

  /// The coordinate ranges of the visible data.
  /// @return nothing for a scalar result, the distance range along a single visible axis, or the
  ///     x and y ranges of the plane projection
  public List<double[]> limits() {
    List<AxisGeometry> visible = selection.visibleAxes();
    List<double[]> limits = new ArrayList<>();
    switch (visible.size()) {
      case 0:
        break;
      case 1:
        double[] distances = visible.get(0).distances();
        limits.add(new double[]{
            Arrays.stream(distances).min().orElse(0.0d),
            Arrays.stream(distances).max().orElse(0.0d)});
        break;
      case 2:
        limits.add(projection.xRange().clone());
        limits.add(projection.yRange().clone());
        break;
      default:
        throw new IllegalStateException("cannot compute limits of " + visible.size() + " visible axes");
    }
    return limits;
  }

  /// extract the field expression at one timestep
  /// @param timestep
  ///     a selected timestep
  /// @return the frame, empty if the timestep is not part of this diagnostic
  public Optional<ProbeFrame> dataAt(long timestep) {
    if (Arrays.binarySearch(timesteps, timestep) < 0) {
      logger.warn("Timestep {} not found in this diagnostic", timestep);
      return Optional.empty();
    }
    ProbeFrame frame = extractor.extract(timestep, expression, metadata.fields(), store);
    if (options.dataLog()) {
      frame = new ProbeFrame(frame.timestep(), GridReductions.log10(frame.values()), frame.shape(),
          "log10( " + frame.title() + " )", frame.units());
    }
    DoubleUnaryOperator transform = options.dataTransform();
    if (transform != null) {
      double[] values = frame.values().clone();
      for (int i = 0; i < values.length; i++) {
        values[i] = transform.applyAsDouble(values[i]);
      }
      frame = new ProbeFrame(frame.timestep(), values, frame.shape(), frame.title(), frame.units());
    }
    return Optional.of(frame);
  }

  /// extract every selected timestep
  /// @return one frame per selected timestep
  public List<ProbeFrame> data() {
    List<ProbeFrame> frames = new ArrayList<>(timesteps.length);
    for (long timestep : timesteps) {
      dataAt(timestep).ifPresent(frames::add);
    }
    return frames;
  }

  /// @param timestep
  ///     a selected timestep
  /// @return the distance the simulation window had moved, empty if unknown
  public OptionalDouble xMoved(long timestep) {
    if (Arrays.binarySearch(timesteps, timestep) < 0) {
      logger.warn("Timestep {} not found in this diagnostic", timestep);
      return OptionalDouble.empty();
    }
    return store.xMoved(timestep);
  }

  /// @return a description of the probe and of the current selection
  public String info() {
    StringBuilder sb = new StringBuilder(metadata.describe());
    for (String description : selection.descriptions()) {
      sb.append("\n\t").append(description);
    }
    return sb.toString();
  }

  @Override
  public void close() {
    store.close();
  }
}
