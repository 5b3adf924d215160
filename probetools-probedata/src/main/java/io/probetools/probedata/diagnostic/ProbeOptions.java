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
import io.probetools.probedata.ordering.OrderingBuilder;
import io.probetools.probedata.selection.RangeRequest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/// The configuration of a [ProbeDiagnostic].
public final class ProbeOptions {

  private final Integer probeNumber;
  private final String field;
  private final TimestepSelection timesteps;
  private final Map<String, RangeRequest> subset;
  private final Map<String, RangeRequest> average;
  private final int chunkSize;
  private final double[] boxSize;
  private final boolean dataLog;
  private final DoubleUnaryOperator dataTransform;

  private ProbeOptions(Builder builder) {
    this.probeNumber = builder.probeNumber;
    this.field = builder.field;
    this.timesteps = builder.timesteps;
    this.subset = Collections.unmodifiableMap(new LinkedHashMap<>(builder.subset));
    this.average = Collections.unmodifiableMap(new LinkedHashMap<>(builder.average));
    this.chunkSize = builder.chunkSize;
    this.boxSize = builder.boxSize == null ? null : builder.boxSize.clone();
    this.dataLog = builder.dataLog;
    this.dataTransform = builder.dataTransform;
  }

  /// @return a new builder
  public static Builder builder() {
    return new Builder();
  }

  /// @return the probe number, or null if not given
  public Integer probeNumber() {
    return probeNumber;
  }

  /// @return the field expression, or null if not given
  public String field() {
    return field;
  }

  /// @return the timestep selection
  public TimestepSelection timesteps() {
    return timesteps;
  }

  /// @return subset requests by axis label
  public Map<String, RangeRequest> subset() {
    return subset;
  }

  /// @return average requests by axis label
  public Map<String, RangeRequest> average() {
    return average;
  }

  /// @return the number of points read at once
  public int chunkSize() {
    return chunkSize;
  }

  /// @return the extent of the simulation box per dimension, or null if unknown
  public double[] boxSize() {
    return boxSize == null ? null : boxSize.clone();
  }

  /// @return true if extracted values are replaced by their base-10 logarithm
  public boolean dataLog() {
    return dataLog;
  }

  /// @return the function applied to every extracted value, after the logarithm if any, or null
  public DoubleUnaryOperator dataTransform() {
    return dataTransform;
  }

  /// @return a builder initialized with these options
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.probeNumber = probeNumber;
    builder.field = field;
    builder.timesteps = timesteps;
    builder.subset.putAll(subset);
    builder.average.putAll(average);
    builder.chunkSize = chunkSize;
    builder.boxSize = boxSize;
    builder.dataLog = dataLog;
    builder.dataTransform = dataTransform;
    return builder;
  }

  /// Builder of [ProbeOptions].
  public static final class Builder {
    private Integer probeNumber;
    private String field;
    private TimestepSelection timesteps = TimestepSelection.all();
    private final Map<String, RangeRequest> subset = new LinkedHashMap<>();
    private final Map<String, RangeRequest> average = new LinkedHashMap<>();
    private int chunkSize = OrderingBuilder.DEFAULT_CHUNK_SIZE;
    private double[] boxSize;
    private boolean dataLog;
    private DoubleUnaryOperator dataTransform;

    private Builder() {
    }

    /// @param probeNumber
    ///     the probe number
    /// @return this builder
    public Builder probe(int probeNumber) {
      this.probeNumber = probeNumber;
      return this;
    }

    /// @param field
    ///     the field expression, e.g. `Ex` or `Ex^2+Ey^2`
    /// @return this builder
    public Builder field(String field) {
      this.field = field;
      return this;
    }

    /// @param timesteps
    ///     the timestep selection
    /// @return this builder
    public Builder timesteps(TimestepSelection timesteps) {
      this.timesteps = timesteps == null ? TimestepSelection.all() : timesteps;
      return this;
    }

    /// @param axis
    ///     the axis label
    /// @param request
    ///     the subset request
    /// @return this builder
    public Builder subset(String axis, RangeRequest request) {
      this.subset.put(axis, request);
      return this;
    }

    /// @param requests
    ///     subset requests by axis label, replacing any given before
    /// @return this builder
    public Builder subset(Map<String, RangeRequest> requests) {
      this.subset.clear();
      this.subset.putAll(requests);
      return this;
    }

    /// @param axis
    ///     the axis label
    /// @param request
    ///     the average request
    /// @return this builder
    public Builder average(String axis, RangeRequest request) {
      this.average.put(axis, request);
      return this;
    }

    /// @param requests
    ///     average requests by axis label, replacing any given before
    /// @return this builder
    public Builder average(Map<String, RangeRequest> requests) {
      this.average.clear();
      this.average.putAll(requests);
      return this;
    }

    /// @param chunkSize
    ///     the number of points read at once
    /// @return this builder
    public Builder chunkSize(int chunkSize) {
      this.chunkSize = chunkSize;
      return this;
    }

    /// @param boxSize
    ///     the extent of the simulation box per dimension
    /// @return this builder
    public Builder boxSize(double... boxSize) {
      this.boxSize = boxSize;
      return this;
    }

    /// @param dataLog
    ///     true to replace extracted values by their base-10 logarithm
    /// @return this builder
    public Builder dataLog(boolean dataLog) {
      this.dataLog = dataLog;
      return this;
    }

    /// @param dataTransform
    ///     a function applied to every extracted value, or null for none
    /// @return this builder
    public Builder dataTransform(DoubleUnaryOperator dataTransform) {
      this.dataTransform = dataTransform;
      return this;
    }

    /// @return the options
    public ProbeOptions build() {
      if (chunkSize <= 0) {
        throw new ProbeConfigurationException("chunk size must be a positive integer: " + chunkSize);
      }
      if (probeNumber != null && probeNumber < 0) {
        throw new ProbeConfigurationException("probe number must be non-negative: " + probeNumber);
      }
      return new ProbeOptions(this);
    }
  }
}
