package io.probetools.probedata.selection;

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

import java.util.Locale;

/// A user request restricting one axis, either to take a subset of it or to average over it.
///
/// Physical requests are expressed in distance from the first grid point of the axis; index
/// requests name grid indices directly.
///
/// ### Text forms
/// - `all` - the whole axis
/// - `x` - the grid point nearest to distance `x`
/// - `a:b` or `a:b:s` - grid points with distance in `[a, b]`, every `s` points
/// - `[m,n)` or `[m,n):s` - grid indices `m` to `n-1`, every `s` indices
/// - `m..n` - grid indices `m` to `n` inclusive
public interface RangeRequest {

  /// the whole axis
  record All() implements RangeRequest {
    @Override
    public String toString() {
      return "all";
    }
  }

  /// the grid point nearest to a distance
  /// @param location
  ///     distance from the first grid point
  record At(double location) implements RangeRequest {
    @Override
    public String toString() {
      return Double.toString(location);
    }
  }

  /// grid points whose distance lies within a closed interval
  /// @param from
  ///     the lower distance bound
  /// @param to
  ///     the upper distance bound
  /// @param step
  ///     keep every `step`-th point
  record Between(double from, double to, int step) implements RangeRequest {
    public Between {
      if (step < 1) {
        throw new ProbeConfigurationException("range step must be a positive integer: " + step);
      }
    }

    @Override
    public String toString() {
      return from + ":" + to + (step == 1 ? "" : ":" + step);
    }
  }

  /// grid indices in a half-open interval
  /// @param start
  ///     the first index
  /// @param stop
  ///     the exclusive upper bound
  /// @param step
  ///     keep every `step`-th index
  record Indices(int start, int stop, int step) implements RangeRequest {
    public Indices {
      if (start < 0) {
        throw new ProbeConfigurationException("index range start must be non-negative: " + start);
      }
      if (step < 1) {
        throw new ProbeConfigurationException("index range step must be a positive integer: " + step);
      }
    }

    @Override
    public String toString() {
      return "[" + start + "," + stop + ")" + (step == 1 ? "" : ":" + step);
    }
  }

  /// @return a request for the whole axis
  static RangeRequest all() {
    return new All();
  }

  /// parse a request from its text form
  /// @param spec
  ///     the text form, see [RangeRequest]
  /// @return the parsed request
  static RangeRequest parse(String spec) {
    if (spec == null || spec.isBlank()) {
      throw new ProbeConfigurationException("range specification cannot be empty");
    }
    String trimmed = spec.trim();
    try {
      if (trimmed.toLowerCase(Locale.ROOT).equals("all")) {
        return new All();
      }
      if (trimmed.startsWith("[")) {
        int close = trimmed.indexOf(')');
        if (close < 0) {
          throw new ProbeConfigurationException("invalid index range '" + spec + "', expected [start,stop) or [start,stop):step");
        }
        String[] parts = trimmed.substring(1, close).split(",");
        if (parts.length != 2) {
          throw new ProbeConfigurationException("invalid index range '" + spec + "', expected [start,stop)");
        }
        int step = 1;
        String rest = trimmed.substring(close + 1).trim();
        if (!rest.isEmpty()) {
          if (!rest.startsWith(":")) {
            throw new ProbeConfigurationException("invalid index range '" + spec + "', expected [start,stop):step");
          }
          step = Integer.parseInt(rest.substring(1).trim());
        }
        return new Indices(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()), step);
      }
      if (trimmed.contains("..")) {
        String[] parts = trimmed.split("\\.\\.");
        if (parts.length != 2) {
          throw new ProbeConfigurationException("invalid index range '" + spec + "', expected start..end");
        }
        return new Indices(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()) + 1, 1);
      }
      if (trimmed.contains(":")) {
        String[] parts = trimmed.split(":");
        if (parts.length < 2 || parts.length > 3) {
          throw new ProbeConfigurationException(
              "invalid range '" + spec + "', expected 1 to 3 numbers as from:to or from:to:step");
        }
        int step = parts.length == 3 ? Integer.parseInt(parts[2].trim()) : 1;
        return new Between(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()), step);
      }
      return new At(Double.parseDouble(trimmed));
    } catch (NumberFormatException e) {
      throw new ProbeConfigurationException("invalid range '" + spec + "': " + e.getMessage(), e);
    }
  }
}
