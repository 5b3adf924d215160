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

import java.util.Arrays;
import java.util.Locale;

/// Which of the recorded timesteps a diagnostic works on.
///
/// ### Text forms
/// - `all` - every recorded timestep
/// - `t` - the recorded timestep nearest to `t`
/// - `a:b` - every recorded timestep in `[a, b]`
/// - `#i` - the `i`-th recorded timestep
/// - `#i:j` - recorded timesteps `i` to `j-1`, by position
public interface TimestepSelection {

  /// select among the recorded timesteps
  /// @param available
  ///     every recorded timestep, ascending
  /// @return the selected timesteps, ascending
  long[] select(long[] available);

  /// every recorded timestep
  record All() implements TimestepSelection {
    @Override
    public long[] select(long[] available) {
      return available.clone();
    }
  }

  /// the recorded timestep nearest to a value
  /// @param timestep
  ///     the requested value
  record Nearest(double timestep) implements TimestepSelection {
    @Override
    public long[] select(long[] available) {
      if (available.length == 0) {
        return new long[0];
      }
      long nearest = available[0];
      for (long t : available) {
        if (Math.abs(t - timestep) < Math.abs(nearest - timestep)) {
          nearest = t;
        }
      }
      return new long[]{nearest};
    }
  }

  /// every recorded timestep in a closed interval
  /// @param from
  ///     the lower bound
  /// @param to
  ///     the upper bound
  record Between(double from, double to) implements TimestepSelection {
    @Override
    public long[] select(long[] available) {
      return Arrays.stream(available).filter(t -> t >= from && t <= to).toArray();
    }
  }

  /// recorded timesteps by position
  /// @param start
  ///     the first position
  /// @param stop
  ///     the exclusive end position
  record Indices(int start, int stop) implements TimestepSelection {
    @Override
    public long[] select(long[] available) {
      int from = Math.max(0, Math.min(start, available.length));
      int to = Math.max(from, Math.min(stop, available.length));
      return Arrays.copyOfRange(available, from, to);
    }
  }

  /// @return a selection of every recorded timestep
  static TimestepSelection all() {
    return new All();
  }

  /// parse a selection from its text form
  /// @param spec
  ///     the text form, see [TimestepSelection]
  /// @return the selection
  static TimestepSelection parse(String spec) {
    if (spec == null || spec.isBlank()) {
      throw new ProbeConfigurationException("timestep selection cannot be empty");
    }
    String trimmed = spec.trim();
    try {
      if (trimmed.toLowerCase(Locale.ROOT).equals("all")) {
        return new All();
      }
      if (trimmed.startsWith("#")) {
        String[] parts = trimmed.substring(1).split(":");
        int start = Integer.parseInt(parts[0].trim());
        if (parts.length == 1) {
          return new Indices(start, start + 1);
        }
        if (parts.length == 2) {
          return new Indices(start, Integer.parseInt(parts[1].trim()));
        }
        throw new ProbeConfigurationException("invalid timestep indices '" + spec + "', expected #i or #i:j");
      }
      if (trimmed.contains(":")) {
        String[] parts = trimmed.split(":");
        if (parts.length != 2) {
          throw new ProbeConfigurationException("invalid timestep range '" + spec + "', expected from:to");
        }
        return new Between(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
      }
      return new Nearest(Double.parseDouble(trimmed));
    } catch (NumberFormatException e) {
      throw new ProbeConfigurationException("invalid timestep selection '" + spec + "': " + e.getMessage(), e);
    }
  }
}
