package io.probetools.probedata.storage;

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

import io.probetools.probedata.extract.FieldReader;
import io.probetools.probedata.ordering.PositionReader;

import java.util.NavigableSet;
import java.util.OptionalDouble;

/// Access to the recorded output of one probe.
public interface ProbeStore extends PositionReader, FieldReader, AutoCloseable {

  /// @return the probe metadata
  ProbeMetadata metadata();

  /// @return every recorded timestep, ascending
  NavigableSet<Long> timesteps();

  /// the distance the simulation window had moved at a timestep
  /// @param timestep
  ///     a recorded timestep
  /// @return the moved distance, if recorded
  OptionalDouble xMoved(long timestep);

  @Override
  void close();
}
