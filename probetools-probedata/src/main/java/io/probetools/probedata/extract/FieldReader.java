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

/// Reads recorded values of one probe field at one timestep, by contiguous raw index range.
@FunctionalInterface
public interface FieldReader {

  /// read field values
  /// @param timestep
  ///     the timestep
  /// @param fieldIndex
  ///     the index of the field among the probe's fields
  /// @param first
  ///     the first raw index
  /// @param count
  ///     the number of points
  /// @return `count` values
  double[] readField(long timestep, int fieldIndex, long first, int count);
}
