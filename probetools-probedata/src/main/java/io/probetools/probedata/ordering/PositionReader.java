package io.probetools.probedata.ordering;

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

/// Reads recorded probe point positions by contiguous raw index range.
@FunctionalInterface
public interface PositionReader {

  /// read positions
  /// @param first
  ///     the first raw index
  /// @param count
  ///     the number of points
  /// @return `count` positions, each of the ambient dimensionality
  double[][] readPositions(long first, int count);
}
