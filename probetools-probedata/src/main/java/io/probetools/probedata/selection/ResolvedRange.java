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

/// A [RangeRequest] resolved against the grid points of one axis.
/// @param slice
///     the selected grid indices
/// @param singlePoint
///     true if the request named a single location rather than a range
/// @param description
///     a human readable account of the selection, e.g. `subset for axis1 from 0.0 to 4.0 L_r`
public record ResolvedRange(AxisSlice slice, boolean singlePoint, String description) {

  /// @return the number of selected grid points
  public int length() {
    return slice.length();
  }
}
