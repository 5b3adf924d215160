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

import java.util.Optional;

/// What happens to one probe axis: it is averaged away, restricted to a subset, or kept whole.
///
/// Every disposition carries the slice used when reindexing points. Averaged axes still select
/// a range of points, and are reduced to a single value after extraction.
public interface AxisDisposition {

  /// @return the selected grid indices
  AxisSlice slice();

  /// @return true if the axis is collapsed by averaging
  boolean isAveraged();

  /// @return the description of the resolved request, if one was made
  Optional<String> description();

  /// @return the number of grid points kept along this axis while reindexing
  default int selectedLength() {
    return slice().length();
  }

  /// @return the size of this axis in the final, pre-squeeze shape
  default int finalLength() {
    return isAveraged() ? 1 : selectedLength();
  }

  /// An axis remains visible in extracted data when it is not averaged and keeps more than
  /// one point. Other axes are squeezed out.
  /// @return true if this axis remains visible
  default boolean isVisible() {
    return !isAveraged() && selectedLength() > 1;
  }

  /// the axis is averaged over a range
  /// @param range
  ///     the averaged range
  record Averaged(ResolvedRange range) implements AxisDisposition {
    @Override
    public AxisSlice slice() {
      return range.slice();
    }

    @Override
    public boolean isAveraged() {
      return true;
    }

    @Override
    public Optional<String> description() {
      return Optional.of(range.description());
    }
  }

  /// the axis is restricted to a range and stays visible if more than one point remains
  /// @param range
  ///     the selected range
  record Subset(ResolvedRange range) implements AxisDisposition {
    @Override
    public AxisSlice slice() {
      return range.slice();
    }

    @Override
    public boolean isAveraged() {
      return false;
    }

    @Override
    public Optional<String> description() {
      return Optional.of(range.description());
    }
  }

  /// the axis is kept whole
  /// @param slice
  ///     the full range of the axis
  record Default(AxisSlice slice) implements AxisDisposition {
    @Override
    public boolean isAveraged() {
      return false;
    }

    @Override
    public Optional<String> description() {
      return Optional.empty();
    }
  }
}
