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

import io.probetools.probedata.geometry.AxisGeometry;

import java.util.ArrayList;
import java.util.List;

/// The resolved selection of a probe: one [AxisDisposition] per axis, the grid shapes before
/// and after averaging, and the axes that remain visible in extracted data.
///
/// Points are reindexed over the selected shape, in which an averaged axis keeps every point of
/// its averaged range. Averaging then reduces those axes to length 1, giving the final shape.
/// @param axes
///     the full geometry of every axis
/// @param dispositions
///     one disposition per axis
/// @param selectedShape
///     per axis, the number of selected points
/// @param visibleAxes
///     the visible axes, with centers restricted to the selection
public record ProbeSelection(
    List<AxisGeometry> axes,
    List<AxisDisposition> dispositions,
    int[] selectedShape,
    List<AxisGeometry> visibleAxes
) {

  /// @return per axis, the number of selected points
  @Override
  public int[] selectedShape() {
    return selectedShape.clone();
  }

  /// @return the number of probe axes
  public int naxes() {
    return dispositions.size();
  }

  /// @return true if the probe samples a single point
  public boolean isPointProbe() {
    return dispositions.isEmpty();
  }

  /// @param axis
  ///     zero-based axis index
  /// @return the slice selected on that axis
  public AxisSlice slice(int axis) {
    return dispositions.get(axis).slice();
  }

  /// @param axis
  ///     zero-based axis index
  /// @return true if that axis is averaged
  public boolean isAveraged(int axis) {
    return dispositions.get(axis).isAveraged();
  }

  /// @return per axis, 1 if averaged, else the number of selected points
  public int[] finalShape() {
    int[] shape = new int[dispositions.size()];
    for (int i = 0; i < shape.length; i++) {
      shape[i] = dispositions.get(i).finalLength();
    }
    return shape;
  }

  /// @return the number of grid slots over the selected shape, the size of an ordering
  public int size() {
    long size = 1;
    for (int n : selectedShape) {
      size *= n;
    }
    if (size > Integer.MAX_VALUE) {
      throw new IllegalStateException("selection of " + size + " grid points exceeds the addressable array size");
    }
    return (int) size;
  }

  /// @return the shape of extracted data once non-visible axes are squeezed
  public int[] outputShape() {
    int[] shape = new int[visibleAxes.size()];
    for (int i = 0; i < shape.length; i++) {
      shape[i] = visibleAxes.get(i).length();
    }
    return shape;
  }

  /// @return the descriptions of every subset and average request, in axis order
  public List<String> descriptions() {
    List<String> descriptions = new ArrayList<>();
    for (AxisDisposition disposition : dispositions) {
      disposition.description().ifPresent(descriptions::add);
    }
    return descriptions;
  }
}
