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
import io.probetools.probedata.geometry.AxisGeometry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Combines per-axis subset and average requests into a [ProbeSelection].
///
/// Requests are keyed by axis label. A label the probe does not have, or a label named by both
/// a subset and an average request, is a [ProbeConfigurationException].
public class SelectionAssembler {
  private static final Logger logger = LogManager.getLogger(SelectionAssembler.class);

  private SelectionAssembler() {
  }

  /// assemble the selection of a probe
  /// @param axes
  ///     the geometry of every probe axis, empty for a point probe
  /// @param subset
  ///     subset requests by axis label
  /// @param average
  ///     average requests by axis label
  /// @return the selection
  public static ProbeSelection assemble(
      List<AxisGeometry> axes,
      Map<String, RangeRequest> subset,
      Map<String, RangeRequest> average
  ) {
    validateLabels(axes, subset, "subset");
    validateLabels(axes, average, "average");

    List<AxisDisposition> dispositions = new ArrayList<>(axes.size());
    List<AxisGeometry> visible = new ArrayList<>();
    int[] selectedShape = new int[axes.size()];

    for (AxisGeometry axis : axes) {
      String label = axis.label();
      AxisDisposition disposition;
      if (average.containsKey(label)) {
        if (subset.containsKey(label)) {
          throw new ProbeConfigurationException(
              "`subset` not possible on the same axes as `average`: " + label + " appears in both");
        }
        disposition = new AxisDisposition.Averaged(
            RangeResolver.resolve(average.get(label), axis, RangeResolver.AVERAGE));
      } else if (subset.containsKey(label)) {
        disposition = new AxisDisposition.Subset(
            RangeResolver.resolve(subset.get(label), axis, RangeResolver.SUBSET));
      } else {
        disposition = new AxisDisposition.Default(AxisSlice.full(axis.length()));
      }
      dispositions.add(disposition);
      selectedShape[axis.index()] = disposition.selectedLength();
      if (disposition.isVisible()) {
        visible.add(restrict(axis, disposition.slice()));
      }
      disposition.description().ifPresent(d -> logger.debug("{}: {}", label, d));
    }

    return new ProbeSelection(List.copyOf(axes), List.copyOf(dispositions), selectedShape, List.copyOf(visible));
  }

  private static AxisGeometry restrict(AxisGeometry axis, AxisSlice slice) {
    double[][] centers = new double[slice.length()][];
    for (int i = 0; i < centers.length; i++) {
      centers[i] = axis.centers()[slice.indexAt(i)].clone();
    }
    return new AxisGeometry(axis.index(), axis.label(), axis.units(), centers, axis.displacement().clone());
  }

  private static void validateLabels(List<AxisGeometry> axes, Map<String, RangeRequest> requests, String operation) {
    Set<String> known = new LinkedHashSet<>();
    for (AxisGeometry axis : axes) {
      known.add(axis.label());
    }
    for (String label : requests.keySet()) {
      if (!known.contains(label)) {
        throw new ProbeConfigurationException(
            "`" + operation + "` on unsupported axis '" + label + "' for a " + axes.size()
                + "-dimensional probe; available axes: " + (known.isEmpty() ? "none" : String.join(", ", known)));
      }
    }
  }
}
