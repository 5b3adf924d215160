package io.probetools.probedata.expression;

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

import java.util.Map;

/// Reference units of probe fields, keyed by the first letter of the field name: magnetic and
/// electric fields, current densities, charge densities and pressure-like tensor components.
/// Time-integrated probes accumulate values over time and carry an extra time unit.
public class FieldUnits {

  private static final Map<Character, String> UNITS_BY_KIND = Map.of(
      'B', "B_r",
      'E', "E_r",
      'J', "J_r",
      'R', "Q_r*N_r",
      'P', "V_r*K_r*N_r"
  );

  /// the units of a field name that matches no known kind
  public static final String DIMENSIONLESS = "";

  private FieldUnits() {
  }

  /// the units of a field
  /// @param field
  ///     the field name, e.g. `Ex` or `Rho_electron`
  /// @param timeIntegrated
  ///     true if the probe integrates its values over time
  /// @return the units in reference units
  public static String unitsFor(String field, boolean timeIntegrated) {
    String units = field.isEmpty() ? DIMENSIONLESS : UNITS_BY_KIND.getOrDefault(field.charAt(0), DIMENSIONLESS);
    if (timeIntegrated) {
      return units.isEmpty() ? "T_r" : units + "*T_r";
    }
    return units;
  }

  /// the display title of a field
  /// @param field
  ///     the field name
  /// @param timeIntegrated
  ///     true if the probe integrates its values over time
  /// @return the title
  public static String titleFor(String field, boolean timeIntegrated) {
    return timeIntegrated ? "Time-integrated " + field : field;
  }
}
