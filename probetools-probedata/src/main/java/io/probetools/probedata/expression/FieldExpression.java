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

import java.util.List;
import java.util.Map;

/// A derived quantity computed element-wise from one or more probe fields.
public interface FieldExpression {

  /// @return the names of the fields the expression reads, in order of first appearance
  List<String> variables();

  /// @return the display title of the quantity
  String title();

  /// @return the units of the quantity, in reference units
  String units();

  /// evaluate the expression
  /// @param fields
  ///     one buffer per variable, all of the same length
  /// @return the combined values with their units and title
  EvaluatedField evaluate(Map<String, double[]> fields);
}
