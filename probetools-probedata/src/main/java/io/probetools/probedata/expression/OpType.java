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

import java.util.function.DoubleBinaryOperator;

/// Binary operators of field expressions.
public enum OpType {
  ADD("+", (a, b) -> a + b),
  SUBTRACT("-", (a, b) -> a - b),
  MULTIPLY("*", (a, b) -> a * b),
  DIVIDE("/", (a, b) -> a / b),
  POWER("^", Math::pow);

  private final String symbol;
  private final DoubleBinaryOperator function;

  OpType(String symbol, DoubleBinaryOperator function) {
    this.symbol = symbol;
    this.function = function;
  }

  /// @return the operator symbol
  public String symbol() {
    return symbol;
  }

  /// @param a
  ///     left operand
  /// @param b
  ///     right operand
  /// @return the result of the operator
  public double apply(double a, double b) {
    return function.applyAsDouble(a, b);
  }
}
