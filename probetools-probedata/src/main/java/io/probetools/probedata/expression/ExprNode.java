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

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

/// A node of a parsed field expression.
interface ExprNode {

  /// evaluate element-wise
  /// @param fields
  ///     the buffers of every variable
  /// @param size
  ///     the number of elements
  /// @return `size` values
  double[] eval(Map<String, double[]> fields, int size);

  /// @param unitsOf
  ///     the units of every field
  /// @return the units of this node, empty if dimensionless
  String units(Function<String, String> unitsOf);

  /// @param into
  ///     receives the field names read by this node
  void collectVariables(Set<String> into);

  /// a numeric literal
  record Literal(double value) implements ExprNode {
    @Override
    public double[] eval(Map<String, double[]> fields, int size) {
      double[] out = new double[size];
      Arrays.fill(out, value);
      return out;
    }

    @Override
    public String units(Function<String, String> unitsOf) {
      return FieldUnits.DIMENSIONLESS;
    }

    @Override
    public void collectVariables(Set<String> into) {
    }
  }

  /// a reference to a probe field
  record FieldRef(String name) implements ExprNode {
    @Override
    public double[] eval(Map<String, double[]> fields, int size) {
      double[] values = fields.get(name);
      if (values == null) {
        throw new IllegalArgumentException("no buffer provided for field " + name);
      }
      return values;
    }

    @Override
    public String units(Function<String, String> unitsOf) {
      return unitsOf.apply(name);
    }

    @Override
    public void collectVariables(Set<String> into) {
      into.add(name);
    }
  }

  /// arithmetic negation
  record Negate(ExprNode operand) implements ExprNode {
    @Override
    public double[] eval(Map<String, double[]> fields, int size) {
      double[] in = operand.eval(fields, size);
      double[] out = new double[size];
      for (int i = 0; i < size; i++) {
        out[i] = -in[i];
      }
      return out;
    }

    @Override
    public String units(Function<String, String> unitsOf) {
      return operand.units(unitsOf);
    }

    @Override
    public void collectVariables(Set<String> into) {
      operand.collectVariables(into);
    }
  }

  /// a binary operator
  record Binary(OpType op, ExprNode left, ExprNode right) implements ExprNode {
    @Override
    public double[] eval(Map<String, double[]> fields, int size) {
      double[] a = left.eval(fields, size);
      double[] b = right.eval(fields, size);
      double[] out = new double[size];
      for (int i = 0; i < size; i++) {
        out[i] = op.apply(a[i], b[i]);
      }
      return out;
    }

    @Override
    public String units(Function<String, String> unitsOf) {
      String a = left.units(unitsOf);
      String b = right.units(unitsOf);
      switch (op) {
        case ADD:
        case SUBTRACT:
          return a.isEmpty() ? b : a;
        case MULTIPLY:
          if (a.isEmpty()) {
            return b;
          }
          return b.isEmpty() ? a : a + "*" + b;
        case DIVIDE:
          if (b.isEmpty()) {
            return a;
          }
          return (a.isEmpty() ? "1" : a) + "/(" + b + ")";
        case POWER:
          if (a.isEmpty()) {
            return a;
          }
          Double exponent = constantExponent(right);
          return exponent == null ? a : "(" + a + ")^" + formatExponent(exponent);
        default:
          throw new IllegalStateException("unhandled operator " + op);
      }
    }

    @Override
    public void collectVariables(Set<String> into) {
      left.collectVariables(into);
      right.collectVariables(into);
    }

    // a literal, possibly negated: `-1` parses as Negate(Literal(1))
    private static Double constantExponent(ExprNode node) {
      if (node instanceof Literal literal) {
        return literal.value();
      }
      if (node instanceof Negate negate) {
        Double inner = constantExponent(negate.operand());
        return inner == null ? null : -inner;
      }
      return null;
    }

    private static String formatExponent(double exponent) {
      return exponent == Math.rint(exponent) ? Long.toString((long) exponent) : Double.toString(exponent);
    }
  }

  /// a single-argument function
  record Call(String function, DoubleUnaryOperator operator, ExprNode argument) implements ExprNode {
    @Override
    public double[] eval(Map<String, double[]> fields, int size) {
      double[] in = argument.eval(fields, size);
      double[] out = new double[size];
      for (int i = 0; i < size; i++) {
        out[i] = operator.applyAsDouble(in[i]);
      }
      return out;
    }

    @Override
    public String units(Function<String, String> unitsOf) {
      String inner = argument.units(unitsOf);
      switch (function) {
        case "abs":
          return inner;
        case "sqrt":
          return inner.isEmpty() ? inner : "(" + inner + ")^0.5";
        default:
          return FieldUnits.DIMENSIONLESS;
      }
    }

    @Override
    public void collectVariables(Set<String> into) {
      argument.collectVariables(into);
    }
  }
}
