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

import io.probetools.probedata.ProbeConfigurationException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/// A [FieldExpression] parsed from arithmetic text over probe field names, such as `Ex`,
/// `Ex^2+Ey^2` or `sqrt(Bx**2 + By**2) / 2`.
///
/// ### Grammar
/// ```
/// expr    := term (('+' | '-') term)*
/// term    := unary (('*' | '/') unary)*
/// unary   := '-' unary | power
/// power   := primary (('^' | '**') unary)?
/// primary := number | field | function '(' expr ')' | '(' expr ')'
/// ```
/// Functions are `sqrt`, `abs`, `exp`, `log` and `log10`. Every other identifier must be one
/// of the probe's fields.
public class FieldOperation implements FieldExpression {

  private static final Map<String, DoubleUnaryOperator> FUNCTIONS = Map.of(
      "sqrt", Math::sqrt,
      "abs", Math::abs,
      "exp", Math::exp,
      "log", Math::log,
      "log10", Math::log10
  );

  private final String text;
  private final ExprNode root;
  private final List<String> variables;
  private final boolean timeIntegrated;

  private FieldOperation(String text, ExprNode root, List<String> variables, boolean timeIntegrated) {
    this.text = text;
    this.root = root;
    this.variables = variables;
    this.timeIntegrated = timeIntegrated;
  }

  /// parse an expression
  /// @param text
  ///     the expression text
  /// @param availableFields
  ///     the fields recorded by the probe
  /// @param timeIntegrated
  ///     true if the probe integrates its values over time
  /// @return the parsed operation
  public static FieldOperation parse(String text, List<String> availableFields, boolean timeIntegrated) {
    if (text == null || text.isBlank()) {
      throw new ProbeConfigurationException("field expression cannot be empty; available fields: "
          + String.join(", ", availableFields));
    }
    Parser parser = new Parser(text, availableFields);
    ExprNode root = parser.parseExpression();
    parser.expectEnd();

    Set<String> names = new LinkedHashSet<>();
    root.collectVariables(names);
    if (names.isEmpty()) {
      throw new ProbeConfigurationException(
          "field expression '" + text + "' must reference at least one of the fields: " + String.join(", ", availableFields));
    }
    return new FieldOperation(text.trim(), root, List.copyOf(names), timeIntegrated);
  }

  @Override
  public List<String> variables() {
    return variables;
  }

  @Override
  public String title() {
    if (root instanceof ExprNode.FieldRef ref) {
      return FieldUnits.titleFor(ref.name(), timeIntegrated);
    }
    return timeIntegrated ? "Time-integrated " + text : text;
  }

  @Override
  public String units() {
    return root.units(this::unitsOf);
  }

  /// @param field
  ///     a field name
  /// @return the units of that field for this probe
  public String unitsOf(String field) {
    return FieldUnits.unitsFor(field, timeIntegrated);
  }

  @Override
  public EvaluatedField evaluate(Map<String, double[]> fields) {
    int size = -1;
    for (String variable : variables) {
      double[] buffer = fields.get(variable);
      if (buffer == null) {
        throw new IllegalArgumentException("no buffer provided for field " + variable);
      }
      if (size >= 0 && buffer.length != size) {
        throw new IllegalArgumentException(
            "field buffers differ in length: " + variable + " has " + buffer.length + ", expected " + size);
      }
      size = buffer.length;
    }
    double[] values = root.eval(fields, size).clone();
    return new EvaluatedField(values, units(), title());
  }

  @Override
  public String toString() {
    return text;
  }

  private static class Parser {
    private final String text;
    private final List<String> fields;
    private int pos;

    Parser(String text, List<String> fields) {
      this.text = text;
      this.fields = fields;
    }

    ExprNode parseExpression() {
      ExprNode node = parseTerm();
      while (true) {
        skipSpaces();
        if (consume("+")) {
          node = new ExprNode.Binary(OpType.ADD, node, parseTerm());
        } else if (consume("-")) {
          node = new ExprNode.Binary(OpType.SUBTRACT, node, parseTerm());
        } else {
          return node;
        }
      }
    }

    private ExprNode parseTerm() {
      ExprNode node = parseUnary();
      while (true) {
        skipSpaces();
        if (peek("**")) {
          return node;
        }
        if (consume("*")) {
          node = new ExprNode.Binary(OpType.MULTIPLY, node, parseUnary());
        } else if (consume("/")) {
          node = new ExprNode.Binary(OpType.DIVIDE, node, parseUnary());
        } else {
          return node;
        }
      }
    }

    private ExprNode parseUnary() {
      skipSpaces();
      if (consume("-")) {
        return new ExprNode.Negate(parseUnary());
      }
      if (consume("+")) {
        return parseUnary();
      }
      return parsePower();
    }

    private ExprNode parsePower() {
      ExprNode base = parsePrimary();
      skipSpaces();
      if (consume("**") || consume("^")) {
        return new ExprNode.Binary(OpType.POWER, base, parseUnary());
      }
      return base;
    }

    private ExprNode parsePrimary() {
      skipSpaces();
      if (pos >= text.length()) {
        throw error("unexpected end of expression");
      }
      char c = text.charAt(pos);
      if (c == '(') {
        pos++;
        ExprNode inner = parseExpression();
        skipSpaces();
        if (!consume(")")) {
          throw error("missing closing parenthesis");
        }
        return inner;
      }
      if (Character.isDigit(c) || c == '.') {
        return new ExprNode.Literal(parseNumber());
      }
      if (Character.isLetter(c) || c == '_') {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
          pos++;
        }
        String name = text.substring(start, pos);
        skipSpaces();
        if (peek("(")) {
          DoubleUnaryOperator function = FUNCTIONS.get(name.toLowerCase(Locale.ROOT));
          if (function == null) {
            throw error("unknown function '" + name + "', known functions: " + String.join(", ", FUNCTIONS.keySet()));
          }
          pos++;
          ExprNode argument = parseExpression();
          skipSpaces();
          if (!consume(")")) {
            throw error("missing closing parenthesis after argument of " + name);
          }
          return new ExprNode.Call(name.toLowerCase(Locale.ROOT), function, argument);
        }
        if (!fields.contains(name)) {
          throw new ProbeConfigurationException(
              "unknown field '" + name + "' in expression '" + text + "'; available fields: " + String.join(", ", fields));
        }
        return new ExprNode.FieldRef(name);
      }
      throw error("unexpected character '" + c + "'");
    }

    private double parseNumber() {
      int start = pos;
      while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
        pos++;
      }
      if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
        int mark = pos;
        pos++;
        if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
          pos++;
        }
        if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
          while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
          }
        } else {
          pos = mark;
        }
      }
      String literal = text.substring(start, pos);
      try {
        return Double.parseDouble(literal);
      } catch (NumberFormatException e) {
        throw new ProbeConfigurationException("invalid number '" + literal + "' in expression '" + text + "'", e);
      }
    }

    void expectEnd() {
      skipSpaces();
      if (pos < text.length()) {
        throw error("unexpected '" + text.substring(pos) + "'");
      }
    }

    private boolean peek(String token) {
      return text.startsWith(token, pos);
    }

    private boolean consume(String token) {
      if (text.startsWith(token, pos)) {
        pos += token.length();
        return true;
      }
      return false;
    }

    private void skipSpaces() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private ProbeConfigurationException error(String message) {
      return new ProbeConfigurationException(message + " at position " + pos + " of expression '" + text + "'");
    }
  }
}
