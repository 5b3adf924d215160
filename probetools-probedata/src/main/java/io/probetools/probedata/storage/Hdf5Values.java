package io.probetools.probedata.storage;

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

import io.jhdf.api.Attribute;
import io.jhdf.api.Node;
import io.probetools.probedata.ProbeStorageException;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;

/// Conversions of jHDF data objects, which come back as boxed scalars or primitive arrays of
/// the stored type, into the types probes need.
class Hdf5Values {

  private Hdf5Values() {
  }

  /// @param node
  ///     the node carrying the attribute
  /// @param name
  ///     the attribute name
  /// @return the attribute data, or null if absent
  static Object attribute(Node node, String name) {
    Attribute attribute = node.getAttribute(name);
    return attribute == null ? null : attribute.getData();
  }

  static long toLong(Object data, String what) {
    Object value = first(data, what);
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof Boolean bool) {
      return bool ? 1L : 0L;
    }
    throw new ProbeStorageException(what + " is not numeric: " + value);
  }

  static boolean toFlag(Object data, String what) {
    if (data == null) {
      return false;
    }
    Object value = first(data, what);
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof Number number) {
      return number.doubleValue() != 0.0d;
    }
    if (value instanceof String string) {
      return Boolean.parseBoolean(string.trim()) || string.trim().equals("1");
    }
    throw new ProbeStorageException(what + " is not a flag: " + value);
  }

  static String toText(Object data, String what) {
    if (data instanceof String string) {
      return string;
    }
    if (data instanceof byte[] bytes) {
      return new String(bytes, StandardCharsets.UTF_8).trim();
    }
    if (data != null && data.getClass().isArray()) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < Array.getLength(data); i++) {
        if (i > 0) {
          sb.append(',');
        }
        sb.append(toText(Array.get(data, i), what));
      }
      return sb.toString();
    }
    throw new ProbeStorageException(what + " is not text: " + data);
  }

  static double[] toDoubles(Object data, String what) {
    if (data instanceof Number number) {
      return new double[]{number.doubleValue()};
    }
    if (data == null || !data.getClass().isArray()) {
      throw new ProbeStorageException(what + " is not a numeric array: " + data);
    }
    int length = Array.getLength(data);
    double[] values = new double[length];
    for (int i = 0; i < length; i++) {
      Object element = Array.get(data, i);
      if (!(element instanceof Number number)) {
        throw new ProbeStorageException(what + " is not a one-dimensional numeric array");
      }
      values[i] = number.doubleValue();
    }
    return values;
  }

  static int[] toInts(Object data, String what) {
    double[] values = toDoubles(data, what);
    int[] ints = new int[values.length];
    for (int i = 0; i < values.length; i++) {
      ints[i] = (int) values[i];
    }
    return ints;
  }

  static double[][] toDoubleMatrix(Object data, String what) {
    if (data == null || !data.getClass().isArray()) {
      throw new ProbeStorageException(what + " is not a numeric matrix: " + data);
    }
    int rows = Array.getLength(data);
    double[][] matrix = new double[rows][];
    for (int r = 0; r < rows; r++) {
      Object row = Array.get(data, r);
      matrix[r] = row instanceof Number number ? new double[]{number.doubleValue()} : toDoubles(row, what);
    }
    return matrix;
  }

  private static Object first(Object data, String what) {
    if (data != null && data.getClass().isArray()) {
      if (Array.getLength(data) == 0) {
        throw new ProbeStorageException(what + " is empty");
      }
      return Array.get(data, 0);
    }
    if (data == null) {
      throw new ProbeStorageException(what + " is missing");
    }
    return data;
  }
}
