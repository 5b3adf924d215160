package io.probetools.probedata;

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

/// Thrown when a probe diagnostic is asked for something its configuration cannot satisfy:
/// a missing probe or field selector, an unknown axis label, a subset and an average on the
/// same axis, an empty selection, or a degenerate probe basis.
///
/// These are raised while a diagnostic is being set up and are not retried.
public class ProbeConfigurationException extends RuntimeException {

  /// Creates a new ProbeConfigurationException with the specified message.
  /// @param message The error message
  public ProbeConfigurationException(String message) {
    super(message);
  }

  /// Creates a new ProbeConfigurationException with the specified message and cause.
  /// @param message The error message
  /// @param cause The cause of the exception
  public ProbeConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
