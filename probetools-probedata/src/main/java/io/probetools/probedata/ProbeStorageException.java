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

/// Thrown when probe output cannot be located or read: no readable probe file in any results
/// directory, no timesteps recorded, or a dataset with an unexpected layout.
public class ProbeStorageException extends RuntimeException {

  /// Creates a new ProbeStorageException with the specified message.
  /// @param message The error message
  public ProbeStorageException(String message) {
    super(message);
  }

  /// Creates a new ProbeStorageException with the specified message and cause.
  /// @param message The error message
  /// @param cause The cause of the exception
  public ProbeStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
