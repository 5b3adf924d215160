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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RangeRequest")
class RangeRequestTest {

  @ParameterizedTest
  @ValueSource(strings = {"all", "ALL", " all "})
  @DisplayName("parses the whole axis")
  void parsesAll(String spec) {
    assertThat(RangeRequest.parse(spec)).isInstanceOf(RangeRequest.All.class);
  }

  @Test
  @DisplayName("parses a single location")
  void parsesLocation() {
    assertThat(RangeRequest.parse("2.5")).isEqualTo(new RangeRequest.At(2.5));
  }

  @ParameterizedTest
  @CsvSource({
      "'1:3', 1.0, 3.0, 1",
      "'0.5:4.5:2', 0.5, 4.5, 2",
      "' -1 : 2 ', -1.0, 2.0, 1"
  })
  @DisplayName("parses a distance interval")
  void parsesBetween(String spec, double from, double to, int step) {
    assertThat(RangeRequest.parse(spec)).isEqualTo(new RangeRequest.Between(from, to, step));
  }

  @ParameterizedTest
  @CsvSource({
      "'[2,5)', 2, 5, 1",
      "'[0,10):3', 0, 10, 3",
      "'3..6', 3, 7, 1"
  })
  @DisplayName("parses an index interval")
  void parsesIndices(String spec, int start, int stop, int step) {
    assertThat(RangeRequest.parse(spec)).isEqualTo(new RangeRequest.Indices(start, stop, step));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "abc", "1:2:3:4", "[1,2", "[1)", "1:2:0", "[-1,3)", "[1,3)x"})
  @DisplayName("rejects malformed ranges")
  void rejectsMalformed(String spec) {
    assertThatThrownBy(() -> RangeRequest.parse(spec)).isInstanceOf(ProbeConfigurationException.class);
  }
}
