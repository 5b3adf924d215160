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

import io.probetools.probedata.ProbeConfigurationException;
import io.probetools.probedata.ProbeStorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/// The probes found in the results directories of a simulation.
public class ProbeCatalog {
  private static final Logger logger = LogManager.getLogger(ProbeCatalog.class);

  private static final Pattern PROBE_FILE = Pattern.compile(
      Pattern.quote(Hdf5ProbeStore.FILE_PREFIX) + "(\\d+)" + Pattern.quote(Hdf5ProbeStore.FILE_SUFFIX));

  private final List<Path> resultsPaths;

  /// create a catalog
  /// @param resultsPaths
  ///     the results directories, in simulation order
  public ProbeCatalog(List<Path> resultsPaths) {
    if (resultsPaths == null || resultsPaths.isEmpty()) {
      throw new ProbeConfigurationException("at least one results directory is required");
    }
    this.resultsPaths = List.copyOf(resultsPaths);
  }

  /// @return the results directories
  public List<Path> resultsPaths() {
    return resultsPaths;
  }

  /// @return the numbers of every probe with a file in any results directory
  public SortedSet<Integer> probeNumbers() {
    SortedSet<Integer> numbers = new TreeSet<>();
    for (Path dir : resultsPaths) {
      if (!Files.isDirectory(dir)) {
        logger.debug("results path {} is not a directory", dir);
        continue;
      }
      try (Stream<Path> entries = Files.list(dir)) {
        entries.forEach(entry -> {
          Matcher matcher = PROBE_FILE.matcher(entry.getFileName().toString());
          if (matcher.matches()) {
            numbers.add(Integer.parseInt(matcher.group(1)));
          }
        });
      } catch (IOException e) {
        throw new ProbeStorageException("Cannot list results directory " + dir, e);
      }
    }
    return numbers;
  }

  /// open a probe
  /// @param probeNumber
  ///     the probe number
  /// @return the store of that probe
  public ProbeStore open(int probeNumber) {
    SortedSet<Integer> available = probeNumbers();
    if (!available.contains(probeNumber)) {
      throw new ProbeConfigurationException("Probe #" + probeNumber + " not found\n" + availableProbes());
    }
    return Hdf5ProbeStore.open(probeNumber, resultsPaths);
  }

  /// describe one probe
  /// @param probeNumber
  ///     the probe number
  /// @return a multi-line summary, or a note that no readable file was found
  public String describe(int probeNumber) {
    for (Path dir : resultsPaths) {
      Path file = dir.resolve(Hdf5ProbeStore.fileName(probeNumber));
      if (Files.isReadable(file)) {
        try {
          return Hdf5ProbeStore.readMetadata(probeNumber, file).describe();
        } catch (ProbeStorageException e) {
          logger.debug("cannot describe {}: {}", file, e.getMessage());
        }
      }
    }
    return "Probe #" + probeNumber + ": \n\tFile not found or not readable";
  }

  /// @return a listing of every available probe, or a note that none was found
  public String availableProbes() {
    SortedSet<Integer> numbers = probeNumbers();
    if (numbers.isEmpty()) {
      return "No probes found in " + resultsPaths;
    }
    StringBuilder sb = new StringBuilder("Printing available probes:\n--------------------------");
    for (int number : numbers) {
      sb.append('\n').append(describe(number));
    }
    return sb.toString();
  }
}
