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

import io.jhdf.HdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import io.probetools.probedata.ProbeStorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.regex.Pattern;

/// A [ProbeStore] reading `Probes<N>.h5` files with jHDF.
///
/// A simulation restarted into several results directories leaves one file per directory. All
/// of them are opened; timesteps recorded in a later directory replace those of an earlier one,
/// and metadata and positions come from the first readable file.
///
/// ### File layout
/// - root attributes `dimension`, `fields` (comma separated) and optionally `time_integral`
/// - datasets `number` (points per axis), `p0`, `p1`, ... (vertices) and `positions`
///   (`numpoints x ndim`)
/// - one dataset per timestep, named by its iteration number, of shape `nfields x numpoints`,
///   optionally carrying an `x_moved` attribute
public class Hdf5ProbeStore implements ProbeStore {
  private static final Logger logger = LogManager.getLogger(Hdf5ProbeStore.class);

  /// name prefix of probe files
  public static final String FILE_PREFIX = "Probes";
  /// name suffix of probe files
  public static final String FILE_SUFFIX = ".h5";

  private static final Pattern TIMESTEP_NAME = Pattern.compile("\\d+");

  private final List<HdfFile> files;
  private final ProbeMetadata metadata;
  private final Dataset positions;
  private final TreeMap<Long, Dataset> dataForTime;

  private Hdf5ProbeStore(List<HdfFile> files, ProbeMetadata metadata, Dataset positions, TreeMap<Long, Dataset> dataForTime) {
    this.files = files;
    this.metadata = metadata;
    this.positions = positions;
    this.dataForTime = dataForTime;
  }

  /// the file name of a probe
  /// @param probeNumber
  ///     the probe number
  /// @return `Probes<N>.h5`
  public static String fileName(int probeNumber) {
    return FILE_PREFIX + probeNumber + FILE_SUFFIX;
  }

  /// open the files of a probe
  /// @param probeNumber
  ///     the probe number
  /// @param resultsPaths
  ///     the results directories, in simulation order
  /// @return the store
  public static Hdf5ProbeStore open(int probeNumber, List<Path> resultsPaths) {
    String name = fileName(probeNumber);
    List<HdfFile> files = new ArrayList<>();
    for (Path dir : resultsPaths) {
      Path file = dir.resolve(name);
      if (!Files.isReadable(file)) {
        logger.debug("no readable {} in {}", name, dir);
        continue;
      }
      try {
        files.add(new HdfFile(file));
        logger.debug("opened {}", file);
      } catch (HdfException e) {
        logger.warn("skipping unreadable probe file {}: {}", file, e.getMessage());
      }
    }
    if (files.isEmpty()) {
      throw new ProbeStorageException("Cannot open any file " + name + " in " + resultsPaths);
    }

    try {
      HdfFile first = files.get(0);
      Dataset positions = first.getDatasetByPath("positions");
      ProbeMetadata metadata = readMetadata(probeNumber, first, positions);

      TreeMap<Long, Dataset> dataForTime = new TreeMap<>();
      for (HdfFile file : files) {
        for (Map.Entry<String, Node> entry : file.getChildren().entrySet()) {
          if (entry.getValue() instanceof Dataset dataset && TIMESTEP_NAME.matcher(entry.getKey()).matches()) {
            dataForTime.put(Long.parseLong(entry.getKey()), dataset);
          }
        }
      }
      if (dataForTime.isEmpty()) {
        throw new ProbeStorageException("No timesteps found in " + name + " of " + resultsPaths);
      }
      logger.info("probe #{}: {} points, {} fields, {} timesteps from {} file(s)", probeNumber, metadata.numpoints(),
          metadata.fields().size(), dataForTime.size(), files.size());
      return new Hdf5ProbeStore(files, metadata, positions, dataForTime);
    } catch (HdfException | ProbeStorageException e) {
      closeAll(files);
      if (e instanceof ProbeStorageException storage) {
        throw storage;
      }
      throw new ProbeStorageException("Cannot read " + name + ": " + e.getMessage(), e);
    }
  }

  /// read only the metadata of a probe file
  /// @param probeNumber
  ///     the probe number
  /// @param file
  ///     the probe file
  /// @return the metadata
  public static ProbeMetadata readMetadata(int probeNumber, Path file) {
    try (HdfFile hdf = new HdfFile(file)) {
      return readMetadata(probeNumber, hdf, hdf.getDatasetByPath("positions"));
    } catch (HdfException e) {
      throw new ProbeStorageException("Cannot read " + file + ": " + e.getMessage(), e);
    }
  }

  private static ProbeMetadata readMetadata(int probeNumber, HdfFile file, Dataset positions) {
    int dimension = (int) Hdf5Values.toLong(Hdf5Values.attribute(file, "dimension"), "attribute 'dimension'");
    String fieldList = Hdf5Values.toText(Hdf5Values.attribute(file, "fields"), "attribute 'fields'");
    List<String> fields = new ArrayList<>();
    for (String field : fieldList.split(",")) {
      if (!field.isBlank()) {
        fields.add(field.trim());
      }
    }
    boolean timeIntegrated = Hdf5Values.toFlag(Hdf5Values.attribute(file, "time_integral"), "attribute 'time_integral'");
    int[] shape = Hdf5Values.toInts(file.getDatasetByPath("number").getData(), "dataset 'number'");

    Map<String, Node> children = file.getChildren();
    List<double[]> vertices = new ArrayList<>();
    for (int i = 0; children.containsKey("p" + i); i++) {
      vertices.add(Hdf5Values.toDoubles(((Dataset) children.get("p" + i)).getData(), "dataset 'p" + i + "'"));
    }
    if (vertices.isEmpty()) {
      throw new ProbeStorageException("probe #" + probeNumber + " declares no reference point p0");
    }
    long numpoints = positions.getDimensions()[0];
    return new ProbeMetadata(probeNumber, dimension, shape, vertices.toArray(new double[0][]),
        Collections.unmodifiableList(fields), timeIntegrated, numpoints);
  }

  @Override
  public ProbeMetadata metadata() {
    return metadata;
  }

  @Override
  public double[][] readPositions(long first, int count) {
    int[] dimensions = positions.getDimensions();
    if (dimensions.length == 1) {
      double[] values = Hdf5Values.toDoubles(positions.getData(new long[]{first}, new int[]{count}), "positions");
      double[][] rows = new double[values.length][];
      for (int i = 0; i < values.length; i++) {
        rows[i] = new double[]{values[i]};
      }
      return rows;
    }
    Object data = positions.getData(new long[]{first, 0}, new int[]{count, dimensions[1]});
    return Hdf5Values.toDoubleMatrix(data, "positions");
  }

  @Override
  public NavigableSet<Long> timesteps() {
    return Collections.unmodifiableNavigableSet(dataForTime.navigableKeySet());
  }

  @Override
  public double[] readField(long timestep, int fieldIndex, long first, int count) {
    Dataset dataset = timestepDataset(timestep);
    Object data = dataset.getData(new long[]{fieldIndex, first}, new int[]{1, count});
    double[][] rows = Hdf5Values.toDoubleMatrix(data, "timestep " + timestep);
    return rows[0];
  }

  @Override
  public OptionalDouble xMoved(long timestep) {
    Object moved = Hdf5Values.attribute(timestepDataset(timestep), "x_moved");
    if (moved == null) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(Hdf5Values.toDoubles(moved, "attribute 'x_moved'")[0]);
  }

  private Dataset timestepDataset(long timestep) {
    Dataset dataset = dataForTime.get(timestep);
    if (dataset == null) {
      throw new IllegalArgumentException("timestep " + timestep + " is not recorded by probe #" + metadata.probeNumber());
    }
    return dataset;
  }

  @Override
  public void close() {
    closeAll(files);
  }

  private static void closeAll(List<HdfFile> files) {
    for (HdfFile file : files) {
      try {
        file.close();
      } catch (HdfException e) {
        logger.warn("error closing {}: {}", file.getFile(), e.getMessage());
      }
    }
  }

  @Override
  public String toString() {
    return "Hdf5ProbeStore{probe=" + metadata.probeNumber() + ", files=" + files.size() + ", timesteps="
        + dataForTime.size() + ", shape=" + Arrays.toString(metadata.shape()) + "}";
  }
}
