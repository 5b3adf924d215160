package io.probetools.probedata.ordering;

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

import java.util.Iterator;
import java.util.NoSuchElementException;

/// Splits `[0, total)` into consecutive chunks of at most `chunkSize` elements, in increasing
/// order. Used to bound the number of points held in memory at once.
public class ChunkedRange implements Iterable<ChunkedRange.Chunk> {

  private final long total;
  private final int chunkSize;

  /// A contiguous range of raw point indices.
  /// @param first
  ///     the first index, inclusive
  /// @param last
  ///     the last index, exclusive
  public record Chunk(long first, long last) {
    /// @return the number of indices in this chunk
    public int count() {
      return (int) (last - first);
    }

    /// @param index
    ///     a raw index
    /// @return true if the index falls inside this chunk
    public boolean contains(long index) {
      return index >= first && index < last;
    }
  }

  /// create a chunked range
  /// @param total
  ///     the number of elements
  /// @param chunkSize
  ///     the largest number of elements per chunk
  public ChunkedRange(long total, int chunkSize) {
    if (total < 0) {
      throw new IllegalArgumentException("total must be non-negative: " + total);
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunk size must be positive: " + chunkSize);
    }
    this.total = total;
    this.chunkSize = chunkSize;
  }

  /// @return the number of chunks
  public long chunkCount() {
    return (total + chunkSize - 1) / chunkSize;
  }

  @Override
  public Iterator<Chunk> iterator() {
    return new Iterator<>() {
      private long next = 0;

      @Override
      public boolean hasNext() {
        return next < total;
      }

      @Override
      public Chunk next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        long first = next;
        long last = Math.min(total, first + chunkSize);
        next = last;
        return new Chunk(first, last);
      }
    };
  }
}
