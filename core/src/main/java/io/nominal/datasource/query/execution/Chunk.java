// This file is part of the Nominal Data Source.
// Copyright (C) 2026  The Nominal Data Source Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package io.nominal.datasource.query.execution;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import io.nominal.datasource.compute.ComputeNodeRequest;

/**
 * An ordered, non-empty slice of the pending queries sent in one batch call.
 * The position of a query in the chunk is the position of its result in the
 * response.
 *
 * @since 1.0
 */
public final class Chunk {
  private final int index;
  private final List<PendingQuery> queries;

  /**
   * Default ctor.
   * @param index The zero based index of the chunk within the batch.
   * @param queries A non-null and non-empty list of queries.
   */
  public Chunk(final int index, final List<PendingQuery> queries) {
    if (index < 0) {
      throw new IllegalArgumentException("Index cannot be negative.");
    }
    if (queries == null || queries.isEmpty()) {
      throw new IllegalArgumentException("Queries cannot be null or empty.");
    }
    this.index = index;
    this.queries = ImmutableList.copyOf(queries);
  }

  /**
   * Splits the pending queries into order preserving chunks of at most
   * {@code max_size} entries.
   * @param pending A non-null list of queries, may be empty.
   * @param max_size The maximum chunk size, at least 1.
   * @return The chunks, empty if there were no queries.
   */
  public static List<Chunk> partition(final List<PendingQuery> pending,
                                      final int max_size) {
    if (pending == null) {
      throw new IllegalArgumentException("Pending queries cannot be null.");
    }
    if (max_size < 1) {
      throw new IllegalArgumentException("Max size must be at least 1: "
          + max_size);
    }
    final List<Chunk> chunks = Lists.newArrayList();
    for (final List<PendingQuery> slice : Lists.partition(pending, max_size)) {
      chunks.add(new Chunk(chunks.size(), slice));
    }
    return chunks;
  }

  public int index() {
    return index;
  }

  public List<PendingQuery> queries() {
    return queries;
  }

  public int size() {
    return queries.size();
  }

  /** @return The compute requests in chunk order. */
  public List<ComputeNodeRequest> requests() {
    final List<ComputeNodeRequest> requests =
        Lists.newArrayListWithCapacity(queries.size());
    for (final PendingQuery query : queries) {
      requests.add(query.request());
    }
    return requests;
  }

  @Override
  public String toString() {
    return "Chunk[" + index + ", size=" + queries.size() + "]";
  }
}
