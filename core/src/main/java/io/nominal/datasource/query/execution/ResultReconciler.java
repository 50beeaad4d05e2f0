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
import java.util.Map;

import io.nominal.datasource.compute.ComputeResult;
import io.nominal.datasource.data.DataResponse;

/**
 * Maps the results of one batch call back onto the queries of the chunk that
 * produced it.
 *
 * @since 1.0
 */
public interface ResultReconciler {

  /**
   * Produces exactly one response per query in the chunk. Implementations
   * must not throw for a single bad result; the failure belongs to that
   * query's response.
   * @param chunk The non-null chunk that was sent.
   * @param results The non-null results as received, possibly shorter or
   * longer than the chunk.
   * @return A map of ref ID to response covering every query of the chunk.
   */
  public Map<String, DataResponse> reconcile(final Chunk chunk,
                                             final List<ComputeResult> results);
}
