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
package io.nominal.datasource.compute;

import java.util.List;

import io.nominal.datasource.query.execution.QueryExecution;

/**
 * An in-flight batch compute call. The deferred resolves to the positional
 * results, which may be shorter than the request list, or to an exception
 * when the call as a whole failed.
 *
 * @since 1.0
 */
public abstract class ComputeExecution
    extends QueryExecution<List<ComputeResult>> {

  /** The number of requests sent. */
  protected final int request_count;

  /** @param request_count The number of requests sent in the call. */
  public ComputeExecution(final int request_count) {
    super();
    this.request_count = request_count;
  }

  /** @return The number of requests sent in the call. */
  public int requestCount() {
    return request_count;
  }
}
