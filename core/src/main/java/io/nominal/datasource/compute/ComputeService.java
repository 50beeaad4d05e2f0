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

import io.nominal.datasource.core.DataSourceSettings;

/**
 * The remote compute service. Implementations must be thread safe.
 *
 * @since 1.0
 */
public interface ComputeService {

  /**
   * Evaluates all of the requests in a single remote call.
   * @param settings The non-null settings with the base URL and API key.
   * @param requests A non-null and non-empty list of requests.
   * @return An execution whose deferred resolves to one result per request,
   * in request order, or to an exception if the call failed.
   */
  public ComputeExecution batchCompute(final DataSourceSettings settings,
                                       final List<ComputeNodeRequest> requests);
}
