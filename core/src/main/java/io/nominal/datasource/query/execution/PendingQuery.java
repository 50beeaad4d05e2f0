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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

import io.nominal.datasource.compute.ComputeNodeRequest;
import io.nominal.datasource.query.QueryModel;

/**
 * A validated asset/channel query awaiting dispatch, with the compute
 * request built for it.
 *
 * @since 1.0
 */
public final class PendingQuery {
  private final String ref_id;
  private final QueryModel model;
  private final ComputeNodeRequest request;

  /**
   * Default ctor.
   * @param ref_id A non-null and non-empty ref ID.
   * @param model The non-null interpolated model.
   * @param request The non-null compute request.
   */
  public PendingQuery(final String ref_id,
                      final QueryModel model,
                      final ComputeNodeRequest request) {
    if (Strings.isNullOrEmpty(ref_id)) {
      throw new IllegalArgumentException("Ref ID cannot be null or empty.");
    }
    if (model == null) {
      throw new IllegalArgumentException("Model cannot be null.");
    }
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    this.ref_id = ref_id;
    this.model = model;
    this.request = request;
  }

  public String refId() {
    return ref_id;
  }

  public QueryModel model() {
    return model;
  }

  public ComputeNodeRequest request() {
    return request;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("refId", ref_id)
        .add("model", model)
        .toString();
  }
}
