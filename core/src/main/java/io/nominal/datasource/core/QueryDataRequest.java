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
package io.nominal.datasource.core;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import io.nominal.datasource.query.DataQuery;

/**
 * A batch of queries submitted together by the dashboard.
 *
 * @since 1.0
 */
public final class QueryDataRequest {
  private final DataSourceInstanceSettings instance_settings;
  private final List<DataQuery> queries;

  /**
   * Default ctor.
   * @param instance_settings The instance settings, null when the data source
   * hasn't been configured.
   * @param queries A non-null list of queries with unique ref IDs.
   * @throws IllegalArgumentException if the list was null or a ref ID was
   * repeated.
   */
  public QueryDataRequest(final DataSourceInstanceSettings instance_settings,
                          final List<DataQuery> queries) {
    if (queries == null) {
      throw new IllegalArgumentException("Queries cannot be null.");
    }
    final Set<String> ids = Sets.newHashSet();
    for (final DataQuery query : queries) {
      if (!ids.add(query.refId())) {
        throw new IllegalArgumentException("Duplicate ref ID: "
            + query.refId());
      }
    }
    this.instance_settings = instance_settings;
    this.queries = ImmutableList.copyOf(queries);
  }

  /** @return The instance settings, may be null. */
  public DataSourceInstanceSettings instanceSettings() {
    return instance_settings;
  }

  public List<DataQuery> queries() {
    return queries;
  }
}
