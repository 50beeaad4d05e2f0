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
package io.nominal.datasource.query;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * One query as submitted by the dashboard: the panel's ref ID, the raw query
 * JSON and the panel's time range.
 *
 * @since 1.0
 */
public final class DataQuery {
  private final String ref_id;
  private final String json;
  private final TimeRange time_range;

  /**
   * Default ctor.
   * @param ref_id A non-null and non-empty ID, unique within the batch.
   * @param json The raw JSON, may be null or malformed. Decoding happens per
   * query so a bad payload only fails its own response.
   * @param time_range A non-null time range.
   */
  public DataQuery(final String ref_id,
                   final String json,
                   final TimeRange time_range) {
    if (Strings.isNullOrEmpty(ref_id)) {
      throw new IllegalArgumentException("Ref ID cannot be null or empty.");
    }
    if (time_range == null) {
      throw new IllegalArgumentException("Time range cannot be null.");
    }
    this.ref_id = ref_id;
    this.json = json;
    this.time_range = time_range;
  }

  public String refId() {
    return ref_id;
  }

  public String json() {
    return json;
  }

  public TimeRange timeRange() {
    return time_range;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("refId", ref_id)
        .add("timeRange", time_range)
        .toString();
  }
}
