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
package io.nominal.datasource.data;

import java.util.Collections;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;

/**
 * Responses for a batch of queries keyed by ref ID.
 *
 * @since 1.0
 */
public final class QueryDataResponse {
  private final Map<String, DataResponse> responses;

  public QueryDataResponse() {
    responses = Maps.newConcurrentMap();
  }

  /**
   * Records a response. The last write for a ref ID wins.
   * @param ref_id A non-null and non-empty ref ID.
   * @param response A non-null response.
   * @return This.
   */
  public QueryDataResponse put(final String ref_id,
                               final DataResponse response) {
    if (Strings.isNullOrEmpty(ref_id)) {
      throw new IllegalArgumentException("Ref ID cannot be null or empty.");
    }
    if (response == null) {
      throw new IllegalArgumentException("Response cannot be null.");
    }
    responses.put(ref_id, response);
    return this;
  }

  /**
   * Copies all of the given responses.
   * @param others A non-null map.
   * @return This.
   */
  public QueryDataResponse putAll(final Map<String, DataResponse> others) {
    responses.putAll(others);
    return this;
  }

  /**
   * @param ref_id The ref ID.
   * @return The response or null if none was recorded.
   */
  public DataResponse get(final String ref_id) {
    return responses.get(ref_id);
  }

  public Map<String, DataResponse> responses() {
    return Collections.unmodifiableMap(responses);
  }

  public int size() {
    return responses.size();
  }
}
