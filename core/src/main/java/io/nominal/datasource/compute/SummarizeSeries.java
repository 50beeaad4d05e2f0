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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Asks the compute service to summarize the input into at most
 * {@code buckets} buckets. A bucket count of zero lets the server decide.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "input", "buckets" })
public final class SummarizeSeries {
  private final Series input;
  private final int buckets;

  /**
   * Default ctor.
   * @param input The non-null series to summarize.
   * @param buckets A non-negative bucket count.
   */
  public SummarizeSeries(final Series input, final int buckets) {
    if (input == null) {
      throw new IllegalArgumentException("Input cannot be null.");
    }
    if (buckets < 0) {
      throw new IllegalArgumentException("Buckets cannot be negative: "
          + buckets);
    }
    this.input = input;
    this.buckets = buckets;
  }

  @JsonProperty("input")
  public Series input() {
    return input;
  }

  @JsonProperty("buckets")
  public int buckets() {
    return buckets;
  }
}
