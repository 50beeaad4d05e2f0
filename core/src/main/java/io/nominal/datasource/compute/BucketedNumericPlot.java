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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Down-sampled numeric data: one {@link NumericBucket} per timestamp.
 *
 * @since 1.0
 */
public final class BucketedNumericPlot implements Plot {
  private final List<Timestamp> timestamps;
  private final List<NumericBucket> buckets;

  /**
   * Default ctor.
   * @param timestamps The timestamps, null is treated as empty.
   * @param buckets The buckets, null is treated as empty.
   */
  public BucketedNumericPlot(final List<Timestamp> timestamps,
                             final List<NumericBucket> buckets) {
    this.timestamps = timestamps == null ? Collections.<Timestamp>emptyList()
        : ImmutableList.copyOf(timestamps);
    this.buckets = buckets == null ? Collections.<NumericBucket>emptyList()
        : ImmutableList.copyOf(buckets);
  }

  public List<Timestamp> timestamps() {
    return timestamps;
  }

  public List<NumericBucket> buckets() {
    return buckets;
  }

  @Override
  public Type type() {
    return Type.BUCKETED_NUMERIC;
  }

  @Override
  public <T> T accept(final Visitor<T> visitor) {
    return visitor.visitBucketedNumeric(this);
  }
}
