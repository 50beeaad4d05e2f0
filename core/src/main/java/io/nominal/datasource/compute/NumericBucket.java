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

/**
 * Summary statistics for one bucket of a {@link BucketedNumericPlot}.
 *
 * @since 1.0
 */
public final class NumericBucket {
  private final double min;
  private final double max;
  private final double mean;
  private final long count;

  public NumericBucket(final double min,
                       final double max,
                       final double mean,
                       final long count) {
    this.min = min;
    this.max = max;
    this.mean = mean;
    this.count = count;
  }

  public double min() {
    return min;
  }

  public double max() {
    return max;
  }

  public double mean() {
    return mean;
  }

  public long count() {
    return count;
  }
}
