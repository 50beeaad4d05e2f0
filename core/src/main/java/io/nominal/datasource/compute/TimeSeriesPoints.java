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

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Parallel, equal length time and value columns ready for a data frame.
 *
 * @since 1.0
 */
public final class TimeSeriesPoints {
  private static final TimeSeriesPoints EMPTY = new TimeSeriesPoints(
      Collections.<Instant>emptyList(), Collections.<Double>emptyList());

  private final List<Instant> times;
  private final List<Double> values;

  /**
   * Default ctor.
   * @param times The non-null times.
   * @param values The non-null values, same length as the times.
   * @throws IllegalArgumentException if the lists were null or of differing
   * lengths.
   */
  public TimeSeriesPoints(final List<Instant> times, final List<Double> values) {
    if (times == null || values == null) {
      throw new IllegalArgumentException("Times and values cannot be null.");
    }
    if (times.size() != values.size()) {
      throw new IllegalArgumentException("Times [" + times.size()
          + "] and values [" + values.size() + "] differ in length.");
    }
    this.times = ImmutableList.copyOf(times);
    this.values = ImmutableList.copyOf(values);
  }

  /** @return An empty series. */
  public static TimeSeriesPoints empty() {
    return EMPTY;
  }

  public List<Instant> times() {
    return times;
  }

  public List<Double> values() {
    return values;
  }

  public int size() {
    return times.size();
  }

  public boolean isEmpty() {
    return times.isEmpty();
  }
}
