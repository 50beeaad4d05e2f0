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

import java.time.Instant;

import com.google.common.base.MoreObjects;

/**
 * An inclusive time range for a dashboard query.
 *
 * @since 1.0
 */
public final class TimeRange {
  private final Instant from;
  private final Instant to;

  /**
   * Default ctor.
   * @param from A non-null start.
   * @param to A non-null end, not before the start.
   * @throws IllegalArgumentException if either end was null or the end was
   * before the start.
   */
  public TimeRange(final Instant from, final Instant to) {
    if (from == null) {
      throw new IllegalArgumentException("From cannot be null.");
    }
    if (to == null) {
      throw new IllegalArgumentException("To cannot be null.");
    }
    if (to.isBefore(from)) {
      throw new IllegalArgumentException("To [" + to
          + "] cannot be before from [" + from + "]");
    }
    this.from = from;
    this.to = to;
  }

  public Instant from() {
    return from;
  }

  public Instant to() {
    return to;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("from", from)
        .add("to", to)
        .toString();
  }
}
