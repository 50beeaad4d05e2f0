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
package io.nominal.datasource.utils;

import java.time.Instant;

/**
 * Time helpers. The clock pass-throughs exist so tests can mock this class
 * instead of {@link System}.
 *
 * @since 1.0
 */
public class DateTime {

  /** @return The current epoch time in milliseconds. */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  /** @return {@link System#nanoTime()} */
  public static long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp
   * @param start The start timestamp
   * @return The value in milliseconds
   * @throws IllegalArgumentException if end is less than start
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }

  /**
   * Builds an instant from epoch seconds and a nanosecond adjustment. Nanos
   * outside of [0, 999999999] are normalized into the seconds.
   * @param seconds Unix epoch seconds.
   * @param nanos Nanosecond adjustment.
   * @return A non-null instant.
   */
  public static Instant toInstant(final long seconds, final long nanos) {
    return Instant.ofEpochSecond(seconds, nanos);
  }
}
