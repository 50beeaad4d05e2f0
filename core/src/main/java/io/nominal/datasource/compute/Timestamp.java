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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;

import io.nominal.datasource.utils.DateTime;

/**
 * A point in time as exchanged with the compute API: Unix epoch seconds and
 * a nanosecond adjustment.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "seconds", "nanos" })
public final class Timestamp {
  private final long seconds;
  private final long nanos;

  @JsonCreator
  public Timestamp(@JsonProperty("seconds") final long seconds,
                   @JsonProperty("nanos") final long nanos) {
    this.seconds = seconds;
    this.nanos = nanos;
  }

  /**
   * Converts an instant to whole seconds, discarding any sub-second
   * precision. Requests are bounded at second granularity.
   * @param instant A non-null instant.
   * @return A timestamp with zero nanos.
   */
  public static Timestamp ofEpochSecond(final Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null.");
    }
    return new Timestamp(instant.getEpochSecond(), 0);
  }

  @JsonProperty("seconds")
  public long seconds() {
    return seconds;
  }

  @JsonProperty("nanos")
  public long nanos() {
    return nanos;
  }

  /** @return The timestamp as an absolute instant. */
  public Instant toInstant() {
    return DateTime.toInstant(seconds, nanos);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Timestamp other = (Timestamp) o;
    return seconds == other.seconds && nanos == other.nanos;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(seconds, nanos);
  }

  @Override
  public String toString() {
    return seconds + "." + nanos;
  }
}
