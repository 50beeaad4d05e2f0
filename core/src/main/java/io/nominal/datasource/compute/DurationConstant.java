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
 * A duration in a compute graph. Only literals are emitted.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "type", "literal" })
public final class DurationConstant {
  private final Duration literal;

  private DurationConstant(final Duration literal) {
    this.literal = literal;
  }

  /**
   * @param seconds Whole seconds.
   * @param nanos Nanosecond adjustment.
   * @return A literal duration.
   */
  public static DurationConstant literal(final long seconds, final long nanos) {
    return new DurationConstant(new Duration(seconds, nanos));
  }

  @JsonProperty("type")
  public String type() {
    return "literal";
  }

  @JsonProperty("literal")
  public Duration literal() {
    return literal;
  }

  /** Seconds and nanos of a duration. */
  @JsonPropertyOrder({ "seconds", "nanos" })
  public static final class Duration {
    private final long seconds;
    private final long nanos;

    Duration(final long seconds, final long nanos) {
      this.seconds = seconds;
      this.nanos = nanos;
    }

    @JsonProperty("seconds")
    public long seconds() {
      return seconds;
    }

    @JsonProperty("nanos")
    public long nanos() {
      return nanos;
    }
  }
}
