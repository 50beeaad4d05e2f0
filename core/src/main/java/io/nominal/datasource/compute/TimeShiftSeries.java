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
 * Shifts the timestamps of the input series by a fixed duration.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "input", "duration" })
public final class TimeShiftSeries {
  private final NumericSeries input;
  private final DurationConstant duration;

  /**
   * Default ctor.
   * @param input The non-null series to shift.
   * @param duration The non-null shift.
   */
  public TimeShiftSeries(final NumericSeries input,
                         final DurationConstant duration) {
    if (input == null) {
      throw new IllegalArgumentException("Input cannot be null.");
    }
    if (duration == null) {
      throw new IllegalArgumentException("Duration cannot be null.");
    }
    this.input = input;
    this.duration = duration;
  }

  @JsonProperty("input")
  public NumericSeries input() {
    return input;
  }

  @JsonProperty("duration")
  public DurationConstant duration() {
    return duration;
  }
}
