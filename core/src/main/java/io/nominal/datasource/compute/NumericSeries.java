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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Union of numeric series nodes: a raw channel or a time shift over another
 * numeric series.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "type", "channel", "timeShift" })
public final class NumericSeries {
  private final ChannelSeries channel;
  private final TimeShiftSeries time_shift;

  private NumericSeries(final ChannelSeries channel,
                        final TimeShiftSeries time_shift) {
    this.channel = channel;
    this.time_shift = time_shift;
  }

  public static NumericSeries channel(final ChannelSeries channel) {
    if (channel == null) {
      throw new IllegalArgumentException("Channel cannot be null.");
    }
    return new NumericSeries(channel, null);
  }

  public static NumericSeries timeShift(final TimeShiftSeries time_shift) {
    if (time_shift == null) {
      throw new IllegalArgumentException("Time shift cannot be null.");
    }
    return new NumericSeries(null, time_shift);
  }

  @JsonProperty("type")
  public String type() {
    return channel != null ? "channel" : "timeShift";
  }

  @JsonProperty("channel")
  public ChannelSeries channel() {
    return channel;
  }

  @JsonProperty("timeShift")
  public TimeShiftSeries timeShift() {
    return time_shift;
  }
}
