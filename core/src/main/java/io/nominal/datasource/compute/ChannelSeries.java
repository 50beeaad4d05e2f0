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
 * Union of the ways a raw channel can be addressed. Only asset scoped
 * channels are supported.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "type", "asset" })
public final class ChannelSeries {
  private final AssetChannel asset;

  private ChannelSeries(final AssetChannel asset) {
    this.asset = asset;
  }

  public static ChannelSeries asset(final AssetChannel asset) {
    if (asset == null) {
      throw new IllegalArgumentException("Asset channel cannot be null.");
    }
    return new ChannelSeries(asset);
  }

  @JsonProperty("type")
  public String type() {
    return "asset";
  }

  @JsonProperty("asset")
  public AssetChannel asset() {
    return asset;
  }
}
