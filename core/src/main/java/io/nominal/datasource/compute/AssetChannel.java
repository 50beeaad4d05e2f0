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
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * References a channel on an asset, optionally within a named data scope.
 * Tag filters and grouping are not used so they serialize empty.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "assetRid", "channel", "dataScopeName", "additionalTags",
  "tagsToGroupBy", "groupByTags" })
public final class AssetChannel {
  private final StringConstant asset_rid;
  private final StringConstant channel;
  private final StringConstant data_scope_name;

  protected AssetChannel(final Builder builder) {
    if (builder.asset_rid == null) {
      throw new IllegalArgumentException("Asset RID cannot be null.");
    }
    if (builder.channel == null) {
      throw new IllegalArgumentException("Channel cannot be null.");
    }
    if (builder.data_scope_name == null) {
      throw new IllegalArgumentException("Data scope name cannot be null.");
    }
    asset_rid = builder.asset_rid;
    channel = builder.channel;
    data_scope_name = builder.data_scope_name;
  }

  @JsonProperty("assetRid")
  public StringConstant assetRid() {
    return asset_rid;
  }

  @JsonProperty("channel")
  public StringConstant channel() {
    return channel;
  }

  @JsonProperty("dataScopeName")
  public StringConstant dataScopeName() {
    return data_scope_name;
  }

  @JsonProperty("additionalTags")
  public Map<String, StringConstant> additionalTags() {
    return Collections.emptyMap();
  }

  @JsonProperty("tagsToGroupBy")
  public List<String> tagsToGroupBy() {
    return Collections.emptyList();
  }

  @JsonProperty("groupByTags")
  public List<String> groupByTags() {
    return Collections.emptyList();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private StringConstant asset_rid;
    private StringConstant channel;
    private StringConstant data_scope_name;

    public Builder setAssetRid(final StringConstant asset_rid) {
      this.asset_rid = asset_rid;
      return this;
    }

    public Builder setChannel(final StringConstant channel) {
      this.channel = channel;
      return this;
    }

    public Builder setDataScopeName(final StringConstant data_scope_name) {
      this.data_scope_name = data_scope_name;
      return this;
    }

    public AssetChannel build() {
      return new AssetChannel(this);
    }
  }
}
