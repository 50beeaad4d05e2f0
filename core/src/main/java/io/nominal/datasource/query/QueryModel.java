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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;

/**
 * The decoded per-query JSON. Immutable; {@link #toBuilder()} returns a
 * builder seeded with this model's values for derived copies such as the
 * interpolated model.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = QueryModel.Builder.class)
public final class QueryModel {
  /** The query type marker for connection tests. */
  public static final String CONNECTION_TEST = "connectionTest";

  private final String asset_rid;
  private final String channel;
  private final String data_scope_name;
  private final int buckets;
  private final String query_type;
  private final Map<String, Object> template_variables;
  private final String query_text;
  private final double constant;
  private final long time_shift_seconds;

  protected QueryModel(final Builder builder) {
    asset_rid = builder.asset_rid;
    channel = builder.channel;
    data_scope_name = builder.data_scope_name;
    buckets = builder.buckets;
    query_type = builder.query_type;
    template_variables = builder.template_variables == null ? null :
        Collections.unmodifiableMap(
            new LinkedHashMap<String, Object>(builder.template_variables));
    query_text = builder.query_text;
    constant = builder.constant;
    time_shift_seconds = builder.time_shift_seconds;
  }

  @JsonProperty("assetRid")
  public String assetRid() {
    return asset_rid;
  }

  @JsonProperty("channel")
  public String channel() {
    return channel;
  }

  /** @return The data scope, may be null when not provided. */
  @JsonProperty("dataScopeName")
  public String dataScopeName() {
    return data_scope_name;
  }

  @JsonProperty("buckets")
  public int buckets() {
    return buckets;
  }

  @JsonProperty("queryType")
  public String queryType() {
    return query_type;
  }

  /** @return The variables, may be null. Values are strings, numbers or
   * booleans as decoded. */
  @JsonProperty("templateVariables")
  public Map<String, Object> templateVariables() {
    return template_variables;
  }

  @JsonProperty("queryText")
  public String queryText() {
    return query_text;
  }

  @JsonProperty("constant")
  public double constant() {
    return constant;
  }

  @JsonProperty("timeShiftSeconds")
  public long timeShiftSeconds() {
    return time_shift_seconds;
  }

  /** @return A builder seeded with this model's values. */
  public Builder toBuilder() {
    return newBuilder()
        .setAssetRid(asset_rid)
        .setChannel(channel)
        .setDataScopeName(data_scope_name)
        .setBuckets(buckets)
        .setQueryType(query_type)
        .setTemplateVariables(template_variables == null ? null :
            new LinkedHashMap<String, Object>(template_variables))
        .setQueryText(query_text)
        .setConstant(constant)
        .setTimeShiftSeconds(time_shift_seconds);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("assetRid", asset_rid)
        .add("channel", channel)
        .add("dataScopeName", data_scope_name)
        .add("buckets", buckets)
        .add("queryType", query_type)
        .add("queryText", query_text)
        .add("constant", constant)
        .add("timeShiftSeconds", time_shift_seconds)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty("assetRid")
    private String asset_rid;
    @JsonProperty("channel")
    private String channel;
    @JsonProperty("dataScopeName")
    private String data_scope_name;
    @JsonProperty("buckets")
    private int buckets;
    @JsonProperty("queryType")
    private String query_type;
    @JsonProperty("templateVariables")
    private Map<String, Object> template_variables;
    @JsonProperty("queryText")
    private String query_text;
    @JsonProperty("constant")
    private double constant;
    @JsonProperty("timeShiftSeconds")
    private long time_shift_seconds;

    public Builder setAssetRid(final String asset_rid) {
      this.asset_rid = asset_rid;
      return this;
    }

    public Builder setChannel(final String channel) {
      this.channel = channel;
      return this;
    }

    public Builder setDataScopeName(final String data_scope_name) {
      this.data_scope_name = data_scope_name;
      return this;
    }

    public Builder setBuckets(final int buckets) {
      this.buckets = buckets;
      return this;
    }

    public Builder setQueryType(final String query_type) {
      this.query_type = query_type;
      return this;
    }

    public Builder setTemplateVariables(
        final Map<String, Object> template_variables) {
      this.template_variables = template_variables;
      return this;
    }

    public Builder addTemplateVariable(final String name, final Object value) {
      if (template_variables == null) {
        template_variables = new LinkedHashMap<String, Object>();
      }
      template_variables.put(name, value);
      return this;
    }

    public Builder setQueryText(final String query_text) {
      this.query_text = query_text;
      return this;
    }

    public Builder setConstant(final double constant) {
      this.constant = constant;
      return this;
    }

    public Builder setTimeShiftSeconds(final long time_shift_seconds) {
      this.time_shift_seconds = time_shift_seconds;
      return this;
    }

    public QueryModel build() {
      return new QueryModel(this);
    }
  }
}
