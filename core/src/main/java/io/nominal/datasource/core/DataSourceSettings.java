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
package io.nominal.datasource.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

import io.nominal.datasource.configuration.ConfigurationException;
import io.nominal.datasource.utils.JSON;

/**
 * Decoded data source settings: the API base URL (or the legacy
 * {@code path} field) and the API key from the secure store. Immutable and
 * loaded once per request batch.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = DataSourceSettings.Builder.class)
public final class DataSourceSettings {
  /** The secure store key of the API key. */
  public static final String API_KEY = "apiKey";

  private final String base_url;
  private final String path;
  private final String api_key;

  protected DataSourceSettings(final Builder builder) {
    base_url = builder.base_url;
    path = builder.path;
    api_key = builder.api_key;
  }

  /**
   * Decodes the instance settings.
   * @param instance The non-null instance settings.
   * @return The decoded settings.
   * @throws ConfigurationException if the JSON could not be decoded.
   */
  public static DataSourceSettings load(
      final DataSourceInstanceSettings instance) {
    if (instance == null) {
      throw new IllegalArgumentException("Instance settings cannot be null.");
    }
    DataSourceSettings decoded = null;
    if (!Strings.isNullOrEmpty(instance.jsonData())) {
      try {
        decoded = JSON.parseToObject(instance.jsonData(),
            DataSourceSettings.class);
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("could not decode settings json: "
            + e.getMessage(), e);
      }
    }
    final Builder builder = decoded == null ? newBuilder()
        : decoded.toBuilder();
    return builder
        .setApiKey(instance.decryptedSecureJsonData().get(API_KEY))
        .build();
  }

  /** @return The configured base URL, may be null. */
  public String baseUrl() {
    return base_url;
  }

  /** @return The legacy base URL field, may be null. */
  public String path() {
    return path;
  }

  /** @return The API key, may be null. */
  public String apiKey() {
    return api_key;
  }

  /** @return The base URL, falling back to the legacy path, or an empty
   * string if neither was set. */
  public String apiBaseUrl() {
    if (!Strings.isNullOrEmpty(base_url)) {
      return base_url;
    }
    if (!Strings.isNullOrEmpty(path)) {
      return path;
    }
    return "";
  }

  /**
   * The URL remote calls are made against.
   * @param default_url The URL to use when none is configured.
   * @return The base URL without a trailing slash.
   */
  public String resolveBaseUrl(final String default_url) {
    String url = apiBaseUrl();
    if (url.isEmpty()) {
      url = Strings.nullToEmpty(default_url);
    }
    if (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    return url;
  }

  public Builder toBuilder() {
    return newBuilder()
        .setBaseUrl(base_url)
        .setPath(path)
        .setApiKey(api_key);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("baseUrl", base_url)
        .add("path", path)
        .add("apiKey", Strings.isNullOrEmpty(api_key) ? "<unset>" : "<set>")
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty("baseUrl")
    private String base_url;
    @JsonProperty("path")
    private String path;
    private String api_key;

    public Builder setBaseUrl(final String base_url) {
      this.base_url = base_url;
      return this;
    }

    public Builder setPath(final String path) {
      this.path = path;
      return this;
    }

    public Builder setApiKey(final String api_key) {
      this.api_key = api_key;
      return this;
    }

    public DataSourceSettings build() {
      return new DataSourceSettings(this);
    }
  }
}
