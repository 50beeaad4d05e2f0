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
package io.nominal.datasource.configuration;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * The schema for a single configuration entry: the key, the primitive type
 * values are converted to, a default and a description for operators.
 *
 * @since 1.0
 */
public class ConfigurationEntrySchema {

  /** The configuration key */
  protected final String key;

  /** The type of data used to parse the config. */
  protected final Class<?> type;

  /** The source of this registration, i.e. the class name. */
  protected final String source;

  /** A description of the configuration item. */
  protected final String description;

  /** The default value for this config entry. */
  protected final Object default_value;

  /** Whether or not the value can be overridden at runtime. */
  protected final boolean dynamic;

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   */
  protected ConfigurationEntrySchema(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (Strings.isNullOrEmpty(builder.description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    if (builder.default_value != null &&
        !builder.type.isInstance(builder.default_value)) {
      throw new IllegalArgumentException("Default value ["
          + builder.default_value + "] is not of type " + builder.type);
    }
    key = builder.key;
    type = builder.type;
    source = builder.source;
    description = builder.description;
    default_value = builder.default_value;
    dynamic = builder.dynamic;
  }

  /** @return The non-null and non-empty key for this config entry. */
  public String getKey() {
    return key;
  }

  /** @return The type values are converted to. */
  public Class<?> getType() {
    return type;
  }

  /** @return The class that registered the schema, may be null. */
  public String getSource() {
    return source;
  }

  /** @return The description for operators. */
  public String getDescription() {
    return description;
  }

  /** @return The default value, may be null. */
  public Object getDefaultValue() {
    return default_value;
  }

  /** @return Whether or not runtime overrides are allowed. */
  public boolean isDynamic() {
    return dynamic;
  }

  /**
   * Converts a raw string from a provider into the schema type.
   * @param raw The raw value, may be null.
   * @return The converted value or null if the raw value was null.
   * @throws ConfigurationException if the value could not be converted.
   */
  public Object convert(final String raw) {
    if (raw == null) {
      return null;
    }
    final String value = raw.trim();
    try {
      if (type == String.class) {
        return raw;
      } else if (type == Integer.class) {
        return Integer.parseInt(value);
      } else if (type == Long.class) {
        return Long.parseLong(value);
      } else if (type == Double.class) {
        return Double.parseDouble(value);
      } else if (type == Boolean.class) {
        final String lc = value.toLowerCase();
        return lc.equals("true") || lc.equals("1") || lc.equals("yes");
      }
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Unable to convert value [" + raw
          + "] for key [" + key + "] to " + type.getSimpleName(), e);
    }
    throw new ConfigurationException("Unsupported type " + type
        + " for key: " + key);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("type", type.getSimpleName())
        .add("default", default_value)
        .add("dynamic", dynamic)
        .add("source", source)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String key;
    private Class<?> type;
    private String source;
    private String description;
    private Object default_value;
    private boolean dynamic;

    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }

    public Builder setType(final Class<?> type) {
      this.type = type;
      return this;
    }

    public Builder setSource(final String source) {
      this.source = source;
      return this;
    }

    public Builder setDescription(final String description) {
      this.description = description;
      return this;
    }

    public Builder setDefaultValue(final Object default_value) {
      this.default_value = default_value;
      return this;
    }

    public Builder isDynamic() {
      dynamic = true;
      return this;
    }

    public ConfigurationEntrySchema build() {
      return new ConfigurationEntrySchema(this);
    }
  }
}
