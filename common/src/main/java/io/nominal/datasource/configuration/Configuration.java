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

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import io.nominal.datasource.configuration.provider.EnvironmentProvider;
import io.nominal.datasource.configuration.provider.PropertiesFileProvider;
import io.nominal.datasource.configuration.provider.Provider;
import io.nominal.datasource.configuration.provider.SystemPropertiesProvider;

/**
 * A simple key to value configuration registry. Components register a
 * {@link ConfigurationEntrySchema} for every key they read, giving the type,
 * a default value and a description. Reads then resolve the value in order
 * of precedence:
 * <ol>
 * <li>Runtime overrides (only for dynamic keys)</li>
 * <li>Providers, last in the list wins</li>
 * <li>The schema default</li>
 * </ol>
 * The default provider list is the properties file named by the
 * {@link #CONFIG_FILE_KEY} system property or environment variable (if
 * present), then the environment, then the system properties.
 * <p>
 * <b>NOTE:</b> Reading a key that was never registered throws a
 * {@link ConfigurationException}.
 *
 * @since 1.0
 */
public class Configuration implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);

  /** The key holding the path to an optional properties file. */
  public static final String CONFIG_FILE_KEY = "nominal.config.file";

  /** Providers in ascending order of precedence. */
  protected final List<Provider> providers;

  /** The registered schemas. */
  protected final Map<String, ConfigurationEntrySchema> schemas;

  /** Runtime overrides for dynamic keys. */
  protected final Map<String, Object> overrides;

  /**
   * Default ctor that loads the standard providers.
   * @throws ConfigurationException if the properties file could not be read.
   */
  public Configuration() {
    this(defaultProviders());
  }

  /**
   * Ctor with an explicit provider list.
   * @param providers A non-null list of providers in ascending order of
   * precedence. May be empty.
   * @throws IllegalArgumentException if the list was null.
   */
  public Configuration(final List<Provider> providers) {
    if (providers == null) {
      throw new IllegalArgumentException("Providers cannot be null.");
    }
    this.providers = ImmutableList.copyOf(providers);
    schemas = Maps.newConcurrentMap();
    overrides = Maps.newConcurrentMap();
  }

  /**
   * Registers a schema.
   * @param schema A non-null schema.
   * @throws IllegalArgumentException if the schema was null.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    if (schemas.putIfAbsent(schema.getKey(), schema) != null) {
      throw new ConfigurationException("Key [" + schema.getKey()
          + "] was already registered.");
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered configuration schema: " + schema);
    }
  }

  /**
   * Registers a string schema.
   * @param key A non-null and non-empty key.
   * @param default_value A default value, may be null.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final String default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(key, String.class, default_value, is_dynamic, description);
  }

  /**
   * Registers an integer schema.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final int default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(key, Integer.class, default_value, is_dynamic, description);
  }

  /**
   * Registers a long schema.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final long default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(key, Long.class, default_value, is_dynamic, description);
  }

  /**
   * Registers a boolean schema.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final boolean default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(key, Boolean.class, default_value, is_dynamic, description);
  }

  private void register(final String key,
                        final Class<?> type,
                        final Object default_value,
                        final boolean is_dynamic,
                        final String description) {
    final ConfigurationEntrySchema.Builder builder =
        ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setType(type)
        .setDefaultValue(default_value)
        .setSource(callerClassName())
        .setDescription(description);
    if (is_dynamic) {
      builder.isDynamic();
    }
    register(builder.build());
  }

  /**
   * Sets a runtime override for a dynamic key.
   * @param key A non-null and non-empty key.
   * @param value The value to set, must match the schema type.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key wasn't registered, wasn't
   * dynamic or the value was of the wrong type.
   */
  public void addOverride(final String key, final Object value) {
    final ConfigurationEntrySchema schema = schema(key);
    if (!schema.isDynamic()) {
      throw new ConfigurationException("Key [" + key
          + "] is not dynamic and cannot be overridden.");
    }
    if (value == null) {
      throw new ConfigurationException("Override for [" + key
          + "] cannot be null.");
    }
    final Object converted = value instanceof String ?
        schema.convert((String) value) : value;
    if (!schema.getType().isInstance(converted)) {
      throw new ConfigurationException("Override [" + value + "] for key ["
          + key + "] is not of type " + schema.getType());
    }
    overrides.put(key, converted);
  }

  /**
   * Removes a runtime override.
   * @param key A non-null and non-empty key.
   * @return True if an override was present and removed, false if not.
   */
  public boolean removeOverride(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return overrides.remove(key) != null;
  }

  /**
   * Determines if the given key has been registered.
   * @param key A non-null and no-empty key.
   * @return True if the key was registered, false if not and calls
   * to read methods would throw an exception.
   * @throws IllegalArgumentException if the key was null or empty.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return schemas.containsKey(key);
  }

  /**
   * @param key A non-null and non-empty key.
   * @return The string value, may be null.
   * @throws ConfigurationException if the key did not exist in the config.
   */
  public String getString(final String key) {
    final Object value = resolve(key);
    return value == null ? null : value.toString();
  }

  /**
   * @param key A non-null and non-empty key.
   * @return The integer value.
   * @throws ConfigurationException if the key did not exist in the config
   * or the value was null or not a number.
   */
  public int getInt(final String key) {
    return number(key).intValue();
  }

  /**
   * @param key A non-null and non-empty key.
   * @return The long value.
   * @throws ConfigurationException if the key did not exist in the config
   * or the value was null or not a number.
   */
  public long getLong(final String key) {
    return number(key).longValue();
  }

  /**
   * Nulls count as false.
   * @param key A non-null and non-empty key.
   * @return The boolean value.
   * @throws ConfigurationException if the key did not exist in the config.
   */
  public boolean getBoolean(final String key) {
    final Object value = resolve(key);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    final String bool = value.toString().toLowerCase().trim();
    return bool.equals("true") || bool.equals("1") || bool.equals("yes");
  }

  /** @return An unmodifiable view of the registered schemas. */
  public Map<String, ConfigurationEntrySchema> schemas() {
    return Collections.unmodifiableMap(schemas);
  }

  /** @return The providers in ascending order of precedence. */
  public List<Provider> providers() {
    return providers;
  }

  @Override
  public void close() throws IOException {
    for (final Provider provider : providers) {
      try {
        provider.close();
      } catch (IOException e) {
        LOG.error("Failed to close provider: " + provider.source(), e);
      }
    }
  }

  /**
   * Resolves the current value for the key.
   * @param key A non-null and non-empty key.
   * @return The value, may be null.
   */
  protected Object resolve(final String key) {
    final ConfigurationEntrySchema schema = schema(key);
    final Object override = overrides.get(key);
    if (override != null) {
      return override;
    }
    for (int i = providers.size() - 1; i >= 0; i--) {
      final String raw = providers.get(i).getSetting(key);
      if (raw != null) {
        return schema.convert(raw);
      }
    }
    return schema.getDefaultValue();
  }

  private ConfigurationEntrySchema schema(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ConfigurationEntrySchema schema = schemas.get(key);
    if (schema == null) {
      throw new ConfigurationException("No schema registered for key: " + key);
    }
    return schema;
  }

  private Number number(final String key) {
    final Object value = resolve(key);
    if (value == null) {
      throw new ConfigurationException("Value for key [" + key + "] was null.");
    }
    if (!(value instanceof Number)) {
      throw new ConfigurationException("Value for key [" + key
          + "] is not a number: " + value);
    }
    return (Number) value;
  }

  /** @return The standard provider list. */
  static List<Provider> defaultProviders() {
    final List<Provider> providers = Lists.newArrayList();
    String path = System.getProperty(CONFIG_FILE_KEY);
    if (Strings.isNullOrEmpty(path)) {
      path = new EnvironmentProvider().getSetting(CONFIG_FILE_KEY);
    }
    if (!Strings.isNullOrEmpty(path)) {
      providers.add(new PropertiesFileProvider(path));
    }
    providers.add(new EnvironmentProvider());
    providers.add(new SystemPropertiesProvider());
    return providers;
  }

  /** @return The name of the class that called one of the register methods. */
  private static String callerClassName() {
    final StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    for (int i = 1; i < stack.length; i++) {
      if (!stack[i].getClassName().equals(Configuration.class.getName()) &&
          !stack[i].getClassName().equals(Thread.class.getName())) {
        return stack[i].getClassName();
      }
    }
    return Configuration.class.getName();
  }
}
