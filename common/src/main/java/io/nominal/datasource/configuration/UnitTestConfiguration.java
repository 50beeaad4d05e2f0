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

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

import com.google.common.collect.Lists;

import io.nominal.datasource.configuration.provider.Provider;

/**
 * A helper for use with unit testing configuration consumers. No
 * environment, system property or file providers are loaded so tests are
 * isolated from the machine they run on.
 *
 * @since 1.0
 */
public class UnitTestConfiguration extends Configuration {

  /**
   * Ctor with the given map as the only provider.
   * @param settings A non-null map of raw values.
   */
  protected UnitTestConfiguration(final Map<String, String> settings) {
    super(Lists.<Provider>newArrayList(new UnitTestProvider(settings)));
  }

  /** @return A configuration with no provider data. */
  public static UnitTestConfiguration getConfiguration() {
    return new UnitTestConfiguration(Collections.<String, String>emptyMap());
  }

  /**
   * The map given must be a mutable reference if the test wants to change
   * values after instantiation.
   * @param settings A non-null map of key values to load.
   * @return A non-null config.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, String> settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    return new UnitTestConfiguration(settings);
  }

  /**
   * Allows a unit test to inject a value for a registered key even if the
   * key is not dynamic.
   * @param key A non-null and non-empty key.
   * @param value A value of the registered type.
   * @throws IllegalArgumentException if the key was not registered.
   */
  public void override(final String key, final Object value) {
    final ConfigurationEntrySchema schema = schemas.get(key);
    if (schema == null) {
      throw new IllegalArgumentException("Register this config first!");
    }
    if (!schema.getType().isInstance(value)) {
      throw new IllegalArgumentException("Bad value: " + value);
    }
    overrides.put(key, value);
  }

  /** Reads from the map handed to the ctor. */
  static class UnitTestProvider implements Provider {
    private final Map<String, String> kvs;

    UnitTestProvider(final Map<String, String> kvs) {
      this.kvs = kvs;
    }

    @Override
    public String getSetting(final String key) {
      return kvs.get(key);
    }

    @Override
    public String source() {
      return UnitTestProvider.class.getSimpleName();
    }

    @Override
    public void close() throws IOException {
      // no-op
    }
  }
}
