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
package io.nominal.datasource.configuration.provider;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import io.nominal.datasource.configuration.ConfigurationException;

/**
 * Loads values once from a Java properties file.
 *
 * @since 1.0
 */
public class PropertiesFileProvider implements Provider {
  private static final Logger LOG = LoggerFactory.getLogger(
      PropertiesFileProvider.class);

  public static final String SOURCE = PropertiesFileProvider.class.getSimpleName();

  /** The file we loaded. */
  private final String path;

  /** The loaded properties. */
  private final Properties properties;

  /**
   * Default ctor.
   * @param path A non-null and non-empty path to a properties file.
   * @throws IllegalArgumentException if the path was null or empty.
   * @throws ConfigurationException if the file could not be read.
   */
  public PropertiesFileProvider(final String path) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    this.path = path;
    properties = new Properties();
    try (final InputStream stream = new FileInputStream(path)) {
      properties.load(stream);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to load properties file: "
          + path, e);
    }
    LOG.info("Loaded " + properties.size() + " properties from: " + path);
  }

  @Override
  public String getSetting(final String key) {
    return properties.getProperty(key);
  }

  @Override
  public String source() {
    return SOURCE + ":" + path;
  }

  @Override
  public void close() throws IOException {
    // no-op
  }

}
