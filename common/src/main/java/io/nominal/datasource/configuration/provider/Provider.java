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

import java.io.Closeable;

import io.nominal.datasource.configuration.Configuration;

/**
 * A source of raw configuration values for the {@link Configuration}.
 * Providers are consulted in order of precedence when a registered key is
 * read.
 *
 * @since 1.0
 */
public interface Provider extends Closeable {

  /**
   * Loads the raw value for the given key.
   * @param key A non-null and non-empty key.
   * @return The raw string value if the provider had data for the key, null
   * if not.
   */
  public String getSetting(final String key);

  /**
   * The name of this provider.
   * @return A non-null string.
   */
  public String source();

}
