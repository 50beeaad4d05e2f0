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

import java.io.IOException;

/**
 * Loads values from the process environment. The key is looked up verbatim
 * first, then in the shell friendly form with dots replaced by underscores
 * and upper cased, e.g. {@code nominal.query.timeout} is also read from
 * {@code NOMINAL_QUERY_TIMEOUT}.
 *
 * @since 1.0
 */
public class EnvironmentProvider implements Provider {
  public static final String SOURCE = EnvironmentProvider.class.getSimpleName();

  @Override
  public String getSetting(final String key) {
    final String value = System.getenv(key);
    if (value != null) {
      return value;
    }
    return System.getenv(toEnvironmentKey(key));
  }

  @Override
  public String source() {
    return SOURCE;
  }

  @Override
  public void close() throws IOException {
    // no-op
  }

  /**
   * @param key A non-null key.
   * @return The upper cased key with dots and dashes as underscores.
   */
  static String toEnvironmentKey(final String key) {
    return key.replace('.', '_').replace('-', '_').toUpperCase();
  }
}
