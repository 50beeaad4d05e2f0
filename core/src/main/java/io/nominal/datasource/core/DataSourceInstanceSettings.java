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

import java.util.Collections;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * The raw settings of a configured data source instance as handed over by
 * the dashboard host: the plain JSON blob and the decrypted secrets.
 *
 * @since 1.0
 */
public final class DataSourceInstanceSettings {
  private final String uid;
  private final String json_data;
  private final Map<String, String> decrypted_secure_json_data;

  /**
   * Default ctor.
   * @param uid The instance UID, may be null.
   * @param json_data The JSON settings, may be null.
   * @param decrypted_secure_json_data The secrets, may be null.
   */
  public DataSourceInstanceSettings(
      final String uid,
      final String json_data,
      final Map<String, String> decrypted_secure_json_data) {
    this.uid = uid;
    this.json_data = json_data;
    this.decrypted_secure_json_data = decrypted_secure_json_data == null ?
        Collections.<String, String>emptyMap() :
          ImmutableMap.copyOf(decrypted_secure_json_data);
  }

  public String uid() {
    return uid;
  }

  public String jsonData() {
    return json_data;
  }

  public Map<String, String> decryptedSecureJsonData() {
    return decrypted_secure_json_data;
  }

  @Override
  public String toString() {
    return "DataSourceInstanceSettings[uid=" + uid + ", secrets="
        + decrypted_secure_json_data.keySet() + "]";
  }
}
