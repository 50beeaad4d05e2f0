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
package io.nominal.datasource.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

/**
 * The profile of the user owning an API key.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UserProfile {
  private final String rid;
  private final String display_name;

  @JsonCreator
  public UserProfile(@JsonProperty("rid") final String rid,
                     @JsonProperty("displayName") final String display_name) {
    this.rid = rid;
    this.display_name = display_name;
  }

  public String rid() {
    return rid;
  }

  public String displayName() {
    return display_name;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("rid", rid)
        .add("displayName", display_name)
        .toString();
  }
}
