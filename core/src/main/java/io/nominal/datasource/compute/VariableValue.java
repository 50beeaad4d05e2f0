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
package io.nominal.datasource.compute;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A value bound to a variable name in a {@link ComputeContext}. Only strings
 * are bound.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "type", "string" })
public final class VariableValue {
  private final String string;

  private VariableValue(final String string) {
    this.string = string;
  }

  public static VariableValue string(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    return new VariableValue(value);
  }

  @JsonProperty("type")
  public String type() {
    return "string";
  }

  @JsonProperty("string")
  public String string() {
    return string;
  }

  @Override
  public String toString() {
    return string;
  }
}
