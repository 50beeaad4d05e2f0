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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Variable bindings resolved by the compute service when it evaluates a
 * node. Insertion order is preserved.
 *
 * @since 1.0
 */
public final class ComputeContext {
  private final Map<String, VariableValue> variables;

  /**
   * Default ctor.
   * @param variables A non-null map of bindings, copied.
   */
  public ComputeContext(final Map<String, VariableValue> variables) {
    if (variables == null) {
      throw new IllegalArgumentException("Variables cannot be null.");
    }
    this.variables = Collections.unmodifiableMap(
        new LinkedHashMap<String, VariableValue>(variables));
  }

  @JsonProperty("variables")
  public Map<String, VariableValue> variables() {
    return variables;
  }
}
