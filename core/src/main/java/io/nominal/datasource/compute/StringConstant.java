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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A string in a compute graph, either a literal or a reference to a variable
 * bound in the request {@link ComputeContext}.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "type", "literal", "variable" })
public final class StringConstant {
  public static final String LITERAL = "literal";
  public static final String VARIABLE = "variable";

  private final String type;
  private final String value;

  private StringConstant(final String type, final String value) {
    this.type = type;
    this.value = value;
  }

  /**
   * @param literal A literal, may be empty but not null.
   * @return A literal constant.
   */
  public static StringConstant literal(final String literal) {
    if (literal == null) {
      throw new IllegalArgumentException("Literal cannot be null.");
    }
    return new StringConstant(LITERAL, literal);
  }

  /**
   * @param name The non-null and non-empty variable name.
   * @return A variable reference.
   */
  public static StringConstant variable(final String name) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Variable name cannot be null or empty.");
    }
    return new StringConstant(VARIABLE, name);
  }

  @JsonProperty("type")
  public String type() {
    return type;
  }

  @JsonProperty(LITERAL)
  public String literal() {
    return LITERAL.equals(type) ? value : null;
  }

  @JsonProperty(VARIABLE)
  public String variable() {
    return VARIABLE.equals(type) ? value : null;
  }

  @JsonIgnore
  public boolean isVariable() {
    return VARIABLE.equals(type);
  }

  @Override
  public String toString() {
    return type + ":" + value;
  }
}
