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
package io.nominal.datasource.query;

/**
 * Thrown when a field that addresses remote data still carries a template
 * variable marker after interpolation, i.e. the dashboard had no value for
 * the variable.
 *
 * @since 1.0
 */
public class UnresolvedTemplateVariableException
    extends QueryValidationException {
  private static final long serialVersionUID = -1137810470391568813L;

  private final String field;

  /**
   * Default ctor.
   * @param field The name of the offending field.
   * @param value The unresolved value.
   */
  public UnresolvedTemplateVariableException(final String field,
                                             final String value) {
    super(field + " contains an unresolved template variable: " + value);
    this.field = field;
  }

  /** @return The name of the offending field. */
  public String field() {
    return field;
  }
}
