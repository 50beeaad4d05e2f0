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

import io.nominal.datasource.exceptions.QueryExecutionException;

/**
 * Thrown when a decoded query is not well formed. Always a 400.
 *
 * @since 1.0
 */
public class QueryValidationException extends QueryExecutionException {
  private static final long serialVersionUID = 2604474928810931367L;

  /** The status code for all validation failures. */
  public static final int STATUS_CODE = 400;

  /** @param msg A non-null message describing the problem. */
  public QueryValidationException(final String msg) {
    super(msg, STATUS_CODE);
  }
}
