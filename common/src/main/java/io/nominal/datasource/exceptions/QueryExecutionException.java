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
package io.nominal.datasource.exceptions;

/**
 * High level exception that should be thrown by any portion of the query
 * engine to bubble up to the dashboard as an error response for one or more
 * queries.
 *
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = -3017356127741904562L;

  /** The index of the chunk within a batch the exception pertains to. E.g. if
   * a batch was split into 4 chunks, this will be an integer from 0 to 3. -1
   * if the exception isn't tied to a chunk. */
  protected final int order;

  /** A status code associated with the exception. For remote errors this is
   * usually the HTTP status. */
  protected final int status_code;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, -1);
  }

  /**
   * Ctor that sets a chunk order for the exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order An optional chunk index.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final int order) {
    this(msg, status_code, order, null);
  }

  /**
   * Ctor that sets a descriptive message, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param t The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final Throwable t) {
    this(msg, status_code, -1, t);
  }

  /**
   * Ctor setting a message, chunk order, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order An optional chunk index.
   * @param t The original exception that caused this to be thrown. May be
   * null.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final int order,
                                 final Throwable t) {
    super(msg, t);
    this.status_code = status_code;
    this.order = order;
  }

  /** @return The chunk index if pertaining to a chunk, -1 if not. */
  public int getOrder() {
    return order;
  }

  /** @return An optional status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass())
        .append(": ")
        .append(getMessage());
    if (status_code > 0) {
      buf.append(" (status: ")
         .append(status_code)
         .append(")");
    }
    if (order >= 0) {
      buf.append(" order[")
         .append(order)
         .append("]");
    }
    return buf.toString();
  }
}
