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
 * An exception that occurred when calling a remote service such as the
 * compute or authentication APIs. Covers transport failures and non-200
 * responses, not per-result errors reported inside a successful response.
 *
 * @since 1.0
 */
public class RemoteQueryExecutionException extends QueryExecutionException {
  private static final long serialVersionUID = 5176229873370811846L;

  /** A description of the remote service that threw the exception. */
  private final String remote_endpoint;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this exception.
   * @param status_code An optional status code reflecting the error state.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code) {
    this(msg, remote_endpoint, status_code, -1, null);
  }

  /**
   * Ctor that sets the cause.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this exception.
   * @param status_code An optional status code reflecting the error state.
   * @param t The original exception that caused this to be thrown.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code,
                                       final Throwable t) {
    this(msg, remote_endpoint, status_code, -1, t);
  }

  /**
   * Ctor setting a message, chunk order, status code and cause.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this exception.
   * @param status_code An optional status code reflecting the error state.
   * @param order An optional chunk index.
   * @param t The original exception that caused this to be thrown. May be null.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code,
                                       final int order,
                                       final Throwable t) {
    super(msg, status_code, order, t);
    this.remote_endpoint = remote_endpoint;
  }

  /** @return The remote endpoint that threw this exception. */
  public String remoteEndpoint() {
    return remote_endpoint;
  }
}
