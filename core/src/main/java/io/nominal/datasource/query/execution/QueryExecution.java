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
package io.nominal.datasource.query.execution;

import java.util.concurrent.atomic.AtomicBoolean;

import com.stumbleupon.async.Deferred;

/**
 * The state of an asynchronous unit of work: a remote call, a batch of
 * chunks or a whole data request. Callers wait on {@link #deferred()} and
 * may {@link #cancel()} at any time.
 * <p>
 * Implementations must complete the deferred exactly once via
 * {@link #callback(Object)}, passing an exception to signal failure.
 *
 * @param <T> The type of result returned by the execution.
 *
 * @since 1.0
 */
public abstract class QueryExecution<T> {
  /** The deferred that will be called with a result or exception. */
  protected final Deferred<T> deferred;

  /** Set when the deferred was called. */
  protected final AtomicBoolean completed;

  public QueryExecution() {
    deferred = new Deferred<T>();
    completed = new AtomicBoolean();
  }

  /** @return The deferred that will be called with a result or exception. */
  public Deferred<T> deferred() {
    return deferred;
  }

  /**
   * Passes the result or exception to the deferred.
   * @param result The result or an exception.
   * @throws IllegalStateException if the deferred was already called.
   */
  protected void callback(final Object result) {
    if (completed.compareAndSet(false, true)) {
      deferred.callback(result);
    } else {
      throw new IllegalStateException("Callback was already executed: "
          + this);
    }
  }

  /** @return Whether or not the deferred was called. */
  public boolean completed() {
    return completed.get();
  }

  /**
   * Cancels the execution if it is still running. The deferred is called with
   * a cancellation exception or whatever partial result the implementation
   * documents.
   */
  public abstract void cancel();
}
