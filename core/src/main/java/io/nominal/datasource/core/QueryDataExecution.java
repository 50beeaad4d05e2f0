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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import io.nominal.datasource.data.DataResponse;
import io.nominal.datasource.data.QueryDataResponse;
import io.nominal.datasource.data.Status;
import io.nominal.datasource.query.DataQuery;
import io.nominal.datasource.query.execution.QueryExecution;

/**
 * The execution of a whole {@link QueryDataRequest}. Immediate responses are
 * recorded as the request is routed; asynchronous work (connection tests and
 * the batch dispatch) is tracked so it can be canceled. The deferred resolves
 * once every tracked piece of work has landed, with exactly one response per
 * query.
 *
 * @since 1.0
 */
public class QueryDataExecution extends QueryExecution<QueryDataResponse> {
  private static final Logger LOG =
      LoggerFactory.getLogger(QueryDataExecution.class);

  private final QueryDataRequest request;
  private final QueryDataResponse response;
  private final List<QueryExecution<?>> executions;
  private final List<Deferred<Object>> deferreds;

  /** @param request The non-null request. */
  QueryDataExecution(final QueryDataRequest request) {
    this.request = request;
    response = new QueryDataResponse();
    executions = Lists.newArrayList();
    deferreds = Lists.newArrayList();
  }

  /** @return The request being executed. */
  public QueryDataRequest request() {
    return request;
  }

  /**
   * Records a response.
   * @param ref_id The ref ID.
   * @param data_response The response.
   */
  void respond(final String ref_id, final DataResponse data_response) {
    response.put(ref_id, data_response);
  }

  /**
   * Tracks outstanding work.
   * @param execution The execution to cancel on {@link #cancel()}.
   * @param deferred A deferred that records its responses and never fails.
   */
  synchronized void track(final QueryExecution<?> execution,
                          final Deferred<Object> deferred) {
    executions.add(execution);
    deferreds.add(deferred);
  }

  /** Completes when all tracked work has landed. */
  void start() {
    final List<Deferred<Object>> outstanding;
    synchronized (this) {
      outstanding = Lists.newArrayList(deferreds);
    }
    if (outstanding.isEmpty()) {
      finish();
      return;
    }
    Deferred.group(outstanding)
        .addCallback(new GroupCB())
        .addErrback(new ErrorCB());
  }

  @Override
  public void cancel() {
    if (completed.get()) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Canceling but already completed: " + this);
      }
      return;
    }
    final List<QueryExecution<?>> outstanding;
    synchronized (this) {
      outstanding = Lists.newArrayList(executions);
    }
    for (final QueryExecution<?> execution : outstanding) {
      try {
        execution.cancel();
      } catch (Exception e) {
        LOG.warn("Failed to cancel execution: " + execution, e);
      }
    }
  }

  private void finish() {
    for (final DataQuery query : request.queries()) {
      if (response.get(query.refId()) == null) {
        LOG.warn("No response recorded for query " + query.refId());
        response.put(query.refId(), DataResponse.error(Status.INTERNAL,
            "No response was produced for the query"));
      }
    }
    try {
      callback(response);
    } catch (IllegalStateException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Lost race condition completing the request: " + this);
      }
    }
  }

  /** Fires once every tracked deferred has been called. */
  class GroupCB implements Callback<Object, ArrayList<Object>> {
    @Override
    public Object call(final ArrayList<Object> ignored) throws Exception {
      finish();
      return null;
    }
  }

  /** Tracked deferreds record their own failures so this is a safety net. */
  class ErrorCB implements Callback<Object, Exception> {
    @Override
    public Object call(final Exception e) throws Exception {
      LOG.error("Unexpected exception from a tracked execution", e);
      finish();
      return null;
    }
  }

  @Override
  public String toString() {
    return "QueryDataExecution[queries=" + request.queries().size()
        + ", outstanding=" + deferreds.size() + "]";
  }
}
