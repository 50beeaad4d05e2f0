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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Callback;

import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import io.nominal.datasource.compute.ComputeExecution;
import io.nominal.datasource.compute.ComputeResult;
import io.nominal.datasource.compute.ComputeService;
import io.nominal.datasource.configuration.Configuration;
import io.nominal.datasource.core.DataSourceSettings;
import io.nominal.datasource.data.DataResponse;
import io.nominal.datasource.data.Status;
import io.nominal.datasource.exceptions.QueryExecutionCanceled;

/**
 * Splits the pending asset/channel queries of a request into chunks of at
 * most {@link #MAX_SUBREQUESTS_KEY} entries and sends each chunk to the
 * {@link ComputeService} as one batch call. At most
 * {@link #PARALLEL_CHUNKS_KEY} calls are outstanding at a time; the default
 * of 1 sends chunk k+1 only after chunk k has completed.
 * <p>
 * A failed call fails every query of its chunk and nothing else. On timeout
 * or cancellation, queries of chunks that haven't completed get a
 * cancellation response while already reconciled responses are kept. Late
 * results for a chunk that was already resolved are dropped.
 *
 * @since 1.0
 */
public class BatchQueryExecutor {
  private static final Logger LOG =
      LoggerFactory.getLogger(BatchQueryExecutor.class);

  public static final String MAX_SUBREQUESTS_KEY =
      "nominal.compute.max_subrequests";
  public static final String PARALLEL_CHUNKS_KEY =
      "nominal.compute.parallel_chunks";
  public static final String TIMEOUT_KEY = "nominal.query.timeout";

  /** The compute service's limit on subrequests per batch call. */
  public static final int DEFAULT_MAX_SUBREQUESTS = 300;

  private final Configuration config;
  private final ComputeService compute_service;
  private final ResultReconciler reconciler;
  private final Timer timer;

  /**
   * Default ctor.
   * @param config A non-null config. Keys are registered if missing.
   * @param compute_service A non-null compute service.
   * @param reconciler A non-null reconciler.
   * @param timer A non-null timer for batch timeouts.
   */
  public BatchQueryExecutor(final Configuration config,
                            final ComputeService compute_service,
                            final ResultReconciler reconciler,
                            final Timer timer) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (compute_service == null) {
      throw new IllegalArgumentException("Compute service cannot be null.");
    }
    if (reconciler == null) {
      throw new IllegalArgumentException("Reconciler cannot be null.");
    }
    if (timer == null) {
      throw new IllegalArgumentException("Timer cannot be null.");
    }
    this.config = config;
    this.compute_service = compute_service;
    this.reconciler = reconciler;
    this.timer = timer;
    registerConfigs(config);
  }

  /**
   * Dispatches the pending queries.
   * @param settings The non-null settings.
   * @param pending A non-null list of queries, may be empty.
   * @return An execution whose deferred resolves to a response for every
   * pending query keyed by ref ID. It never resolves to an exception.
   */
  public QueryExecution<Map<String, DataResponse>> execute(
      final DataSourceSettings settings,
      final List<PendingQuery> pending) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    if (pending == null) {
      throw new IllegalArgumentException("Pending queries cannot be null.");
    }
    final int max_subrequests = config.getInt(MAX_SUBREQUESTS_KEY);
    if (max_subrequests < 1) {
      throw new IllegalStateException(MAX_SUBREQUESTS_KEY
          + " must be at least 1: " + max_subrequests);
    }
    final BatchExecution execution = new BatchExecution(settings,
        Chunk.partition(pending, max_subrequests),
        Math.max(1, config.getInt(PARALLEL_CHUNKS_KEY)),
        config.getLong(TIMEOUT_KEY));
    execution.execute();
    return execution;
  }

  /** The state of one dispatch. */
  @VisibleForTesting
  class BatchExecution extends QueryExecution<Map<String, DataResponse>>
      implements TimerTask {
    private final DataSourceSettings settings;
    private final List<Chunk> chunks;
    private final int parallels;
    private final long timeout_ms;

    /** Calls per chunk so we can cancel them. */
    private final ComputeExecution[] executions;

    /** Set once a chunk has been resolved one way or another. */
    private final AtomicBoolean[] resolved;

    /** The number of resolved chunks. */
    private final AtomicInteger resolved_count;

    private final Map<String, DataResponse> responses;

    /** The index of the next chunk to send. */
    private int chunk_index;

    private Timeout timer_timeout;

    BatchExecution(final DataSourceSettings settings,
                   final List<Chunk> chunks,
                   final int parallels,
                   final long timeout_ms) {
      this.settings = settings;
      this.chunks = chunks;
      this.parallels = parallels;
      this.timeout_ms = timeout_ms;
      executions = new ComputeExecution[chunks.size()];
      resolved = new AtomicBoolean[chunks.size()];
      for (int i = 0; i < resolved.length; i++) {
        resolved[i] = new AtomicBoolean();
      }
      resolved_count = new AtomicInteger();
      responses = Maps.newConcurrentMap();
    }

    void execute() {
      if (chunks.isEmpty()) {
        callback(Collections.<String, DataResponse>emptyMap());
        return;
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Dispatching " + chunks.size() + " chunks with up to "
            + parallels + " in parallel.");
      }
      if (timeout_ms > 0) {
        timer_timeout = timer.newTimeout(this, timeout_ms,
            TimeUnit.MILLISECONDS);
      }
      // locked so that a chunk returning before we've fired the initial set
      // doesn't advance the index on us.
      synchronized (this) {
        for (int i = 0; i < chunks.size() && i < parallels; i++) {
          if (completed.get() || chunk_index >= chunks.size()) {
            return;
          }
          launchNext();
        }
      }
    }

    /**
     * <b>WARNING:</b> Make sure to synchronize on *this* before executing to
     * avoid a race.
     */
    private void launchNext() {
      final int idx = chunk_index++;
      final Chunk chunk = chunks.get(idx);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Sending " + chunk + " to the compute service.");
      }
      final ComputeExecution execution;
      try {
        execution = compute_service.batchCompute(settings, chunk.requests());
      } catch (Exception e) {
        chunkFailed(idx, e);
        return;
      }
      executions[idx] = execution;
      execution.deferred()
          .addCallback(new DataCB(idx))
          .addErrback(new ErrCB(idx));
    }

    /** Fails every query of the chunk with the exception. */
    private void chunkFailed(final int idx, final Exception e) {
      if (!resolved[idx].compareAndSet(false, true)) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Dropping late failure for chunk " + idx, e);
        }
        return;
      }
      LOG.error("Batch compute call failed for chunk " + idx, e);
      for (final PendingQuery query : chunks.get(idx).queries()) {
        responses.put(query.refId(), DataResponse.error(Status.INTERNAL,
            "Batch compute failed: " + e.getMessage(), e));
      }
      chunkResolved();
    }

    /** Launches the next chunk or completes when all have resolved. */
    private void chunkResolved() {
      if (resolved_count.incrementAndGet() == chunks.size()) {
        complete();
        return;
      }
      synchronized (this) {
        if (!completed.get() && chunk_index < chunks.size()) {
          launchNext();
        }
      }
    }

    private void complete() {
      synchronized (this) {
        if (timer_timeout != null) {
          timer_timeout.cancel();
          timer_timeout = null;
        }
      }
      try {
        callback(ImmutableMap.copyOf(responses));
      } catch (IllegalStateException e) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Lost race condition completing the batch: " + this);
        }
      }
    }

    @Override
    public void run(final Timeout timeout) throws Exception {
      if (completed.get()) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Timeout fired after the batch completed: " + this);
        }
        return;
      }
      LOG.warn("Batch timed out after " + timeout_ms + "ms with "
          + (chunks.size() - resolved_count.get()) + " chunks outstanding.");
      synchronized (this) {
        timer_timeout = null;
      }
      abort(new QueryExecutionCanceled("Batch query timed out after "
          + timeout_ms + "ms", Status.TIMEOUT.code()));
    }

    @Override
    public void cancel() {
      if (completed.get()) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Canceling but the batch already completed.");
        }
        return;
      }
      abort(new QueryExecutionCanceled("Batch query was cancelled",
          Status.CANCELLED.code()));
    }

    /** Resolves every outstanding chunk with the exception. */
    private void abort(final QueryExecutionCanceled e) {
      synchronized (this) {
        // prevent further launches
        chunk_index = chunks.size();
      }
      for (int i = 0; i < chunks.size(); i++) {
        if (!resolved[i].compareAndSet(false, true)) {
          continue;
        }
        for (final PendingQuery query : chunks.get(i).queries()) {
          responses.put(query.refId(), DataResponse.fromException(null, e));
        }
        final ComputeExecution execution = executions[i];
        if (execution != null) {
          execution.cancel();
        }
        // a chunk still reconciling completes the batch when it's done.
        if (resolved_count.incrementAndGet() == chunks.size()) {
          complete();
        }
      }
    }

    /** Reconciles a successful call. */
    class DataCB implements Callback<Object, List<ComputeResult>> {
      final int index;

      DataCB(final int index) {
        this.index = index;
      }

      @Override
      public Object call(final List<ComputeResult> results) throws Exception {
        if (!resolved[index].compareAndSet(false, true)) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Dropping late results for chunk " + index);
          }
          return null;
        }
        if (LOG.isDebugEnabled()) {
          LOG.debug("Received " + (results == null ? 0 : results.size())
              + " results for chunk " + index);
        }
        final Chunk chunk = chunks.get(index);
        try {
          responses.putAll(reconciler.reconcile(chunk, results));
        } catch (Exception e) {
          LOG.error("Failed to reconcile chunk " + index, e);
          for (final PendingQuery query : chunk.queries()) {
            responses.put(query.refId(), DataResponse.error(Status.INTERNAL,
                "Batch compute failed: " + e.getMessage(), e));
          }
        }
        chunkResolved();
        return null;
      }
    }

    /** Fails the chunk on a call failure. */
    class ErrCB implements Callback<Object, Exception> {
      final int index;

      ErrCB(final int index) {
        this.index = index;
      }

      @Override
      public Object call(final Exception e) throws Exception {
        chunkFailed(index, e);
        return null;
      }
    }

    @Override
    public String toString() {
      return "BatchExecution[chunks=" + chunks.size() + ", resolved="
          + resolved_count.get() + "]";
    }
  }

  /**
   * Registers the dispatch keys if they are missing.
   * @param config A non-null config.
   */
  public static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(MAX_SUBREQUESTS_KEY)) {
      config.register(MAX_SUBREQUESTS_KEY, DEFAULT_MAX_SUBREQUESTS, true,
          "The maximum number of compute subrequests sent in one batch call.");
    }
    if (!config.hasProperty(PARALLEL_CHUNKS_KEY)) {
      config.register(PARALLEL_CHUNKS_KEY, 1, true,
          "The maximum number of batch calls outstanding at once for a "
          + "single query request.");
    }
    if (!config.hasProperty(TIMEOUT_KEY)) {
      config.register(TIMEOUT_KEY, 30000L, true,
          "How long, in milliseconds, to wait for all batch calls of a "
          + "query request before the remainder is cancelled. 0 disables "
          + "the timeout.");
    }
  }
}
