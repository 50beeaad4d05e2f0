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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

import com.google.common.collect.Lists;

import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import io.nominal.datasource.compute.ComputeExecution;
import io.nominal.datasource.compute.ComputeNodeRequest;
import io.nominal.datasource.compute.ComputeResult;
import io.nominal.datasource.compute.ComputeService;
import io.nominal.datasource.compute.MockComputeExecution;
import io.nominal.datasource.compute.NumericPlot;
import io.nominal.datasource.compute.Timestamp;
import io.nominal.datasource.configuration.UnitTestConfiguration;
import io.nominal.datasource.core.DataSourceSettings;
import io.nominal.datasource.data.DataResponse;
import io.nominal.datasource.data.Status;
import io.nominal.datasource.exceptions.RemoteQueryExecutionException;

public class TestBatchQueryExecutor {
  private UnitTestConfiguration config;
  private ComputeService service;
  private Timer timer;
  private Timeout timeout;
  private DataSourceSettings settings;
  private List<MockComputeExecution> executions;

  @SuppressWarnings("unchecked")
  @Before
  public void before() throws Exception {
    config = UnitTestConfiguration.getConfiguration();
    BatchQueryExecutor.registerConfigs(config);
    config.override(BatchQueryExecutor.MAX_SUBREQUESTS_KEY, 2);
    service = mock(ComputeService.class);
    timer = mock(Timer.class);
    timeout = mock(Timeout.class);
    settings = DataSourceSettings.newBuilder()
        .setBaseUrl("https://nominal.example/api")
        .setApiKey("key")
        .build();
    executions = Lists.newArrayList();

    when(timer.newTimeout(any(TimerTask.class), anyLong(),
        any(TimeUnit.class))).thenReturn(timeout);
    when(service.batchCompute(any(DataSourceSettings.class), anyList()))
      .thenAnswer(new Answer<ComputeExecution>() {
        @Override
        public ComputeExecution answer(final InvocationOnMock invocation)
            throws Throwable {
          final MockComputeExecution execution = new MockComputeExecution(
              (List<ComputeNodeRequest>) invocation.getArguments()[1]);
          executions.add(execution);
          return execution;
        }
      });
  }

  @Test
  public void ctor() throws Exception {
    try {
      new BatchQueryExecutor(null, service, new PositionalResultReconciler(),
          timer);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new BatchQueryExecutor(config, null, new PositionalResultReconciler(),
          timer);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new BatchQueryExecutor(config, service, null, timer);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new BatchQueryExecutor(config, service,
          new PositionalResultReconciler(), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    // keys are registered once
    final UnitTestConfiguration fresh = UnitTestConfiguration.getConfiguration();
    executor(fresh);
    executor(fresh);
    assertEquals(BatchQueryExecutor.DEFAULT_MAX_SUBREQUESTS,
        fresh.getInt(BatchQueryExecutor.MAX_SUBREQUESTS_KEY));
    assertEquals(1, fresh.getInt(BatchQueryExecutor.PARALLEL_CHUNKS_KEY));
    assertEquals(30000L, fresh.getLong(BatchQueryExecutor.TIMEOUT_KEY));
  }

  @Test
  public void empty() throws Exception {
    final QueryExecution<Map<String, DataResponse>> execution =
        executor(config).execute(settings, Lists.<PendingQuery>newArrayList());
    assertTrue(execution.completed());
    assertTrue(execution.deferred().join(1000).isEmpty());
    verify(service, never()).batchCompute(any(DataSourceSettings.class),
        anyList());
    verify(timer, never()).newTimeout(any(TimerTask.class), anyLong(),
        any(TimeUnit.class));
  }

  @Test
  public void sequentialChunks() throws Exception {
    final List<PendingQuery> pending = TestChunk.pending(5);
    final QueryExecution<Map<String, DataResponse>> execution =
        executor(config).execute(settings, pending);
    verify(timer, times(1)).newTimeout(any(TimerTask.class), eq(30000L),
        eq(TimeUnit.MILLISECONDS));

    assertEquals(1, executions.size());
    assertEquals(2, executions.get(0).requestCount());
    assertEquals(pending.get(0).request(),
        executions.get(0).requests().get(0));

    executions.get(0).complete(results(2));
    assertEquals(2, executions.size());
    assertFalse(execution.completed());
    assertEquals(pending.get(2).request(),
        executions.get(1).requests().get(0));

    executions.get(1).complete(results(2));
    assertEquals(3, executions.size());
    assertEquals(1, executions.get(2).requestCount());
    assertFalse(execution.completed());

    executions.get(2).complete(results(1));
    assertTrue(execution.completed());
    final Map<String, DataResponse> responses = execution.deferred().join(1000);
    assertEquals(5, responses.size());
    for (int i = 0; i < 5; i++) {
      assertFalse(responses.get("q" + i).isError());
      assertEquals("channel" + i, responses.get("q" + i).frames().get(0).name());
    }
    verify(timeout, times(1)).cancel();
    verify(service, times(3)).batchCompute(any(DataSourceSettings.class),
        anyList());
  }

  @Test
  public void parallelChunks() throws Exception {
    config.override(BatchQueryExecutor.PARALLEL_CHUNKS_KEY, 2);
    final QueryExecution<Map<String, DataResponse>> execution =
        executor(config).execute(settings, TestChunk.pending(5));
    assertEquals(2, executions.size());

    // out of order completion
    executions.get(1).complete(results(2));
    assertEquals(3, executions.size());
    executions.get(2).complete(results(1));
    assertEquals(3, executions.size());
    assertFalse(execution.completed());
    executions.get(0).complete(results(2));
    assertEquals(5, execution.deferred().join(1000).size());
  }

  @Test
  public void chunkFailureIsolated() throws Exception {
    final QueryExecution<Map<String, DataResponse>> execution =
        executor(config).execute(settings, TestChunk.pending(5));
    executions.get(0).complete(results(2));
    executions.get(1).complete(new RemoteQueryExecutionException(
        "Service unavailable", "https://nominal.example/api", 503));
    // a failure still advances to the next chunk
    assertEquals(3, executions.size());
    executions.get(2).complete(results(1));

    final Map<String, DataResponse> responses = execution.deferred().join(1000);
    assertEquals(5, responses.size());
    assertFalse(responses.get("q0").isError());
    assertFalse(responses.get("q1").isError());
    assertEquals(Status.INTERNAL, responses.get("q2").status());
    assertEquals("Batch compute failed: Service unavailable",
        responses.get("q2").error());
    assertEquals(Status.INTERNAL, responses.get("q3").status());
    assertFalse(responses.get("q4").isError());
  }

  @Test
  public void serviceThrows() throws Exception {
    doThrow(new IllegalArgumentException("Boo!"))
      .when(service).batchCompute(any(DataSourceSettings.class), anyList());
    final QueryExecution<Map<String, DataResponse>> execution =
        executor(config).execute(settings, TestChunk.pending(3));
    assertTrue(execution.completed());
    final Map<String, DataResponse> responses = execution.deferred().join(1000);
    assertEquals(3, responses.size());
    for (final DataResponse response : responses.values()) {
      assertEquals(Status.INTERNAL, response.status());
      assertEquals("Batch compute failed: Boo!", response.error());
    }
    verify(service, times(2)).batchCompute(any(DataSourceSettings.class),
        anyList());
  }

  @Test
  public void reconcilerThrows() throws Exception {
    final ResultReconciler reconciler = mock(ResultReconciler.class);
    when(reconciler.reconcile(any(Chunk.class), anyList()))
      .thenThrow(new IllegalStateException("Boo!"));
    final QueryExecution<Map<String, DataResponse>> execution =
        new BatchQueryExecutor(config, service, reconciler, timer)
          .execute(settings, TestChunk.pending(2));
    executions.get(0).complete(results(2));
    final Map<String, DataResponse> responses = execution.deferred().join(1000);
    assertEquals("Batch compute failed: Boo!", responses.get("q0").error());
    assertEquals("Batch compute failed: Boo!", responses.get("q1").error());
  }

  @Test
  public void timeoutKeepsCompletedChunks() throws Exception {
    final ArgumentCaptor<TimerTask> task =
        ArgumentCaptor.forClass(TimerTask.class);
    final QueryExecution<Map<String, DataResponse>> execution =
        executor(config).execute(settings, TestChunk.pending(5));
    verify(timer).newTimeout(task.capture(), anyLong(), any(TimeUnit.class));

    executions.get(0).complete(results(2));
    assertEquals(2, executions.size());

    task.getValue().run(timeout);
    assertTrue(execution.completed());
    assertTrue(executions.get(1).cancelled());
    // nothing further was launched
    assertEquals(2, executions.size());

    final Map<String, DataResponse> responses = execution.deferred().join(1000);
    assertEquals(5, responses.size());
    assertFalse(responses.get("q0").isError());
    assertFalse(responses.get("q1").isError());
    for (int i = 2; i < 5; i++) {
      assertEquals(Status.TIMEOUT, responses.get("q" + i).status());
      assertEquals("Batch query timed out after 30000ms",
          responses.get("q" + i).error());
    }

    // late results are dropped
    executions.get(1).complete(results(2));
    assertEquals(2, executions.size());
    assertEquals(Status.TIMEOUT,
        execution.deferred().join(1000).get("q2").status());
  }

  @Test
  public void timeoutAfterCompletion() throws Exception {
    final ArgumentCaptor<TimerTask> task =
        ArgumentCaptor.forClass(TimerTask.class);
    final QueryExecution<Map<String, DataResponse>> execution =
        executor(config).execute(settings, TestChunk.pending(1));
    verify(timer).newTimeout(task.capture(), anyLong(), any(TimeUnit.class));
    executions.get(0).complete(results(1));
    assertTrue(execution.completed());

    task.getValue().run(timeout);
    assertFalse(execution.deferred().join(1000).get("q0").isError());
  }

  @Test
  public void timeoutDisabled() throws Exception {
    config.override(BatchQueryExecutor.TIMEOUT_KEY, 0L);
    final QueryExecution<Map<String, DataResponse>> execution =
        executor(config).execute(settings, TestChunk.pending(1));
    verify(timer, never()).newTimeout(any(TimerTask.class), anyLong(),
        any(TimeUnit.class));
    executions.get(0).complete(results(1));
    assertEquals(1, execution.deferred().join(1000).size());
  }

  @Test
  public void cancel() throws Exception {
    final QueryExecution<Map<String, DataResponse>> execution =
        executor(config).execute(settings, TestChunk.pending(3));
    execution.cancel();
    assertTrue(execution.completed());
    assertTrue(executions.get(0).cancelled());
    assertEquals(1, executions.size());

    final Map<String, DataResponse> responses = execution.deferred().join(1000);
    assertEquals(3, responses.size());
    for (final DataResponse response : responses.values()) {
      assertEquals(Status.CANCELLED, response.status());
      assertEquals("Batch query was cancelled", response.error());
    }
    verify(timeout, times(1)).cancel();

    // no-op once complete
    execution.cancel();
  }

  @Test
  public void badMaxSubrequests() throws Exception {
    config.override(BatchQueryExecutor.MAX_SUBREQUESTS_KEY, 0);
    try {
      executor(config).execute(settings, TestChunk.pending(1));
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }

  private BatchQueryExecutor executor(final UnitTestConfiguration config) {
    return new BatchQueryExecutor(config, service,
        new PositionalResultReconciler(), timer);
  }

  private static List<ComputeResult> results(final int count) {
    final List<ComputeResult> results = Lists.newArrayList();
    for (int i = 0; i < count; i++) {
      results.add(ComputeResult.success(new NumericPlot(
          Lists.newArrayList(new Timestamp(10, 0)),
          Lists.newArrayList((double) i))));
    }
    return results;
  }
}
