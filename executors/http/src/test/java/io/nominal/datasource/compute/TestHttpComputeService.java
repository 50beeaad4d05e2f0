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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Future;

import org.apache.http.HttpResponse;
import org.apache.http.HttpVersion;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.message.BasicStatusLine;
import org.apache.http.util.EntityUtils;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Lists;

import io.nominal.datasource.configuration.UnitTestConfiguration;
import io.nominal.datasource.core.DataSourceSettings;
import io.nominal.datasource.exceptions.QueryExecutionCanceled;
import io.nominal.datasource.exceptions.RemoteQueryExecutionException;
import io.nominal.datasource.query.QueryModel;
import io.nominal.datasource.query.TimeRange;
import io.nominal.datasource.utils.JSON;
import io.nominal.datasource.utils.SharedHttpClient;

public class TestHttpComputeService {
  private static final String ENDPOINT =
      "https://nominal.example/api/compute/v2/compute/batch-with-units";

  private UnitTestConfiguration config;
  private SharedHttpClient client;
  private CloseableHttpAsyncClient http;
  private Future<HttpResponse> future;
  private DataSourceSettings settings;
  private List<ComputeNodeRequest> requests;

  @SuppressWarnings("unchecked")
  @Before
  public void before() throws Exception {
    config = UnitTestConfiguration.getConfiguration();
    client = mock(SharedHttpClient.class);
    http = mock(CloseableHttpAsyncClient.class);
    future = mock(Future.class);
    when(client.getClient()).thenReturn(http);
    when(http.execute(any(HttpUriRequest.class), any(FutureCallback.class)))
      .thenReturn(future);
    settings = DataSourceSettings.newBuilder()
        .setBaseUrl("https://nominal.example/api")
        .setApiKey("secret")
        .build();

    final ComputeRequestBuilder builder = new ComputeRequestBuilder();
    final TimeRange range = new TimeRange(Instant.ofEpochSecond(1700000000L),
        Instant.ofEpochSecond(1700003600L));
    requests = Lists.newArrayList(
        builder.build(QueryModel.newBuilder()
            .setAssetRid("ri.asset.1")
            .setChannel("speed")
            .build(), range),
        builder.build(QueryModel.newBuilder()
            .setAssetRid("ri.asset.2")
            .setChannel("rpm")
            .build(), range));
  }

  @Test
  public void ctor() throws Exception {
    new HttpComputeService(config, client);
    assertEquals(HttpComputeService.DEFAULT_PATH,
        config.getString(HttpComputeService.PATH_KEY));
    // idempotent registration
    new HttpComputeService(config, client);

    try {
      new HttpComputeService(null, client);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new HttpComputeService(config, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void request() throws Exception {
    final ComputeExecution execution = new HttpComputeService(config, client)
        .batchCompute(settings, requests);
    assertEquals(2, execution.requestCount());

    final ArgumentCaptor<HttpUriRequest> request =
        ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(http).execute(request.capture(), any(FutureCallback.class));
    final HttpPost post = (HttpPost) request.getValue();
    assertEquals(ENDPOINT, post.getURI().toString());
    assertEquals("Bearer secret",
        post.getFirstHeader("Authorization").getValue());
    assertEquals("application/json", post.getFirstHeader("Accept").getValue());
    assertTrue(post.getEntity().getContentType().getValue()
        .startsWith("application/json"));

    final JsonNode body = JSON.getMapper().readTree(
        EntityUtils.toString(post.getEntity()));
    assertEquals(2, body.get("requests").size());
    assertEquals("ri.asset.1", body.at(
        "/requests/0/context/variables/assetRid/string").asText());
    assertEquals("rpm", body.at("/requests/1/node/series/input/numeric/"
        + "timeShift/input/channel/asset/channel/literal").asText());
    assertEquals(1700000000L, body.at("/requests/0/start/seconds").asLong());
  }

  @Test
  public void customPath() throws Exception {
    config.register(HttpComputeService.PATH_KEY, "/compute/custom", false,
        "Custom");
    new HttpComputeService(config, client).batchCompute(settings, requests);
    final ArgumentCaptor<HttpUriRequest> request =
        ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(http).execute(request.capture(), any(FutureCallback.class));
    assertEquals("https://nominal.example/api/compute/custom",
        request.getValue().getURI().toString());
  }

  @Test
  public void completed() throws Exception {
    final ComputeExecution execution = new HttpComputeService(config, client)
        .batchCompute(settings, requests);
    callback().completed(response(200, "{\"results\":["
        + "{\"computeResult\":{\"type\":\"success\",\"success\":{\"type\":"
        + "\"numeric\",\"numeric\":{\"timestamps\":[{\"seconds\":1,\"nanos\":0}],"
        + "\"values\":[4.5]}}}},"
        + "{\"computeResult\":{\"type\":\"error\",\"error\":{\"errorType\":"
        + "\"NOT_FOUND\",\"code\":404}}}]}"));
    final List<ComputeResult> results = execution.deferred().join(1000);
    assertEquals(2, results.size());
    assertEquals(ComputeResult.Type.SUCCESS, results.get(0).type());
    assertEquals(ComputeResult.Type.ERROR, results.get(1).type());
    assertTrue(execution.completed());
  }

  @Test
  public void completedHttpError() throws Exception {
    final ComputeExecution execution = new HttpComputeService(config, client)
        .batchCompute(settings, requests);
    callback().completed(response(401, "{\"errorCode\":\"PERMISSION_DENIED\","
        + "\"errorName\":\"Default:Unauthorized\"}"));
    try {
      execution.deferred().join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(401, e.getStatusCode());
      assertEquals(ENDPOINT, e.remoteEndpoint());
    }
  }

  @Test
  public void completedBadBody() throws Exception {
    final ComputeExecution execution = new HttpComputeService(config, client)
        .batchCompute(settings, requests);
    callback().completed(response(200, "[\"not\",\"an\",\"object\"]"));
    try {
      execution.deferred().join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(500, e.getStatusCode());
      assertTrue(e.getMessage().startsWith(
          "Failed to decode the batch compute response: "));
    }
  }

  @Test
  public void failed() throws Exception {
    final ComputeExecution execution = new HttpComputeService(config, client)
        .batchCompute(settings, requests);
    callback().failed(new java.net.ConnectException("Connection refused"));
    try {
      execution.deferred().join(1000);
      fail("Expected ConnectException");
    } catch (java.net.ConnectException e) { }
  }

  @Test
  public void cancelled() throws Exception {
    final ComputeExecution execution = new HttpComputeService(config, client)
        .batchCompute(settings, requests);
    callback().cancelled();
    try {
      execution.deferred().join(1000);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) {
      assertEquals(499, e.getStatusCode());
    }
  }

  @Test
  public void cancel() throws Exception {
    final ComputeExecution execution = new HttpComputeService(config, client)
        .batchCompute(settings, requests);
    final FutureCallback<HttpResponse> callback = callback();
    execution.cancel();
    verify(future).cancel(true);
    assertTrue(execution.completed());

    // the client's own cancel callback is dropped
    callback.cancelled();
    try {
      execution.deferred().join(1000);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
  }

  @Test
  public void badArguments() throws Exception {
    final HttpComputeService service = new HttpComputeService(config, client);
    try {
      service.batchCompute(null, requests);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      service.batchCompute(settings,
          Collections.<ComputeNodeRequest>emptyList());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    verify(future, never()).cancel(anyBoolean());
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private FutureCallback<HttpResponse> callback() {
    final ArgumentCaptor<FutureCallback> callback =
        ArgumentCaptor.forClass(FutureCallback.class);
    verify(http).execute(any(HttpUriRequest.class), callback.capture());
    return callback.getValue();
  }

  private static HttpResponse response(final int status, final String body) {
    final BasicHttpResponse response = new BasicHttpResponse(
        new BasicStatusLine(HttpVersion.HTTP_1_1, status, "status"));
    response.setEntity(new StringEntity(body, StandardCharsets.UTF_8));
    return response;
  }
}
