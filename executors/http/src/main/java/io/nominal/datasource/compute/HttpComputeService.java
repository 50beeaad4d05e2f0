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

import java.util.List;
import java.util.concurrent.Future;

import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import io.nominal.datasource.configuration.Configuration;
import io.nominal.datasource.core.DataSourceSettings;
import io.nominal.datasource.exceptions.QueryExecutionCanceled;
import io.nominal.datasource.exceptions.RemoteQueryExecutionException;
import io.nominal.datasource.utils.DateTime;
import io.nominal.datasource.utils.DefaultSharedHttpClient;
import io.nominal.datasource.utils.JSON;
import io.nominal.datasource.utils.SharedHttpClient;

/**
 * Sends batch compute calls to the API over HTTP. The body is
 * <code>{"requests": [...]}</code>, authenticated with the data source's
 * API key as a bearer token.
 *
 * @since 1.0
 */
public class HttpComputeService implements ComputeService {
  private static final Logger LOG =
      LoggerFactory.getLogger(HttpComputeService.class);

  public static final String PATH_KEY = "nominal.compute.path";
  public static final String DEFAULT_PATH =
      "/compute/v2/compute/batch-with-units";

  private final Configuration config;
  private final SharedHttpClient client;

  /**
   * Default ctor.
   * @param config A non-null config.
   * @param client A non-null shared client.
   */
  public HttpComputeService(final Configuration config,
                            final SharedHttpClient client) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.config = config;
    this.client = client;
    if (!config.hasProperty(PATH_KEY)) {
      config.register(PATH_KEY, DEFAULT_PATH, false,
          "The path, relative to the API base URL, of the batch compute "
          + "endpoint.");
    }
  }

  @Override
  public ComputeExecution batchCompute(final DataSourceSettings settings,
                                       final List<ComputeNodeRequest> requests) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    if (requests == null || requests.isEmpty()) {
      throw new IllegalArgumentException("Requests cannot be null or empty.");
    }
    final HttpComputeExecution execution = new HttpComputeExecution(
        settings.baseUrl() + config.getString(PATH_KEY), requests.size());
    execution.execute(settings, requests);
    return execution;
  }

  /** One batch call. */
  class HttpComputeExecution extends ComputeExecution {
    private final String endpoint;
    private volatile Future<HttpResponse> future;

    HttpComputeExecution(final String endpoint, final int request_count) {
      super(request_count);
      this.endpoint = endpoint;
    }

    void execute(final DataSourceSettings settings,
                 final List<ComputeNodeRequest> requests) {
      final long start = DateTime.nanoTime();
      final HttpPost post = new HttpPost(endpoint);
      post.addHeader("Accept", "application/json");
      post.addHeader("Accept-Encoding", "gzip, deflate");
      post.addHeader("Authorization", "Bearer "
          + Strings.nullToEmpty(settings.apiKey()));
      post.setEntity(new StringEntity(JSON.serializeToString(
          ImmutableMap.of("requests", requests)), ContentType.APPLICATION_JSON));

      class ResponseCallback implements FutureCallback<HttpResponse> {
        @Override
        public void completed(final HttpResponse response) {
          final List<ComputeResult> results;
          try {
            final String json = DefaultSharedHttpClient.parseResponse(
                response, 0, endpoint);
            results = ComputeResultDecoder.decodeBatch(json);
          } catch (RemoteQueryExecutionException e) {
            complete(e);
            return;
          } catch (Exception e) {
            complete(new RemoteQueryExecutionException(
                "Failed to decode the batch compute response: "
                    + e.getMessage(), endpoint, 500, e));
            return;
          }
          if (LOG.isDebugEnabled()) {
            LOG.debug("Received " + results.size() + " results for "
                + request_count + " requests from [" + endpoint + "] after "
                + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
          }
          complete(results);
        }

        @Override
        public void failed(final Exception ex) {
          complete(ex);
        }

        @Override
        public void cancelled() {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Http call was canceled: " + endpoint);
          }
          complete(new QueryExecutionCanceled("Call was canceled: "
              + endpoint, 499));
        }
      }

      if (LOG.isDebugEnabled()) {
        LOG.debug("Sending " + request_count + " compute requests to "
            + endpoint);
      }
      future = client.getClient().execute(post, new ResponseCallback());
    }

    @Override
    public void cancel() {
      final Future<HttpResponse> outstanding = future;
      if (outstanding != null) {
        outstanding.cancel(true);
      }
      complete(new QueryExecutionCanceled("Call was canceled: " + endpoint,
          499));
    }

    private void complete(final Object result) {
      try {
        callback(result);
      } catch (IllegalStateException e) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Dropping result for an already completed call: "
              + endpoint);
        }
      }
    }

    @Override
    public String toString() {
      return "HttpComputeExecution[" + endpoint + ", requests="
          + request_count + "]";
    }
  }
}
