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
package io.nominal.datasource.auth;

import java.util.concurrent.Future;

import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.concurrent.FutureCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import io.nominal.datasource.configuration.Configuration;
import io.nominal.datasource.core.DataSourceSettings;
import io.nominal.datasource.exceptions.QueryExecutionCanceled;
import io.nominal.datasource.exceptions.RemoteQueryExecutionException;
import io.nominal.datasource.query.execution.QueryExecution;
import io.nominal.datasource.utils.DefaultSharedHttpClient;
import io.nominal.datasource.utils.JSON;
import io.nominal.datasource.utils.SharedHttpClient;

/**
 * Fetches the caller's profile over HTTP to verify an API key.
 *
 * @since 1.0
 */
public class HttpAuthenticationService implements AuthenticationService {
  private static final Logger LOG =
      LoggerFactory.getLogger(HttpAuthenticationService.class);

  public static final String PATH_KEY = "nominal.auth.profile.path";
  public static final String DEFAULT_PATH = "/authentication/v2/my/profile";

  private final Configuration config;
  private final SharedHttpClient client;

  /**
   * Default ctor.
   * @param config A non-null config.
   * @param client A non-null shared client.
   */
  public HttpAuthenticationService(final Configuration config,
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
          "The path, relative to the API base URL, of the profile endpoint.");
    }
  }

  @Override
  public QueryExecution<UserProfile> getMyProfile(
      final DataSourceSettings settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    final ProfileExecution execution = new ProfileExecution(
        settings.baseUrl() + config.getString(PATH_KEY));
    execution.execute(settings);
    return execution;
  }

  /** One profile call. */
  class ProfileExecution extends QueryExecution<UserProfile> {
    private final String endpoint;
    private volatile Future<HttpResponse> future;

    ProfileExecution(final String endpoint) {
      this.endpoint = endpoint;
    }

    void execute(final DataSourceSettings settings) {
      final HttpGet get = new HttpGet(endpoint);
      get.addHeader("Accept", "application/json");
      get.addHeader("Authorization", "Bearer "
          + Strings.nullToEmpty(settings.apiKey()));

      class ResponseCallback implements FutureCallback<HttpResponse> {
        @Override
        public void completed(final HttpResponse response) {
          try {
            final String json = DefaultSharedHttpClient.parseResponse(
                response, 0, endpoint);
            complete(JSON.parseToObject(json, UserProfile.class));
          } catch (RemoteQueryExecutionException e) {
            complete(e);
          } catch (Exception e) {
            complete(new RemoteQueryExecutionException(
                "Failed to decode the profile response: " + e.getMessage(),
                endpoint, 500, e));
          }
        }

        @Override
        public void failed(final Exception ex) {
          complete(ex);
        }

        @Override
        public void cancelled() {
          complete(new QueryExecutionCanceled("Call was canceled: "
              + endpoint, 499));
        }
      }

      future = client.getClient().execute(get, new ResponseCallback());
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
  }
}
