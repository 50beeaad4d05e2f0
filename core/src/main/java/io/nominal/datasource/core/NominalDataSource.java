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

import java.io.Closeable;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import io.nominal.datasource.auth.AuthenticationService;
import io.nominal.datasource.auth.UserProfile;
import io.nominal.datasource.compute.ComputeRequestBuilder;
import io.nominal.datasource.compute.ComputeService;
import io.nominal.datasource.configuration.Configuration;
import io.nominal.datasource.configuration.ConfigurationException;
import io.nominal.datasource.data.DataFrame;
import io.nominal.datasource.data.DataResponse;
import io.nominal.datasource.data.Field;
import io.nominal.datasource.data.QueryDataResponse;
import io.nominal.datasource.data.Status;
import io.nominal.datasource.exceptions.QueryExecutionCanceled;
import io.nominal.datasource.exceptions.QueryExecutionException;
import io.nominal.datasource.query.DataQuery;
import io.nominal.datasource.query.QueryClassifier;
import io.nominal.datasource.query.QueryKind;
import io.nominal.datasource.query.QueryModel;
import io.nominal.datasource.query.QueryValidationException;
import io.nominal.datasource.query.TemplateInterpolator;
import io.nominal.datasource.query.execution.BatchQueryExecutor;
import io.nominal.datasource.query.execution.PendingQuery;
import io.nominal.datasource.query.execution.PositionalResultReconciler;
import io.nominal.datasource.query.execution.QueryExecution;
import io.nominal.datasource.utils.JSON;

/**
 * The entry point of the data source. A request batch is routed query by
 * query:
 * <ol>
 * <li>Connection tests fetch the caller's profile from the
 * {@link AuthenticationService}.</li>
 * <li>Legacy constant and text queries are answered immediately with a
 * synthetic two point series.</li>
 * <li>Asset/channel queries are collected and sent through the
 * {@link BatchQueryExecutor}.</li>
 * </ol>
 * A failure of one query never affects the responses of its siblings.
 *
 * @since 1.0
 */
public class NominalDataSource implements Closeable {
  private static final Logger LOG =
      LoggerFactory.getLogger(NominalDataSource.class);

  public static final String DEFAULT_URL_KEY = "nominal.api.default_url";
  public static final String HEALTH_TIMEOUT_KEY = "nominal.health.timeout";

  public static final String DEFAULT_URL = "https://api.gov.nominal.io/api";
  public static final String CONNECTED_MESSAGE =
      "Successfully connected to Nominal API";

  private final Configuration config;
  private final AuthenticationService auth_service;
  private final BatchQueryExecutor batch_executor;
  private final TemplateInterpolator interpolator;
  private final QueryClassifier classifier;
  private final ComputeRequestBuilder request_builder;
  private final Timer timer;
  private final boolean owns_timer;

  /**
   * Ctor that creates and owns a timer, stopped on {@link #close()}.
   * @param config A non-null config.
   * @param compute_service A non-null compute service.
   * @param auth_service A non-null authentication service.
   */
  public NominalDataSource(final Configuration config,
                           final ComputeService compute_service,
                           final AuthenticationService auth_service) {
    this(config, compute_service, auth_service, new HashedWheelTimer(), true);
  }

  /**
   * Ctor with a shared timer that is not stopped on {@link #close()}.
   * @param config A non-null config.
   * @param compute_service A non-null compute service.
   * @param auth_service A non-null authentication service.
   * @param timer A non-null timer.
   */
  public NominalDataSource(final Configuration config,
                           final ComputeService compute_service,
                           final AuthenticationService auth_service,
                           final Timer timer) {
    this(config, compute_service, auth_service, timer, false);
  }

  private NominalDataSource(final Configuration config,
                            final ComputeService compute_service,
                            final AuthenticationService auth_service,
                            final Timer timer,
                            final boolean owns_timer) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (auth_service == null) {
      throw new IllegalArgumentException("Auth service cannot be null.");
    }
    if (timer == null) {
      throw new IllegalArgumentException("Timer cannot be null.");
    }
    this.config = config;
    this.auth_service = auth_service;
    this.timer = timer;
    this.owns_timer = owns_timer;
    registerConfigs(config);
    batch_executor = new BatchQueryExecutor(config, compute_service,
        new PositionalResultReconciler(), timer);
    interpolator = new TemplateInterpolator();
    classifier = new QueryClassifier();
    request_builder = new ComputeRequestBuilder();
  }

  /**
   * Executes every query of the request.
   * @param request A non-null request.
   * @return The execution whose deferred resolves to a response for every
   * query. It never resolves to an exception.
   */
  public QueryDataExecution execute(final QueryDataRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    final QueryDataExecution execution = new QueryDataExecution(request);

    if (request.instanceSettings() == null) {
      for (final DataQuery query : request.queries()) {
        execution.respond(query.refId(), DataResponse.error(
            Status.BAD_REQUEST, "DataSource not configured"));
      }
      execution.start();
      return execution;
    }

    final DataSourceSettings settings;
    try {
      settings = effectiveSettings(request.instanceSettings());
    } catch (ConfigurationException e) {
      LOG.error("Failed to load data source settings", e);
      for (final DataQuery query : request.queries()) {
        execution.respond(query.refId(), DataResponse.error(Status.INTERNAL,
            "Failed to load settings: " + e.getMessage(), e));
      }
      execution.start();
      return execution;
    }

    final List<PendingQuery> pending = Lists.newArrayList();
    for (final DataQuery query : request.queries()) {
      route(execution, settings, query, pending);
    }

    if (!pending.isEmpty()) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Executing batch query for " + pending.size() + " queries.");
      }
      final QueryExecution<Map<String, DataResponse>> batch =
          batch_executor.execute(settings, pending);
      execution.track(batch, batch.deferred()
          .addCallback(new BatchCB(execution, pending)));
    }
    execution.start();
    return execution;
  }

  /**
   * @param request A non-null request.
   * @return The deferred of {@link #execute(QueryDataRequest)}.
   */
  public Deferred<QueryDataResponse> queryData(
      final QueryDataRequest request) {
    return execute(request).deferred();
  }

  /**
   * Verifies the settings and the API key by fetching the caller's profile.
   * @param instance The instance settings, may be null.
   * @return A deferred resolving to the result. It never resolves to an
   * exception.
   */
  public Deferred<CheckHealthResult> checkHealth(
      final DataSourceInstanceSettings instance) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Health check called");
    }
    final DataSourceSettings loaded;
    try {
      if (instance == null) {
        throw new ConfigurationException("DataSource not configured");
      }
      loaded = DataSourceSettings.load(instance);
    } catch (ConfigurationException e) {
      LOG.error("Failed to load data source settings", e);
      return Deferred.fromResult(CheckHealthResult.error(
          "Unable to load settings: " + e.getMessage()));
    }
    if (loaded.apiBaseUrl().isEmpty()) {
      return Deferred.fromResult(
          CheckHealthResult.error("Base URL is required"));
    }
    if (Strings.isNullOrEmpty(loaded.apiKey())) {
      return Deferred.fromResult(
          CheckHealthResult.error("API key is required"));
    }

    final HealthCheck check = new HealthCheck(resolve(loaded),
        config.getLong(HEALTH_TIMEOUT_KEY));
    check.execute();
    return check.deferred();
  }

  @Override
  public void close() throws IOException {
    if (owns_timer) {
      timer.stop();
    }
  }

  /** Decodes, interpolates, classifies and dispatches a single query. */
  private void route(final QueryDataExecution execution,
                     final DataSourceSettings settings,
                     final DataQuery query,
                     final List<PendingQuery> pending) {
    QueryModel model;
    try {
      model = JSON.parseToObject(query.json(), QueryModel.class);
      if (model == null) {
        throw new IllegalArgumentException("Query was null");
      }
    } catch (RuntimeException e) {
      execution.respond(query.refId(), DataResponse.error(Status.BAD_REQUEST,
          "Failed to decode query: " + e.getMessage(), e));
      return;
    }

    model = interpolator.interpolate(model);
    if (QueryModel.CONNECTION_TEST.equals(model.queryType())) {
      connectionTest(execution, settings, query);
      return;
    }

    final QueryKind kind;
    try {
      kind = classifier.validate(model);
    } catch (QueryValidationException e) {
      LOG.error("Query validation failed for " + query.refId() + ": "
          + e.getMessage());
      execution.respond(query.refId(), DataResponse.error(Status.BAD_REQUEST,
          "Query validation failed: " + e.getMessage(), e));
      return;
    }

    if (kind.isBatchable()) {
      pending.add(new PendingQuery(query.refId(), model,
          request_builder.build(model, query.timeRange())));
    } else {
      execution.respond(query.refId(), legacy(model, query));
    }
  }

  /** Answers a legacy query with the constant and the constant plus ten. */
  private DataResponse legacy(final QueryModel model, final DataQuery query) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Using legacy query support for " + query.refId());
    }
    final List<Field<?>> fields = ImmutableList.<Field<?>>of(
        Field.time("time", ImmutableList.of(query.timeRange().from(),
            query.timeRange().to())),
        Field.number("values", ImmutableList.of(model.constant(),
            model.constant() + 10)));
    return DataResponse.ok(new DataFrame("response", fields));
  }

  private void connectionTest(final QueryDataExecution execution,
                              final DataSourceSettings settings,
                              final DataQuery query) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Processing connection test query " + query.refId());
    }

    class ProfileCB implements Callback<Object, UserProfile> {
      @Override
      public Object call(final UserProfile profile) throws Exception {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Connection test successful for profile "
              + (profile == null ? null : profile.rid()));
        }
        final List<Field<?>> fields = ImmutableList.<Field<?>>of(
            Field.string("status", ImmutableList.of("success")),
            Field.string("message", ImmutableList.of(CONNECTED_MESSAGE)));
        execution.respond(query.refId(),
            DataResponse.ok(new DataFrame("connectionTest", fields)));
        return null;
      }
    }

    class ErrCB implements Callback<Object, Exception> {
      @Override
      public Object call(final Exception e) throws Exception {
        LOG.error("Connection test failed for " + query.refId(), e);
        execution.respond(query.refId(), DataResponse.error(Status.INTERNAL,
            "Connection test failed: " + e.getMessage(), e));
        return null;
      }
    }

    final QueryExecution<UserProfile> profile;
    try {
      profile = auth_service.getMyProfile(settings);
    } catch (Exception e) {
      LOG.error("Connection test failed for " + query.refId(), e);
      execution.respond(query.refId(), DataResponse.error(Status.INTERNAL,
          "Connection test failed: " + e.getMessage(), e));
      return;
    }
    execution.track(profile, profile.deferred()
        .addCallback(new ProfileCB())
        .addErrback(new ErrCB()));
  }

  /** Copies the batch responses into the request response. */
  class BatchCB implements Callback<Object, Map<String, DataResponse>> {
    final QueryDataExecution execution;
    final List<PendingQuery> pending;

    BatchCB(final QueryDataExecution execution,
            final List<PendingQuery> pending) {
      this.execution = execution;
      this.pending = pending;
    }

    @Override
    public Object call(final Map<String, DataResponse> responses)
        throws Exception {
      for (final PendingQuery query : pending) {
        final DataResponse response = responses.get(query.refId());
        execution.respond(query.refId(), response != null ? response :
          DataResponse.error(Status.INTERNAL,
              PositionalResultReconciler.MISSING_RESULT));
      }
      return null;
    }
  }

  /** A profile call bounded by the health check timeout. */
  class HealthCheck extends QueryExecution<CheckHealthResult>
      implements TimerTask {
    private final DataSourceSettings settings;
    private final long timeout_ms;
    private volatile QueryExecution<UserProfile> profile;
    private Timeout timer_timeout;

    HealthCheck(final DataSourceSettings settings, final long timeout_ms) {
      this.settings = settings;
      this.timeout_ms = timeout_ms;
    }

    void execute() {
      class SuccessCB implements Callback<Object, UserProfile> {
        @Override
        public Object call(final UserProfile user) throws Exception {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Health check successful for user "
                + (user == null ? null : user.displayName()));
          }
          complete(CheckHealthResult.ok(CONNECTED_MESSAGE));
          return null;
        }
      }

      class ErrCB implements Callback<Object, Exception> {
        @Override
        public Object call(final Exception e) throws Exception {
          LOG.error("Health check failed", e);
          complete(CheckHealthResult.error(describeHealthFailure(e)));
          return null;
        }
      }

      synchronized (this) {
        if (timeout_ms > 0) {
          timer_timeout = timer.newTimeout(this, timeout_ms,
              TimeUnit.MILLISECONDS);
        }
      }
      try {
        profile = auth_service.getMyProfile(settings);
        profile.deferred()
          .addCallback(new SuccessCB())
          .addErrback(new ErrCB());
      } catch (Exception e) {
        LOG.error("Health check failed", e);
        complete(CheckHealthResult.error(describeHealthFailure(e)));
      }
    }

    @Override
    public void run(final Timeout timeout) throws Exception {
      if (completed.get()) {
        return;
      }
      synchronized (this) {
        timer_timeout = null;
      }
      complete(CheckHealthResult.error(describeHealthFailure(
          new QueryExecutionCanceled("Health check timed out after "
              + timeout_ms + "ms", Status.TIMEOUT.code()))));
      cancel();
    }

    @Override
    public void cancel() {
      final QueryExecution<UserProfile> outstanding = profile;
      if (outstanding != null && !outstanding.completed()) {
        outstanding.cancel();
      }
      complete(CheckHealthResult.error(describeHealthFailure(
          new QueryExecutionCanceled("Health check was cancelled",
              Status.CANCELLED.code()))));
    }

    private void complete(final CheckHealthResult result) {
      synchronized (this) {
        if (timer_timeout != null) {
          timer_timeout.cancel();
          timer_timeout = null;
        }
      }
      try {
        callback(result);
      } catch (IllegalStateException e) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Health check already completed, dropping: " + result);
        }
      }
    }
  }

  /**
   * Builds the operator facing message for a failed profile call.
   * @param e The non-null failure.
   * @return The classified message followed by the failure message.
   */
  static String describeHealthFailure(final Throwable e) {
    final String detail = e.getMessage() == null ? e.toString() : e.getMessage();
    String message = "Failed to connect to Nominal API";
    if (isUnauthorized(e, detail)) {
      message = "Invalid API key - authentication failed";
    } else if (isTimeout(e, detail)) {
      message = "Connection timeout - unable to reach Nominal API";
    } else if (isUnreachable(e, detail)) {
      message = "Unable to connect to Nominal API - check base URL";
    }
    return message + ": " + detail;
  }

  private static boolean isUnauthorized(final Throwable e, final String detail) {
    if (e instanceof QueryExecutionException &&
        ((QueryExecutionException) e).getStatusCode() == 401) {
      return true;
    }
    return detail.contains("401") || detail.contains("unauthorized");
  }

  private static boolean isTimeout(final Throwable e, final String detail) {
    if (e instanceof QueryExecutionCanceled &&
        ((QueryExecutionCanceled) e).getStatusCode() == Status.TIMEOUT.code()) {
      return true;
    }
    for (final Throwable t : Throwables.getCausalChain(e)) {
      if (t instanceof SocketTimeoutException) {
        return true;
      }
    }
    return detail.contains("timeout") || detail.contains("timed out") ||
        detail.contains("context deadline exceeded");
  }

  private static boolean isUnreachable(final Throwable e, final String detail) {
    for (final Throwable t : Throwables.getCausalChain(e)) {
      if (t instanceof ConnectException || t instanceof UnknownHostException) {
        return true;
      }
    }
    return detail.contains("connection refused") ||
        detail.contains("no such host");
  }

  /**
   * Loads the settings and resolves the base URL against the default.
   * @param instance The non-null instance settings.
   * @return The settings to make remote calls with.
   * @throws ConfigurationException if the settings could not be decoded.
   */
  DataSourceSettings effectiveSettings(
      final DataSourceInstanceSettings instance) {
    return resolve(DataSourceSettings.load(instance));
  }

  private DataSourceSettings resolve(final DataSourceSettings settings) {
    return settings.toBuilder()
        .setBaseUrl(settings.resolveBaseUrl(config.getString(DEFAULT_URL_KEY)))
        .build();
  }

  /**
   * Registers the data source keys if they are missing.
   * @param config A non-null config.
   */
  public static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(DEFAULT_URL_KEY)) {
      config.register(DEFAULT_URL_KEY, DEFAULT_URL, false,
          "The API base URL used when the data source has none configured.");
    }
    if (!config.hasProperty(HEALTH_TIMEOUT_KEY)) {
      config.register(HEALTH_TIMEOUT_KEY, 10000L, true,
          "How long, in milliseconds, a health check waits for the "
          + "authentication service.");
    }
    BatchQueryExecutor.registerConfigs(config);
  }
}
