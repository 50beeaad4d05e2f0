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
package io.nominal.datasource.utils;

import java.io.IOException;

import org.apache.http.HttpResponse;
import org.apache.http.ParseException;
import org.apache.http.client.entity.DeflateDecompressingEntity;
import org.apache.http.client.entity.GzipDecompressingEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.impl.nio.client.HttpAsyncClients;
import org.apache.http.impl.nio.reactor.IOReactorConfig;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import io.nominal.datasource.configuration.Configuration;
import io.nominal.datasource.exceptions.RemoteQueryExecutionException;

/**
 * The default {@link SharedHttpClient}: one pooled async client sized from
 * the configuration, started on construction and closed with this object.
 *
 * @since 1.0
 */
public class DefaultSharedHttpClient implements SharedHttpClient {
  private static final Logger LOG = LoggerFactory.getLogger(
      DefaultSharedHttpClient.class);

  public static final String KEY_PREFIX = "httpclient.";
  public static final String IO_THREADS_KEY = "io.threads";
  public static final String MAX_CONNECTIONS_KEY = "max.connections";
  public static final String MAX_ROUTE_CONNECTIONS_KEY =
      "max.connections.route";

  /** The client. */
  protected final CloseableHttpAsyncClient client;

  /**
   * Builds and starts a client from the configuration.
   * @param config A non-null config. Keys are registered if missing.
   */
  public DefaultSharedHttpClient(final Configuration config) {
    this(buildClient(config));
  }

  /**
   * Wraps an existing client, starting it if needed.
   * @param client A non-null client.
   */
  protected DefaultSharedHttpClient(final CloseableHttpAsyncClient client) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.client = client;
    if (!client.isRunning()) {
      client.start();
    }
    LOG.info("Initialized shared HTTP client.");
  }

  @Override
  public CloseableHttpAsyncClient getClient() {
    return client;
  }

  @Override
  public void close() throws IOException {
    try {
      client.close();
    } catch (IOException e) {
      LOG.error("Failed to close HTTPClient", e);
      throw e;
    }
  }

  /**
   * Helper that handles decompressing the result and parses the entity
   * to a string. If the status isn't a 200 we throw a
   * {@link RemoteQueryExecutionException} with the most useful message we
   * can pull out of the body.
   * @param response The non-null response to parse.
   * @param order The order of the result.
   * @param remote_host The remote host name.
   * @return A string if successful.
   * @throws RemoteQueryExecutionException if the call failed or the body
   * couldn't be read.
   */
  public static String parseResponse(final HttpResponse response,
                                     final int order,
                                     final String remote_host) {
    final String content;
    if (response.getEntity() == null) {
      throw new RemoteQueryExecutionException("Content for http response "
          + "was null: " + response, remote_host,
          statusCode(response, 500), order, null);
    }

    try {
      final String encoding = (response.getEntity().getContentEncoding() != null &&
          response.getEntity().getContentEncoding().getValue() != null ?
              response.getEntity().getContentEncoding().getValue().toLowerCase() :
                "");
      if (encoding.equals("gzip") || encoding.equals("x-gzip")) {
        content = EntityUtils.toString(
            new GzipDecompressingEntity(response.getEntity()), "UTF-8");
      } else if (encoding.equals("deflate")) {
        content = EntityUtils.toString(
            new DeflateDecompressingEntity(response.getEntity()), "UTF-8");
      } else if (encoding.equals("") || encoding.equals("identity")) {
        content = EntityUtils.toString(response.getEntity(), "UTF-8");
      } else {
        throw new RemoteQueryExecutionException("Unhandled content encoding ["
            + encoding + "] : " + response, remote_host, 500, order, null);
      }
    } catch (ParseException e) {
      LOG.error("Failed to parse content from HTTP response: " + response, e);
      throw new RemoteQueryExecutionException("Content parsing failure for: "
          + response, remote_host, 500, order, e);
    } catch (IOException e) {
      LOG.error("Failed to parse content from HTTP response: " + response, e);
      throw new RemoteQueryExecutionException("Content parsing failure for: "
          + response, remote_host, 500, order, e);
    }

    final int status = response.getStatusLine().getStatusCode();
    if (status == 200) {
      return content;
    }

    if (content.startsWith("{")) {
      try {
        final JsonNode root = JSON.getMapper().readTree(content);
        // conjure style: {"errorCode": "...", "errorName": "..."}
        final JsonNode error_name = root.get("errorName");
        if (error_name != null && !error_name.isNull()) {
          final JsonNode error_code = root.get("errorCode");
          throw new RemoteQueryExecutionException(status + " "
              + error_name.asText() + (error_code == null || error_code.isNull()
                  ? "" : " (" + error_code.asText() + ")"),
              remote_host, status, order, null);
        }
        // nested style: {"error": {"message": "..."}}
        final JsonNode node = root.get("error");
        if (node != null && !node.isNull()) {
          final JsonNode message = node.get("message");
          if (message != null && !message.isNull()) {
            throw new RemoteQueryExecutionException(message.asText(),
                remote_host, status, order, null);
          }
        }
      } catch (IOException e) {
        LOG.warn("Failed to parse the JSON exception: " + content, e);
        // fall through
      }
    }
    throw new RemoteQueryExecutionException(content.isEmpty() ?
        "HTTP " + status + " from " + remote_host : content,
        remote_host, status, order, null);
  }

  private static int statusCode(final HttpResponse response,
                                final int default_code) {
    return response.getStatusLine() == null ? default_code :
      response.getStatusLine().getStatusCode();
  }

  private static CloseableHttpAsyncClient buildClient(
      final Configuration config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    registerConfigs(config);
    return HttpAsyncClients.custom()
        .setDefaultIOReactorConfig(IOReactorConfig.custom()
            .setIoThreadCount(config.getInt(KEY_PREFIX + IO_THREADS_KEY))
            .build())
        .setMaxConnTotal(config.getInt(KEY_PREFIX + MAX_CONNECTIONS_KEY))
        .setMaxConnPerRoute(config.getInt(KEY_PREFIX + MAX_ROUTE_CONNECTIONS_KEY))
        .build();
  }

  /**
   * Registers the client keys if they are missing.
   * @param config A non-null config.
   */
  static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(KEY_PREFIX + IO_THREADS_KEY)) {
      config.register(KEY_PREFIX + IO_THREADS_KEY, 8, false,
          "The number of I/O reactor threads for the shared HTTP client.");
    }
    if (!config.hasProperty(KEY_PREFIX + MAX_CONNECTIONS_KEY)) {
      config.register(KEY_PREFIX + MAX_CONNECTIONS_KEY, 200, false,
          "The maximum number of pooled connections across all routes.");
    }
    if (!config.hasProperty(KEY_PREFIX + MAX_ROUTE_CONNECTIONS_KEY)) {
      config.register(KEY_PREFIX + MAX_ROUTE_CONNECTIONS_KEY, 25, false,
          "The maximum number of pooled connections per route.");
    }
  }
}
