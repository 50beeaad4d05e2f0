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

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Lists;

import io.nominal.datasource.utils.JSON;

/**
 * Decodes batch compute responses of the form
 * <pre>
 * {"results": [{"computeResult": {"type": "success", "success": {...}}}, ...]}
 * </pre>
 * into {@link ComputeResult}s. Unions are read from the tree so unknown
 * variants surface as {@link ComputeResult.Type#UNKNOWN} or
 * {@link UnknownPlot} rather than as mapping errors.
 *
 * @since 1.0
 */
public final class ComputeResultDecoder {
  private static final Logger LOG =
      LoggerFactory.getLogger(ComputeResultDecoder.class);

  private ComputeResultDecoder() {
  }

  /**
   * Decodes a full response body.
   * @param json The non-null and non-empty body.
   * @return The positional results, possibly empty.
   * @throws IllegalArgumentException if the body could not be parsed or the
   * results array was missing.
   */
  public static List<ComputeResult> decodeBatch(final String json) {
    return decodeBatch(JSON.parseToTree(json));
  }

  /**
   * Decodes a parsed response body.
   * @param root The non-null root node.
   * @return The positional results, possibly empty.
   * @throws IllegalArgumentException if the results array was missing.
   */
  public static List<ComputeResult> decodeBatch(final JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Response was not a JSON object.");
    }
    final JsonNode results = root.get("results");
    if (results == null || results.isNull()) {
      return Collections.emptyList();
    }
    if (!results.isArray()) {
      throw new IllegalArgumentException("Results was not an array.");
    }
    final List<ComputeResult> decoded =
        Lists.newArrayListWithCapacity(results.size());
    for (final JsonNode result : results) {
      decoded.add(decode(result.get("computeResult")));
    }
    return decoded;
  }

  /**
   * Decodes one compute result union.
   * @param node The union node, may be null.
   * @return The decoded result, never null.
   */
  public static ComputeResult decode(final JsonNode node) {
    final String type = text(node, "type");
    if ("success".equals(type)) {
      return ComputeResult.success(decodePlot(node.get("success")));
    }
    if ("error".equals(type)) {
      final JsonNode error = node.get("error");
      return ComputeResult.error(text(error, "errorType"), text(error, "code"));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Unknown compute result variant: " + type);
    }
    return ComputeResult.unknown(type);
  }

  /**
   * Decodes a plot union.
   * @param node The union node, may be null.
   * @return The decoded plot, never null.
   */
  public static Plot decodePlot(final JsonNode node) {
    final String type = text(node, "type");
    if ("numeric".equals(type)) {
      final JsonNode plot = node.path("numeric");
      final List<Double> values = Lists.newArrayList();
      for (final JsonNode value : plot.path("values")) {
        values.add(value.asDouble());
      }
      return new NumericPlot(timestamps(plot.path("timestamps")), values);
    }
    if ("bucketedNumeric".equals(type)) {
      final JsonNode plot = node.path("bucketedNumeric");
      final List<NumericBucket> buckets = Lists.newArrayList();
      for (final JsonNode bucket : plot.path("buckets")) {
        buckets.add(new NumericBucket(
            bucket.path("min").asDouble(Double.NaN),
            bucket.path("max").asDouble(Double.NaN),
            bucket.path("mean").asDouble(Double.NaN),
            bucket.path("count").asLong()));
      }
      return new BucketedNumericPlot(timestamps(plot.path("timestamps")),
          buckets);
    }
    return new UnknownPlot(type);
  }

  private static List<Timestamp> timestamps(final JsonNode array) {
    final List<Timestamp> timestamps =
        Lists.newArrayListWithCapacity(array.size());
    for (final JsonNode ts : array) {
      timestamps.add(new Timestamp(ts.path("seconds").asLong(),
          ts.path("nanos").asLong()));
    }
    return timestamps;
  }

  private static String text(final JsonNode node, final String field) {
    if (node == null) {
      return null;
    }
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
