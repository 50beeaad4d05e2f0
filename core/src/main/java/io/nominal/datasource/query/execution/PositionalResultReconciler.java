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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import io.nominal.datasource.compute.ComputeResult;
import io.nominal.datasource.compute.Plot;
import io.nominal.datasource.compute.PlotTransformer;
import io.nominal.datasource.compute.TimeSeriesPoints;
import io.nominal.datasource.data.DataFrame;
import io.nominal.datasource.data.DataResponse;
import io.nominal.datasource.data.Field;
import io.nominal.datasource.data.Status;

/**
 * Pairs the i-th result with the i-th query of the chunk. Successful plots
 * become a frame named after the query's channel with {@code time} and
 * {@code value} fields; remote errors, unknown variants, transform failures
 * and missing results become error responses for that query alone.
 *
 * @since 1.0
 */
public class PositionalResultReconciler implements ResultReconciler {
  private static final Logger LOG =
      LoggerFactory.getLogger(PositionalResultReconciler.class);

  public static final String MISSING_RESULT = "Missing result in batch response";

  private final PlotTransformer transformer;

  public PositionalResultReconciler() {
    this(new PlotTransformer());
  }

  /** @param transformer A non-null transformer. */
  public PositionalResultReconciler(final PlotTransformer transformer) {
    if (transformer == null) {
      throw new IllegalArgumentException("Transformer cannot be null.");
    }
    this.transformer = transformer;
  }

  @Override
  public Map<String, DataResponse> reconcile(final Chunk chunk,
                                             final List<ComputeResult> results) {
    if (chunk == null) {
      throw new IllegalArgumentException("Chunk cannot be null.");
    }
    final List<ComputeResult> received = results == null ?
        Collections.<ComputeResult>emptyList() : results;
    if (received.size() != chunk.size()) {
      LOG.warn("Batch response for " + chunk + " had " + received.size()
          + " results for " + chunk.size() + " requests.");
    }

    final Map<String, DataResponse> responses =
        Maps.newHashMapWithExpectedSize(chunk.size());
    for (int i = 0; i < chunk.size(); i++) {
      final PendingQuery query = chunk.queries().get(i);
      final ComputeResult result = i < received.size() ? received.get(i) : null;
      if (result == null) {
        responses.put(query.refId(),
            DataResponse.error(Status.INTERNAL, MISSING_RESULT));
        continue;
      }
      responses.put(query.refId(), result.accept(new ResultCB(query)));
    }
    return responses;
  }

  /** Converts one result for one query. */
  class ResultCB implements ComputeResult.Visitor<DataResponse> {
    final PendingQuery query;

    ResultCB(final PendingQuery query) {
      this.query = query;
    }

    @Override
    public DataResponse visitSuccess(final Plot plot) {
      final TimeSeriesPoints points;
      try {
        points = transformer.transform(plot);
      } catch (Exception e) {
        LOG.error("Failed to transform result for " + query.refId(), e);
        return DataResponse.error(Status.INTERNAL,
            "Transform failed: " + e.getMessage(), e);
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Transformed " + points.size() + " points for "
            + query.refId());
      }
      final List<Field<?>> fields = Lists.newArrayListWithCapacity(2);
      fields.add(Field.time("time", points.times()));
      fields.add(Field.number("value", points.values()));
      return DataResponse.ok(new DataFrame(query.model().channel(), fields));
    }

    @Override
    public DataResponse visitError(final String error_type, final String code) {
      return DataResponse.error(Status.INTERNAL,
          "Compute error: " + error_type + " (code: " + code + ")");
    }

    @Override
    public DataResponse visitUnknown(final String type_name) {
      return DataResponse.error(Status.INTERNAL,
          "Unknown result type: " + type_name);
    }
  }
}
