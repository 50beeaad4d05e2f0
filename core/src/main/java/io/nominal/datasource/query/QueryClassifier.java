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
package io.nominal.datasource.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

/**
 * Classifies decoded (and interpolated) queries and validates the fields of
 * the asset/channel kind. Classification is by priority:
 * <ol>
 * <li>An explicit {@code connectionTest} query type.</li>
 * <li>Non-empty asset RID and channel.</li>
 * <li>Non-empty query text.</li>
 * <li>A non-zero constant.</li>
 * </ol>
 * Anything else is invalid.
 *
 * @since 1.0
 */
public class QueryClassifier {
  private static final Logger LOG = LoggerFactory.getLogger(QueryClassifier.class);

  /** Bucket counts above this are allowed but logged. */
  public static final int LARGE_BUCKET_COUNT = 10000;

  /**
   * Determines the kind without validating fields.
   * @param model A non-null model.
   * @return The kind.
   * @throws QueryValidationException if the model matched no kind.
   */
  public QueryKind classify(final QueryModel model) {
    if (model == null) {
      throw new IllegalArgumentException("Model cannot be null.");
    }
    if (QueryModel.CONNECTION_TEST.equals(model.queryType())) {
      return QueryKind.CONNECTION_TEST;
    }
    if (!Strings.isNullOrEmpty(model.assetRid()) &&
        !Strings.isNullOrEmpty(model.channel())) {
      return QueryKind.ASSET_CHANNEL;
    }
    if (!Strings.isNullOrEmpty(model.queryText())) {
      return QueryKind.LEGACY_TEXT;
    }
    if (model.constant() != 0) {
      return QueryKind.LEGACY_CONSTANT;
    }
    throw new QueryValidationException("query must have either asset/channel "
        + "parameters, query text, or constant value");
  }

  /**
   * Classifies and then validates the model.
   * @param model A non-null model.
   * @return The kind.
   * @throws QueryValidationException if the model was invalid.
   * @throws UnresolvedTemplateVariableException if the asset RID still
   * carries a template variable marker.
   */
  public QueryKind validate(final QueryModel model) {
    final QueryKind kind = classify(model);
    if (kind != QueryKind.ASSET_CHANNEL) {
      return kind;
    }

    if (model.assetRid().trim().isEmpty()) {
      throw new QueryValidationException("assetRid cannot be empty");
    }
    if (model.channel().trim().isEmpty()) {
      throw new QueryValidationException("channel cannot be empty");
    }
    if (!Strings.isNullOrEmpty(model.dataScopeName()) &&
        model.dataScopeName().trim().isEmpty()) {
      throw new QueryValidationException(
          "dataScopeName cannot be empty when provided");
    }
    if (model.buckets() < 0) {
      throw new QueryValidationException(
          "buckets must be non-negative, got " + model.buckets());
    }
    if (model.buckets() > LARGE_BUCKET_COUNT) {
      LOG.warn("Large bucket count may impact performance: "
          + model.buckets());
    }
    if (model.assetRid().indexOf('$') >= 0) {
      throw new UnresolvedTemplateVariableException("assetRid",
          model.assetRid());
    }
    return kind;
  }
}
