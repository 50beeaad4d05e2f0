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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.base.Strings;

import io.nominal.datasource.query.QueryModel;
import io.nominal.datasource.query.TimeRange;

/**
 * Builds the compute graph for a validated asset/channel query:
 * <pre>
 * summarize(buckets)
 *   numeric(timeShift(duration))
 *     channel(asset(assetRid = $assetRid, channel, dataScopeName))
 * </pre>
 * The asset RID is bound through the context variable {@link #ASSET_RID}
 * rather than inlined. String template variables are bound as well so
 * server-side references resolve; other value types are skipped.
 *
 * @since 1.0
 */
public class ComputeRequestBuilder {

  /** The context variable the asset RID is bound to. */
  public static final String ASSET_RID = "assetRid";

  /**
   * Builds the request.
   * @param model A non-null, validated model.
   * @param time_range A non-null time range. Sub-second precision is
   * discarded.
   * @return A non-null request.
   */
  public ComputeNodeRequest build(final QueryModel model,
                                  final TimeRange time_range) {
    if (model == null) {
      throw new IllegalArgumentException("Model cannot be null.");
    }
    if (time_range == null) {
      throw new IllegalArgumentException("Time range cannot be null.");
    }

    final AssetChannel asset_channel = AssetChannel.newBuilder()
        .setAssetRid(StringConstant.variable(ASSET_RID))
        .setChannel(StringConstant.literal(model.channel()))
        .setDataScopeName(StringConstant.literal(
            Strings.nullToEmpty(model.dataScopeName())))
        .build();

    final TimeShiftSeries shift = new TimeShiftSeries(
        NumericSeries.channel(ChannelSeries.asset(asset_channel)),
        DurationConstant.literal(model.timeShiftSeconds(), 0));

    final SummarizeSeries summarize = new SummarizeSeries(
        Series.numeric(NumericSeries.timeShift(shift)), model.buckets());

    return ComputeNodeRequest.newBuilder()
        .setStart(Timestamp.ofEpochSecond(time_range.from()))
        .setEnd(Timestamp.ofEpochSecond(time_range.to()))
        .setNode(ComputableNode.series(summarize))
        .setContext(buildContext(model))
        .build();
  }

  /**
   * Binds the asset RID and every string template variable. The query's own
   * asset RID wins over a template variable of the same name.
   * @param model A non-null model.
   * @return The context.
   */
  ComputeContext buildContext(final QueryModel model) {
    final Map<String, VariableValue> variables =
        new LinkedHashMap<String, VariableValue>();
    variables.put(ASSET_RID,
        VariableValue.string(Strings.nullToEmpty(model.assetRid())));
    if (model.templateVariables() != null) {
      for (final Entry<String, Object> entry :
          model.templateVariables().entrySet()) {
        if (entry.getValue() instanceof String &&
            !ASSET_RID.equals(entry.getKey())) {
          variables.put(entry.getKey(),
              VariableValue.string((String) entry.getValue()));
        }
      }
    }
    return new ComputeContext(variables);
  }
}
