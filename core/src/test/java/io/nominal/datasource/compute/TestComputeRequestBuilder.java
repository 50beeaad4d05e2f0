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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.Iterator;

import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;

import io.nominal.datasource.query.QueryModel;
import io.nominal.datasource.query.TimeRange;
import io.nominal.datasource.utils.JSON;

public class TestComputeRequestBuilder {
  private static final TimeRange RANGE = new TimeRange(
      Instant.ofEpochSecond(1700000000L, 250000000),
      Instant.ofEpochSecond(1700003600L, 999000000));

  private ComputeRequestBuilder builder;

  @Before
  public void before() throws Exception {
    builder = new ComputeRequestBuilder();
  }

  @Test
  public void build() throws Exception {
    final ComputeNodeRequest request = builder.build(QueryModel.newBuilder()
        .setAssetRid("ri.asset.1")
        .setChannel("speed")
        .setDataScopeName("car")
        .setBuckets(250)
        .setTimeShiftSeconds(-60)
        .build(), RANGE);

    assertEquals(new Timestamp(1700000000L, 0), request.start());
    assertEquals(new Timestamp(1700003600L, 0), request.end());

    final SummarizeSeries summarize = request.node().series();
    assertEquals(250, summarize.buckets());
    final TimeShiftSeries shift = summarize.input().numeric().timeShift();
    assertEquals(-60, shift.duration().literal().seconds());
    assertEquals(0, shift.duration().literal().nanos());

    final AssetChannel asset = shift.input().channel().asset();
    assertTrue(asset.assetRid().isVariable());
    assertEquals(ComputeRequestBuilder.ASSET_RID, asset.assetRid().variable());
    assertFalse(asset.channel().isVariable());
    assertEquals("speed", asset.channel().literal());
    assertEquals("car", asset.dataScopeName().literal());

    assertEquals(1, request.context().variables().size());
    assertEquals("ri.asset.1", request.context().variables()
        .get(ComputeRequestBuilder.ASSET_RID).string());
  }

  @Test
  public void serializedShape() throws Exception {
    final ComputeNodeRequest request = builder.build(QueryModel.newBuilder()
        .setAssetRid("ri.asset.1")
        .setChannel("speed")
        .setBuckets(100)
        .build(), RANGE);
    final JsonNode root = JSON.getMapper().readTree(
        JSON.serializeToString(request));

    final Iterator<String> names = root.fieldNames();
    assertEquals("start", names.next());
    assertEquals("end", names.next());
    assertEquals("node", names.next());
    assertEquals("context", names.next());
    assertFalse(names.hasNext());

    assertEquals(1700000000L, root.at("/start/seconds").asLong());
    assertEquals(0, root.at("/start/nanos").asLong());
    assertEquals(1700003600L, root.at("/end/seconds").asLong());

    final JsonNode node = root.get("node");
    assertEquals("series", node.get("type").asText());
    assertEquals(100, node.at("/series/buckets").asInt());
    final JsonNode numeric = node.at("/series/input");
    assertEquals("numeric", numeric.get("type").asText());
    assertEquals("timeShift", numeric.at("/numeric/type").asText());
    final JsonNode shift = numeric.at("/numeric/timeShift");
    assertEquals("literal", shift.at("/duration/type").asText());
    assertEquals(0, shift.at("/duration/literal/seconds").asLong());
    assertEquals("channel", shift.at("/input/type").asText());
    assertTrue(shift.get("input").get("timeShift") == null);

    final JsonNode asset = shift.at("/input/channel/asset");
    assertEquals("asset", shift.at("/input/channel/type").asText());
    assertEquals("variable", asset.at("/assetRid/type").asText());
    assertEquals("assetRid", asset.at("/assetRid/variable").asText());
    assertTrue(asset.get("assetRid").get("literal") == null);
    assertEquals("literal", asset.at("/channel/type").asText());
    assertEquals("speed", asset.at("/channel/literal").asText());
    assertEquals("", asset.at("/dataScopeName/literal").asText());
    assertTrue(asset.get("additionalTags").isObject());
    assertEquals(0, asset.get("additionalTags").size());
    assertTrue(asset.get("tagsToGroupBy").isArray());
    assertEquals(0, asset.get("groupByTags").size());

    final JsonNode variables = root.at("/context/variables");
    assertEquals("string", variables.at("/assetRid/type").asText());
    assertEquals("ri.asset.1", variables.at("/assetRid/string").asText());
  }

  @Test
  public void contextVariables() throws Exception {
    final ComputeContext context = builder.buildContext(QueryModel.newBuilder()
        .setAssetRid("ri.asset.1")
        .setChannel("speed")
        .addTemplateVariable("vehicle", "car-1")
        .addTemplateVariable("assetRid", "ri.asset.other")
        .addTemplateVariable("count", 4)
        .build());
    assertEquals(2, context.variables().size());
    assertEquals("ri.asset.1", context.variables().get("assetRid").string());
    assertEquals("car-1", context.variables().get("vehicle").string());
    assertEquals("assetRid", context.variables().keySet().iterator().next());

    try {
      context.variables().put("x", VariableValue.string("y"));
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }

  @Test
  public void buildNulls() throws Exception {
    try {
      builder.build(null, RANGE);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      builder.build(QueryModel.newBuilder()
          .setAssetRid("ri.asset.1")
          .setChannel("speed")
          .build(), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
