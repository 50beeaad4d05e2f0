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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

public class TestComputeResultDecoder {

  @Test
  public void decodeNumeric() throws Exception {
    final List<ComputeResult> results = ComputeResultDecoder.decodeBatch(
        "{\"results\":[{\"computeResult\":{\"type\":\"success\",\"success\":"
        + "{\"type\":\"numeric\",\"numeric\":{\"timestamps\":[{\"seconds\":10,"
        + "\"nanos\":5},{\"seconds\":11,\"nanos\":0}],\"values\":[1.5,2]}}}}]}");
    assertEquals(1, results.size());
    assertEquals(ComputeResult.Type.SUCCESS, results.get(0).type());
    final Plot plot = results.get(0).accept(new PlotCapture());
    assertEquals(Plot.Type.NUMERIC, plot.type());
    final NumericPlot numeric = (NumericPlot) plot;
    assertEquals(new Timestamp(10, 5), numeric.timestamps().get(0));
    assertEquals(new Timestamp(11, 0), numeric.timestamps().get(1));
    assertEquals(1.5, numeric.values().get(0), 0.0001);
    assertEquals(2.0, numeric.values().get(1), 0.0001);
  }

  @Test
  public void decodeBucketed() throws Exception {
    final List<ComputeResult> results = ComputeResultDecoder.decodeBatch(
        "{\"results\":[{\"computeResult\":{\"type\":\"success\",\"success\":"
        + "{\"type\":\"bucketedNumeric\",\"bucketedNumeric\":{\"timestamps\":"
        + "[{\"seconds\":10,\"nanos\":0}],\"buckets\":[{\"min\":1,\"max\":3,"
        + "\"mean\":2,\"count\":7}]}}}}]}");
    final BucketedNumericPlot plot = (BucketedNumericPlot)
        results.get(0).accept(new PlotCapture());
    assertEquals(Plot.Type.BUCKETED_NUMERIC, plot.type());
    assertEquals(1, plot.buckets().size());
    assertEquals(1, plot.buckets().get(0).min(), 0.0001);
    assertEquals(3, plot.buckets().get(0).max(), 0.0001);
    assertEquals(2, plot.buckets().get(0).mean(), 0.0001);
    assertEquals(7, plot.buckets().get(0).count());
  }

  @Test
  public void decodeNonFiniteBuckets() throws Exception {
    final List<ComputeResult> results = ComputeResultDecoder.decodeBatch(
        "{\"results\":[{\"computeResult\":{\"type\":\"success\",\"success\":"
        + "{\"type\":\"bucketedNumeric\",\"bucketedNumeric\":{\"timestamps\":"
        + "[{\"seconds\":10,\"nanos\":0}],\"buckets\":[{\"min\":NaN,"
        + "\"count\":0}]}}}}]}");
    final BucketedNumericPlot plot = (BucketedNumericPlot)
        results.get(0).accept(new PlotCapture());
    assertTrue(Double.isNaN(plot.buckets().get(0).min()));
    assertTrue(Double.isNaN(plot.buckets().get(0).mean()));
  }

  @Test
  public void decodeErrorAndUnknown() throws Exception {
    final List<ComputeResult> results = ComputeResultDecoder.decodeBatch(
        "{\"results\":["
        + "{\"computeResult\":{\"type\":\"error\",\"error\":{\"errorType\":"
        + "\"CHANNEL_NOT_FOUND\",\"code\":404}}},"
        + "{\"computeResult\":{\"type\":\"somethingNew\",\"somethingNew\":{}}},"
        + "{\"computeResult\":{\"type\":\"success\",\"success\":{\"type\":"
        + "\"enum\",\"enum\":{}}}},"
        + "{\"other\":true}"
        + "]}");
    assertEquals(4, results.size());

    assertEquals(ComputeResult.Type.ERROR, results.get(0).type());
    assertEquals("CHANNEL_NOT_FOUND:404", results.get(0).accept(
        new Describer()));

    assertEquals(ComputeResult.Type.UNKNOWN, results.get(1).type());
    assertEquals("unknown:somethingNew", results.get(1).accept(
        new Describer()));

    final Plot plot = results.get(2).accept(new PlotCapture());
    assertEquals(Plot.Type.UNKNOWN, plot.type());
    assertEquals("enum", ((UnknownPlot) plot).typeName());

    // missing compute result
    assertEquals(ComputeResult.Type.UNKNOWN, results.get(3).type());
    assertEquals("unknown:null", results.get(3).accept(new Describer()));
  }

  @Test
  public void decodeEmpty() throws Exception {
    assertTrue(ComputeResultDecoder.decodeBatch("{}").isEmpty());
    assertTrue(ComputeResultDecoder.decodeBatch("{\"results\":null}")
        .isEmpty());
    assertTrue(ComputeResultDecoder.decodeBatch("{\"results\":[]}")
        .isEmpty());
  }

  @Test
  public void decodeMalformed() throws Exception {
    try {
      ComputeResultDecoder.decodeBatch("[]");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ComputeResultDecoder.decodeBatch("{\"results\":{}}");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ComputeResultDecoder.decodeBatch("{\"results\":[");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ComputeResultDecoder.decodeBatch((String) null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  /** Returns the plot on success, null otherwise. */
  static class PlotCapture implements ComputeResult.Visitor<Plot> {
    @Override
    public Plot visitSuccess(final Plot plot) {
      return plot;
    }

    @Override
    public Plot visitError(final String error_type, final String code) {
      return null;
    }

    @Override
    public Plot visitUnknown(final String type_name) {
      return null;
    }
  }

  static class Describer implements ComputeResult.Visitor<String> {
    @Override
    public String visitSuccess(final Plot plot) {
      return "success";
    }

    @Override
    public String visitError(final String error_type, final String code) {
      return error_type + ":" + code;
    }

    @Override
    public String visitUnknown(final String type_name) {
      return "unknown:" + type_name;
    }
  }

  @Test
  public void nullPlot() throws Exception {
    try {
      ComputeResult.success(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    assertNull(ComputeResult.error("E", "1").accept(new PlotCapture()));
  }
}
