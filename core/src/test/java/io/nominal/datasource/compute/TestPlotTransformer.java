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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;

public class TestPlotTransformer {
  private PlotTransformer transformer;

  @Before
  public void before() throws Exception {
    transformer = new PlotTransformer();
  }

  @Test
  public void numeric() throws Exception {
    final TimeSeriesPoints points = transformer.transform(new NumericPlot(
        Lists.newArrayList(new Timestamp(10, 0), new Timestamp(11, 500)),
        Lists.newArrayList(1.0, 2.0)));
    assertEquals(2, points.size());
    assertEquals(Instant.ofEpochSecond(10), points.times().get(0));
    assertEquals(Instant.ofEpochSecond(11, 500), points.times().get(1));
    assertEquals(2.0, points.values().get(1), 0.0001);
  }

  @Test
  public void numericMismatchedLengths() throws Exception {
    TimeSeriesPoints points = transformer.transform(new NumericPlot(
        Lists.newArrayList(new Timestamp(10, 0), new Timestamp(11, 0),
            new Timestamp(12, 0)),
        Lists.newArrayList(1.0, 2.0)));
    assertEquals(2, points.size());
    assertEquals(Instant.ofEpochSecond(11), points.times().get(1));

    points = transformer.transform(new NumericPlot(
        Lists.newArrayList(new Timestamp(10, 0)),
        Lists.newArrayList(1.0, 2.0, 3.0)));
    assertEquals(1, points.size());
    assertEquals(1.0, points.values().get(0), 0.0001);
  }

  @Test
  public void bucketedUsesMean() throws Exception {
    final TimeSeriesPoints points = transformer.transform(
        new BucketedNumericPlot(
            Lists.newArrayList(new Timestamp(10, 0), new Timestamp(20, 0)),
            Lists.newArrayList(new NumericBucket(0, 10, 4.5, 3),
                new NumericBucket(1, 2, 1.5, 2),
                new NumericBucket(5, 5, 5, 1))));
    assertEquals(2, points.size());
    assertEquals(4.5, points.values().get(0), 0.0001);
    assertEquals(1.5, points.values().get(1), 0.0001);
    assertEquals(Instant.ofEpochSecond(20), points.times().get(1));
  }

  @Test
  public void emptyAndUnknown() throws Exception {
    assertTrue(transformer.transform(new NumericPlot(
        Collections.<Timestamp>emptyList(),
        Collections.<Double>emptyList())).isEmpty());
    assertTrue(transformer.transform(new UnknownPlot("enum")).isEmpty());

    try {
      transformer.transform(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void pointsValidation() throws Exception {
    try {
      new TimeSeriesPoints(Lists.newArrayList(Instant.EPOCH),
          Collections.<Double>emptyList());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new TimeSeriesPoints(null, Collections.<Double>emptyList());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
