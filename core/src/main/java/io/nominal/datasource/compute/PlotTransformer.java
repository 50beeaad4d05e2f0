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

import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

/**
 * Turns a successful {@link Plot} into time and value columns. Numeric plots
 * zip timestamps with values, bucketed plots zip timestamps with the bucket
 * means. Both stop at the shorter of the two lists. Other shapes yield an
 * empty series.
 *
 * @since 1.0
 */
public class PlotTransformer implements Plot.Visitor<TimeSeriesPoints> {
  private static final Logger LOG =
      LoggerFactory.getLogger(PlotTransformer.class);

  /**
   * @param plot A non-null plot.
   * @return The points, never null.
   */
  public TimeSeriesPoints transform(final Plot plot) {
    if (plot == null) {
      throw new IllegalArgumentException("Plot cannot be null.");
    }
    return plot.accept(this);
  }

  @Override
  public TimeSeriesPoints visitNumeric(final NumericPlot plot) {
    final int size = Math.min(plot.timestamps().size(), plot.values().size());
    final List<Instant> times = Lists.newArrayListWithCapacity(size);
    final List<Double> values = Lists.newArrayListWithCapacity(size);
    for (int i = 0; i < size; i++) {
      times.add(plot.timestamps().get(i).toInstant());
      values.add(plot.values().get(i));
    }
    return new TimeSeriesPoints(times, values);
  }

  @Override
  public TimeSeriesPoints visitBucketedNumeric(final BucketedNumericPlot plot) {
    final int size = Math.min(plot.timestamps().size(), plot.buckets().size());
    final List<Instant> times = Lists.newArrayListWithCapacity(size);
    final List<Double> values = Lists.newArrayListWithCapacity(size);
    for (int i = 0; i < size; i++) {
      times.add(plot.timestamps().get(i).toInstant());
      values.add(plot.buckets().get(i).mean());
    }
    return new TimeSeriesPoints(times, values);
  }

  @Override
  public TimeSeriesPoints visitUnknown(final UnknownPlot plot) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Unsupported plot type: " + plot.typeName());
    }
    return TimeSeriesPoints.empty();
  }
}
