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

import com.google.common.collect.ImmutableList;

/**
 * Raw numeric points. The timestamp and value lists are parallel though the
 * server doesn't promise equal lengths.
 *
 * @since 1.0
 */
public final class NumericPlot implements Plot {
  private final List<Timestamp> timestamps;
  private final List<Double> values;

  /**
   * Default ctor.
   * @param timestamps The timestamps, null is treated as empty.
   * @param values The values, null is treated as empty.
   */
  public NumericPlot(final List<Timestamp> timestamps,
                     final List<Double> values) {
    this.timestamps = timestamps == null ? Collections.<Timestamp>emptyList()
        : ImmutableList.copyOf(timestamps);
    this.values = values == null ? Collections.<Double>emptyList()
        : Collections.unmodifiableList(values);
  }

  public List<Timestamp> timestamps() {
    return timestamps;
  }

  public List<Double> values() {
    return values;
  }

  @Override
  public Type type() {
    return Type.NUMERIC;
  }

  @Override
  public <T> T accept(final Visitor<T> visitor) {
    return visitor.visitNumeric(this);
  }
}
