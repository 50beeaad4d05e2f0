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
package io.nominal.datasource.data;

import java.time.Instant;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A named, typed column of a {@link DataFrame}.
 *
 * @param <T> The value type.
 * @since 1.0
 */
public final class Field<T> {
  private final String name;
  private final Class<T> type;
  private final List<T> values;

  private Field(final String name, final Class<T> type, final List<T> values) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    this.name = name;
    this.type = type;
    this.values = ImmutableList.copyOf(values);
  }

  public static Field<Instant> time(final String name,
                                    final List<Instant> values) {
    return new Field<Instant>(name, Instant.class, values);
  }

  public static Field<Double> number(final String name,
                                     final List<Double> values) {
    return new Field<Double>(name, Double.class, values);
  }

  public static Field<String> string(final String name,
                                     final List<String> values) {
    return new Field<String>(name, String.class, values);
  }

  public String name() {
    return name;
  }

  public Class<T> type() {
    return type;
  }

  public List<T> values() {
    return values;
  }

  public int size() {
    return values.size();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("type", type.getSimpleName())
        .add("size", values.size())
        .toString();
  }
}
