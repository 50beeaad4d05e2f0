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

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A named set of columns.
 *
 * @since 1.0
 */
public final class DataFrame {
  private final String name;
  private final List<Field<?>> fields;

  /**
   * Default ctor.
   * @param name The frame name, may be null.
   * @param fields The non-null columns.
   */
  public DataFrame(final String name, final List<Field<?>> fields) {
    if (fields == null) {
      throw new IllegalArgumentException("Fields cannot be null.");
    }
    this.name = name;
    this.fields = ImmutableList.copyOf(fields);
  }

  public String name() {
    return name;
  }

  public List<Field<?>> fields() {
    return fields;
  }

  /**
   * @param name The field name.
   * @return The first field with the name or null if not found.
   */
  public Field<?> field(final String name) {
    for (final Field<?> field : fields) {
      if (field.name().equals(name)) {
        return field;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("fields", fields)
        .toString();
  }
}
