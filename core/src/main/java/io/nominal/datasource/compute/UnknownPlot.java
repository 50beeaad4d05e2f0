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

/**
 * A plot shape this client doesn't render, e.g. enum or log plots.
 *
 * @since 1.0
 */
public final class UnknownPlot implements Plot {
  private final String type_name;

  /** @param type_name The wire type name, may be null. */
  public UnknownPlot(final String type_name) {
    this.type_name = type_name;
  }

  /** @return The wire type name. */
  public String typeName() {
    return type_name;
  }

  @Override
  public Type type() {
    return Type.UNKNOWN;
  }

  @Override
  public <T> T accept(final Visitor<T> visitor) {
    return visitor.visitUnknown(this);
  }
}
