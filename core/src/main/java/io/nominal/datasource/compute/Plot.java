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
 * A successful compute payload. Only numeric shapes are rendered; every
 * other server-side shape decodes to {@link UnknownPlot}.
 *
 * @since 1.0
 */
public interface Plot {

  /** The shapes. */
  public static enum Type {
    NUMERIC,
    BUCKETED_NUMERIC,
    UNKNOWN
  }

  /**
   * Visitor over the shapes.
   * @param <T> The return type.
   */
  public static interface Visitor<T> {
    T visitNumeric(final NumericPlot plot);

    T visitBucketedNumeric(final BucketedNumericPlot plot);

    T visitUnknown(final UnknownPlot plot);
  }

  /** @return The shape. */
  public Type type();

  /**
   * @param visitor A non-null visitor.
   * @return The visitor's result.
   */
  public <T> T accept(final Visitor<T> visitor);
}
