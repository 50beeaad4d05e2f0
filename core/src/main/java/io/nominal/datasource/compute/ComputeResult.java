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

import com.google.common.base.MoreObjects;

/**
 * The outcome of one compute subrequest. Results are positional: the i-th
 * result of a batch call answers the i-th request. The set of variants is
 * closed; server variants this client doesn't know land in {@link Unknown}.
 *
 * @since 1.0
 */
public abstract class ComputeResult {

  /** The variants. */
  public static enum Type {
    SUCCESS,
    ERROR,
    UNKNOWN
  }

  /**
   * Visitor over the variants.
   * @param <T> The return type.
   */
  public static interface Visitor<T> {
    T visitSuccess(final Plot plot);

    T visitError(final String error_type, final String code);

    T visitUnknown(final String type_name);
  }

  private ComputeResult() {
  }

  /** @return The variant. */
  public abstract Type type();

  /**
   * Dispatches to the matching visitor method.
   * @param visitor A non-null visitor.
   * @return The visitor's result.
   */
  public abstract <T> T accept(final Visitor<T> visitor);

  public static ComputeResult success(final Plot plot) {
    if (plot == null) {
      throw new IllegalArgumentException("Plot cannot be null.");
    }
    return new Success(plot);
  }

  public static ComputeResult error(final String error_type, final String code) {
    return new Error(error_type, code);
  }

  public static ComputeResult unknown(final String type_name) {
    return new Unknown(type_name);
  }

  static final class Success extends ComputeResult {
    private final Plot plot;

    Success(final Plot plot) {
      this.plot = plot;
    }

    @Override
    public Type type() {
      return Type.SUCCESS;
    }

    @Override
    public <T> T accept(final Visitor<T> visitor) {
      return visitor.visitSuccess(plot);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("plot", plot.type())
          .toString();
    }
  }

  static final class Error extends ComputeResult {
    private final String error_type;
    private final String code;

    Error(final String error_type, final String code) {
      this.error_type = error_type;
      this.code = code;
    }

    @Override
    public Type type() {
      return Type.ERROR;
    }

    @Override
    public <T> T accept(final Visitor<T> visitor) {
      return visitor.visitError(error_type, code);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("errorType", error_type)
          .add("code", code)
          .toString();
    }
  }

  static final class Unknown extends ComputeResult {
    private final String type_name;

    Unknown(final String type_name) {
      this.type_name = type_name;
    }

    @Override
    public Type type() {
      return Type.UNKNOWN;
    }

    @Override
    public <T> T accept(final Visitor<T> visitor) {
      return visitor.visitUnknown(type_name);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("type", type_name)
          .toString();
    }
  }
}
