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
package io.nominal.datasource.core;

import com.google.common.base.MoreObjects;

/**
 * The outcome of a data source health check.
 *
 * @since 1.0
 */
public final class CheckHealthResult {

  public static enum HealthStatus {
    OK,
    ERROR
  }

  private final HealthStatus status;
  private final String message;

  private CheckHealthResult(final HealthStatus status, final String message) {
    this.status = status;
    this.message = message;
  }

  public static CheckHealthResult ok(final String message) {
    return new CheckHealthResult(HealthStatus.OK, message);
  }

  public static CheckHealthResult error(final String message) {
    return new CheckHealthResult(HealthStatus.ERROR, message);
  }

  public HealthStatus status() {
    return status;
  }

  public String message() {
    return message;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("status", status)
        .add("message", message)
        .toString();
  }
}
