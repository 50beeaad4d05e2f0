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

/**
 * Per-query response status as reported to the dashboard host.
 *
 * @since 1.0
 */
public enum Status {
  OK(200),
  BAD_REQUEST(400),
  CANCELLED(499),
  INTERNAL(500),
  TIMEOUT(504);

  private final int code;

  Status(final int code) {
    this.code = code;
  }

  /** @return The HTTP style code. */
  public int code() {
    return code;
  }

  /**
   * Maps an HTTP style code to a status. Unmapped 4xx codes are bad requests,
   * everything else unmapped is internal.
   * @param code The code.
   * @return A non-null status.
   */
  public static Status fromCode(final int code) {
    for (final Status status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    if (code >= 400 && code < 500) {
      return BAD_REQUEST;
    }
    return INTERNAL;
  }
}
