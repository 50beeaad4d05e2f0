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

import java.util.Collections;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import io.nominal.datasource.exceptions.QueryExecutionCanceled;
import io.nominal.datasource.exceptions.QueryExecutionException;

/**
 * The answer to a single query: frames on success or a status and message
 * on failure.
 *
 * @since 1.0
 */
public final class DataResponse {
  private final List<DataFrame> frames;
  private final Status status;
  private final String error;
  private final Throwable exception;

  private DataResponse(final List<DataFrame> frames,
                       final Status status,
                       final String error,
                       final Throwable exception) {
    this.frames = frames;
    this.status = status;
    this.error = error;
    this.exception = exception;
  }

  /**
   * @param frames A non-null list of frames.
   * @return A successful response.
   */
  public static DataResponse ok(final List<DataFrame> frames) {
    if (frames == null) {
      throw new IllegalArgumentException("Frames cannot be null.");
    }
    return new DataResponse(ImmutableList.copyOf(frames), Status.OK, null,
        null);
  }

  /**
   * @param frame A non-null frame.
   * @return A successful response with one frame.
   */
  public static DataResponse ok(final DataFrame frame) {
    return ok(ImmutableList.of(frame));
  }

  /**
   * @param status A non-null, non-OK status.
   * @param error A non-null message.
   * @return An error response.
   */
  public static DataResponse error(final Status status, final String error) {
    return error(status, error, null);
  }

  /**
   * @param status A non-null, non-OK status.
   * @param error A non-null message.
   * @param exception An optional cause.
   * @return An error response.
   */
  public static DataResponse error(final Status status,
                                   final String error,
                                   final Throwable exception) {
    if (status == null || status == Status.OK) {
      throw new IllegalArgumentException("Status must be a failure: " + status);
    }
    if (error == null) {
      throw new IllegalArgumentException("Error cannot be null.");
    }
    return new DataResponse(Collections.<DataFrame>emptyList(), status, error,
        exception);
  }

  /**
   * Builds an error response from an exception, using its status code when
   * it is a {@link QueryExecutionException} and mapping cancellations.
   * @param prefix A message prefix, may be null.
   * @param t A non-null exception.
   * @return An error response.
   */
  public static DataResponse fromException(final String prefix,
                                           final Throwable t) {
    final Status status;
    if (t instanceof QueryExecutionCanceled) {
      status = ((QueryExecutionCanceled) t).getStatusCode() ==
          Status.TIMEOUT.code() ? Status.TIMEOUT : Status.CANCELLED;
    } else if (t instanceof QueryExecutionException &&
        ((QueryExecutionException) t).getStatusCode() > 0) {
      final Status mapped = Status.fromCode(
          ((QueryExecutionException) t).getStatusCode());
      status = mapped == Status.OK ? Status.INTERNAL : mapped;
    } else {
      status = Status.INTERNAL;
    }
    final String message = prefix == null ? t.getMessage()
        : prefix + t.getMessage();
    return error(status, message, t);
  }

  public List<DataFrame> frames() {
    return frames;
  }

  public Status status() {
    return status;
  }

  /** @return The error message, null on success. */
  public String error() {
    return error;
  }

  /** @return The cause, may be null. */
  public Throwable exception() {
    return exception;
  }

  public boolean isError() {
    return status != Status.OK;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("status", status)
        .add("error", error)
        .add("frames", frames.size())
        .toString();
  }
}
