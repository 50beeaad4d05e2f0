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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;

/**
 * One compute subrequest: a node evaluated over a time range within a
 * variable context. Many of these are sent in a single batch call.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "start", "end", "node", "context" })
public final class ComputeNodeRequest {
  private final Timestamp start;
  private final Timestamp end;
  private final ComputableNode node;
  private final ComputeContext context;

  protected ComputeNodeRequest(final Builder builder) {
    if (builder.start == null) {
      throw new IllegalArgumentException("Start cannot be null.");
    }
    if (builder.end == null) {
      throw new IllegalArgumentException("End cannot be null.");
    }
    if (builder.node == null) {
      throw new IllegalArgumentException("Node cannot be null.");
    }
    if (builder.context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    start = builder.start;
    end = builder.end;
    node = builder.node;
    context = builder.context;
  }

  @JsonProperty("start")
  public Timestamp start() {
    return start;
  }

  @JsonProperty("end")
  public Timestamp end() {
    return end;
  }

  @JsonProperty("node")
  public ComputableNode node() {
    return node;
  }

  @JsonProperty("context")
  public ComputeContext context() {
    return context;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("start", start)
        .add("end", end)
        .add("variables", context.variables())
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private Timestamp start;
    private Timestamp end;
    private ComputableNode node;
    private ComputeContext context;

    public Builder setStart(final Timestamp start) {
      this.start = start;
      return this;
    }

    public Builder setEnd(final Timestamp end) {
      this.end = end;
      return this;
    }

    public Builder setNode(final ComputableNode node) {
      this.node = node;
      return this;
    }

    public Builder setContext(final ComputeContext context) {
      this.context = context;
      return this;
    }

    public ComputeNodeRequest build() {
      return new ComputeNodeRequest(this);
    }
  }
}
