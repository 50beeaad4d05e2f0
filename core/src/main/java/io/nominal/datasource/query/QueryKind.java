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
package io.nominal.datasource.query;

/**
 * How a decoded query is serviced.
 *
 * @since 1.0
 */
public enum QueryKind {
  /** Verifies credentials against the authentication service. */
  CONNECTION_TEST,

  /** Legacy: a synthetic two point series derived from a constant. */
  LEGACY_CONSTANT,

  /** Legacy: free text with no backing data, answered like a constant. */
  LEGACY_TEXT,

  /** A channel on an asset, batched to the compute service. */
  ASSET_CHANNEL;

  /** @return Whether or not the query goes through the batch path. */
  public boolean isBatchable() {
    return this == ASSET_CHANNEL;
  }
}
