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
package io.nominal.datasource.auth;

import io.nominal.datasource.query.execution.QueryExecution;

/**
 * A profile lookup that tests complete by hand.
 */
public class MockProfileExecution extends QueryExecution<UserProfile> {
  private boolean cancelled;

  /** @param result A profile or an exception. */
  public void complete(final Object result) {
    callback(result);
  }

  public boolean cancelled() {
    return cancelled;
  }

  @Override
  public void cancel() {
    cancelled = true;
  }
}
