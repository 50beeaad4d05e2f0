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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.net.ConnectException;
import java.time.Instant;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import io.nominal.datasource.exceptions.QueryExecutionCanceled;
import io.nominal.datasource.exceptions.QueryExecutionException;
import io.nominal.datasource.exceptions.RemoteQueryExecutionException;

public class TestDataResponse {

  @Test
  public void ok() throws Exception {
    final DataFrame frame = new DataFrame("speed", ImmutableList.<Field<?>>of(
        Field.time("time", ImmutableList.of(Instant.EPOCH)),
        Field.number("value", ImmutableList.of(42.0))));
    final DataResponse response = DataResponse.ok(frame);
    assertFalse(response.isError());
    assertEquals(Status.OK, response.status());
    assertNull(response.error());
    assertNull(response.exception());
    assertSame(frame, response.frames().get(0));
    assertNull(frame.field("nosuch"));
    assertEquals(1, frame.field("value").size());

    try {
      DataResponse.ok((List<DataFrame>) null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void error() throws Exception {
    final Exception cause = new IllegalStateException("Boo!");
    final DataResponse response = DataResponse.error(Status.BAD_REQUEST,
        "Bad query", cause);
    assertTrue(response.isError());
    assertEquals(Status.BAD_REQUEST, response.status());
    assertEquals("Bad query", response.error());
    assertSame(cause, response.exception());
    assertTrue(response.frames().isEmpty());

    try {
      DataResponse.error(Status.OK, "fine");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DataResponse.error(null, "fine");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DataResponse.error(Status.INTERNAL, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void fromException() throws Exception {
    DataResponse response = DataResponse.fromException(null,
        new QueryExecutionCanceled("Timed out", 504));
    assertEquals(Status.TIMEOUT, response.status());
    assertEquals("Timed out", response.error());

    response = DataResponse.fromException(null,
        new QueryExecutionCanceled("Cancelled", 499));
    assertEquals(Status.CANCELLED, response.status());

    response = DataResponse.fromException("Batch compute failed: ",
        new RemoteQueryExecutionException("Unauthorized", "host", 401));
    assertEquals(Status.BAD_REQUEST, response.status());
    assertEquals("Batch compute failed: Unauthorized", response.error());

    response = DataResponse.fromException(null,
        new QueryExecutionException("Weird", 200));
    assertEquals(Status.INTERNAL, response.status());

    response = DataResponse.fromException(null,
        new QueryExecutionException("Unset", 0));
    assertEquals(Status.INTERNAL, response.status());

    response = DataResponse.fromException(null,
        new ConnectException("Connection refused"));
    assertEquals(Status.INTERNAL, response.status());
    assertEquals("Connection refused", response.error());
  }

  @Test
  public void statusCodes() throws Exception {
    assertEquals(200, Status.OK.code());
    assertEquals(499, Status.CANCELLED.code());
    assertEquals(Status.TIMEOUT, Status.fromCode(504));
    assertEquals(Status.BAD_REQUEST, Status.fromCode(404));
    assertEquals(Status.BAD_REQUEST, Status.fromCode(429));
    assertEquals(Status.INTERNAL, Status.fromCode(503));
    assertEquals(Status.INTERNAL, Status.fromCode(302));
  }

  @Test
  public void queryDataResponse() throws Exception {
    final QueryDataResponse response = new QueryDataResponse();
    response.put("A", DataResponse.error(Status.INTERNAL, "Boo!"));
    assertEquals(1, response.size());
    assertEquals("Boo!", response.get("A").error());
    assertNull(response.get("B"));

    try {
      response.put("", DataResponse.error(Status.INTERNAL, "Boo!"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      response.put("B", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      response.responses().put("C", DataResponse.error(Status.INTERNAL, "x"));
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }

  @Test
  public void fields() throws Exception {
    final Field<String> field = Field.string("status",
        ImmutableList.of("success"));
    assertEquals("status", field.name());
    assertEquals(String.class, field.type());
    assertEquals("success", field.values().get(0));

    try {
      Field.number("", ImmutableList.of(1.0));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Field.number("value", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
