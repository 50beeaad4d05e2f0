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
package io.nominal.datasource.configuration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestConfigurationEntrySchema {

  @Test
  public void builder() throws Exception {
    final ConfigurationEntrySchema schema = ConfigurationEntrySchema.newBuilder()
        .setKey("my.key")
        .setType(Long.class)
        .setDefaultValue(42L)
        .setDescription("Desc")
        .setSource("unit")
        .isDynamic()
        .build();
    assertEquals("my.key", schema.getKey());
    assertEquals(Long.class, schema.getType());
    assertEquals(42L, schema.getDefaultValue());
    assertEquals("Desc", schema.getDescription());
    assertEquals("unit", schema.getSource());
    assertTrue(schema.isDynamic());

    try {
      ConfigurationEntrySchema.newBuilder()
          .setKey("my.key")
          .setType(Long.class)
          .setDefaultValue("not a long")
          .setDescription("Desc")
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ConfigurationEntrySchema.newBuilder()
          .setKey("my.key")
          .setDescription("Desc")
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void convert() throws Exception {
    assertEquals(" raw ", schema(String.class).convert(" raw "));
    assertEquals(12, schema(Integer.class).convert(" 12"));
    assertEquals(12L, schema(Long.class).convert("12"));
    assertEquals(1.5, (Double) schema(Double.class).convert("1.5"), 0.0001);
    assertEquals(true, schema(Boolean.class).convert("TRUE"));
    assertEquals(true, schema(Boolean.class).convert("1"));
    assertEquals(false, schema(Boolean.class).convert("no"));
    assertNull(schema(Integer.class).convert(null));
    assertFalse(schema(String.class).isDynamic());

    try {
      schema(Integer.class).convert("1.5");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }

    try {
      schema(StringBuilder.class).convert("foo");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  private static ConfigurationEntrySchema schema(final Class<?> type) {
    return ConfigurationEntrySchema.newBuilder()
        .setKey("my.key")
        .setType(type)
        .setDescription("Desc")
        .build();
  }
}
