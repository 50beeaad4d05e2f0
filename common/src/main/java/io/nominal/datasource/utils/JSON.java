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
package io.nominal.datasource.utils;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Static initialization and configuration of the Jackson ObjectMapper for use
 * throughout the data source. The mapper is thread safe and expensive to
 * build so it's shared.
 * <p>
 * Small POJOs go through the wrappers here. Remote responses are decoded as
 * trees via {@link #getMapper()} so unknown union variants can be handled
 * without mapping exceptions.
 *
 * @since 1.0
 */
public final class JSON {
  /**
   * Jackson de/serializer initialized, configured and shared
   */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    // the compute API may hand back NaN and Infinity for empty buckets.
    jsonMapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
  }

  /**
   * Deserializes a JSON formatted string to a specific class type.
   * @param json The string to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed
   * @throws JSONException if the data could not be read
   */
  public static final <T> T parseToObject(final String json,
                                          final Class<T> pojo) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }

    try {
      return jsonMapper.readValue(json, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e.getOriginalMessage(), e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Parses the string into a tree.
   * @param json The string to parse.
   * @return The root node.
   * @throws IllegalArgumentException if the data was null or empty or could
   * not be parsed.
   */
  public static final JsonNode parseToTree(final String json) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    try {
      return jsonMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e.getOriginalMessage(), e);
    }
  }

  /**
   * Serializes the given object to a JSON string
   * @param object The object to serialize
   * @return A JSON formatted string
   * @throws IllegalArgumentException if the object was null
   * @throws JSONException if the object could not be serialized
   */
  public static final String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return jsonMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Serializes the given object to a JSON byte array
   * @param object The object to serialize
   * @return A JSON formatted byte array
   * @throws IllegalArgumentException if the object was null
   * @throws JSONException if the object could not be serialized
   */
  public static final byte[] serializeToBytes(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return jsonMapper.writeValueAsBytes(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }

  /** @return The shared mapper. Do not reconfigure it. */
  public static final ObjectMapper getMapper() {
    return jsonMapper;
  }
}
