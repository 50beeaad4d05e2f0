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

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.Lists;

/**
 * Substitutes dashboard template variables into query fields. Both
 * <code>${name}</code> and {@code $name} forms are replaced, for every key
 * in the variable map. Keys are applied longest first so a variable
 * {@code $asset} doesn't clobber the prefix of {@code $assetName}.
 * <p>
 * Null values are skipped, leaving the marker in place for validation to
 * report.
 *
 * @since 1.0
 */
public class TemplateInterpolator {

  /**
   * Interpolates the asset RID, channel, data scope and query text of the
   * model.
   * @param model A non-null model.
   * @return The given model if it has no variables, otherwise a new model.
   */
  public QueryModel interpolate(final QueryModel model) {
    if (model == null) {
      throw new IllegalArgumentException("Model cannot be null.");
    }
    final Map<String, Object> variables = model.templateVariables();
    if (variables == null || variables.isEmpty()) {
      return model;
    }
    return model.toBuilder()
        .setAssetRid(interpolate(model.assetRid(), variables))
        .setChannel(interpolate(model.channel(), variables))
        .setDataScopeName(interpolate(model.dataScopeName(), variables))
        .setQueryText(interpolate(model.queryText(), variables))
        .build();
  }

  /**
   * Interpolates a single string.
   * @param input The input, may be null.
   * @param variables The variables, may be null.
   * @return The input with all known markers replaced. Null if the input was
   * null.
   */
  public String interpolate(final String input,
                            final Map<String, Object> variables) {
    if (input == null || input.isEmpty() ||
        variables == null || variables.isEmpty()) {
      return input;
    }
    final List<Entry<String, Object>> entries =
        Lists.newArrayList(variables.entrySet());
    entries.sort((a, b) -> b.getKey().length() - a.getKey().length());

    String result = input;
    for (final Entry<String, Object> entry : entries) {
      if (entry.getKey() == null || entry.getKey().isEmpty() ||
          entry.getValue() == null) {
        continue;
      }
      final String value = stringify(entry.getValue());
      result = result.replace("${" + entry.getKey() + "}", value);
      result = result.replace("$" + entry.getKey(), value);
    }
    return result;
  }

  /**
   * Renders a variable value. Integral numbers are printed without a
   * fractional part.
   * @param value A non-null value.
   * @return The string form.
   */
  static String stringify(final Object value) {
    if (value instanceof String) {
      return (String) value;
    }
    if (value instanceof Double || value instanceof Float) {
      final double d = ((Number) value).doubleValue();
      if (!Double.isInfinite(d) && d == Math.rint(d) &&
          Math.abs(d) < 1e15) {
        return Long.toString((long) d);
      }
    }
    return String.valueOf(value);
  }
}
