/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import lombok.NonNull;
import runscope.common.models.FieldDataType;
import runscope.common.models.FlattenedField;

/**
 * Flattens nested run JSON (config, system metadata) into dot-path leaves.
 *
 * <p>Objects are recursed into; arrays are never expanded and are kept as a single leaf. A scalar
 * passed at the top level only yields an entry when a prefix is given to key it under.
 */
public final class JsonFlattener {
  private JsonFlattener() {}

  /** Config keys under these prefixes were imported from another tracker and are not indexed. */
  public static final List<String> IMPORTED_KEY_PREFIXES = ImmutableList.of("sys/", "source_code/");

  private static final Pattern ISO_DATE =
      Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}");

  public static Map<String, JsonNode> flatten(@Nullable final JsonNode json) {
    return flatten(json, "");
  }

  public static Map<String, JsonNode> flatten(
      @Nullable final JsonNode json, @NonNull final String prefix) {
    final Map<String, JsonNode> result = new LinkedHashMap<>();
    flattenInto(json, prefix, result);
    return result;
  }

  private static void flattenInto(
      @Nullable final JsonNode json, final String prefix, final Map<String, JsonNode> result) {
    if (json == null || json.isNull() || json.isMissingNode()) {
      return;
    }
    if (!json.isObject()) {
      if (!prefix.isEmpty()) {
        result.put(prefix, json);
      }
      return;
    }
    final Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      final String key = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
      if (field.getValue().isObject()) {
        flattenInto(field.getValue(), key, result);
      } else {
        result.put(key, field.getValue());
      }
    }
  }

  /** Flattens and types every leaf, optionally skipping imported key prefixes. */
  public static List<FlattenedField> flattenFields(
      @Nullable final JsonNode json, final boolean skipImportedKeys) {
    final ImmutableList.Builder<FlattenedField> fields = ImmutableList.builder();
    for (Map.Entry<String, JsonNode> leaf : flatten(json).entrySet()) {
      if (skipImportedKeys && isImportedKey(leaf.getKey())) {
        continue;
      }
      fields.add(new FlattenedField(leaf.getKey(), leaf.getValue(), inferType(leaf.getValue())));
    }
    return fields.build();
  }

  public static boolean isImportedKey(@NonNull final String key) {
    return IMPORTED_KEY_PREFIXES.stream().anyMatch(key::startsWith);
  }

  public static FieldDataType inferType(@NonNull final JsonNode value) {
    if (value.isNumber()) {
      return FieldDataType.NUMBER;
    }
    if (value.isTextual() && ISO_DATE.matcher(value.textValue()).find()) {
      return FieldDataType.DATE;
    }
    return FieldDataType.TEXT;
  }
}
