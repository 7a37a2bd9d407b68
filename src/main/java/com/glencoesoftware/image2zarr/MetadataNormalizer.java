/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens an artifact's summary metadata and diagnostic messages into a
 * single attribute mapping.
 */
public class MetadataNormalizer {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(MetadataNormalizer.class);

  /** Summary keys describing structure that is stored elsewhere. */
  public static final Set<String> OMITTED_KEYS =
    Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
      "axisnames", "incr", "ndim", "refpix", "refval",
      "shape", "tileshape", "messages")));

  /** Separator between a diagnostic label and its value. */
  private static final String MESSAGE_SEPARATOR = ": ";

  /** Separator used for flattened nested keys. */
  public static final String KEY_SEPARATOR = ".";

  /**
   * Build the attribute mapping for an artifact.
   *
   * @param summary summary metadata
   * @param messages diagnostic messages
   * @return flattened attributes in insertion order
   */
  public Map<String, Object> normalize(
    Map<String, SummaryValue> summary, List<String> messages)
  {
    Map<String, Object> attrs = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, SummaryValue> entry : summary.entrySet()) {
      String key = entry.getKey();
      if (OMITTED_KEYS.contains(key)) {
        continue;
      }
      SummaryValue value = entry.getValue();
      if (value.isNested()) {
        attrs.put(key, flatten(
          ((SummaryValue.Nested) value).getEntries(), KEY_SEPARATOR));
      }
      else {
        attrs.put(key.toLowerCase(), value.getValue());
      }
    }

    for (String message : messages) {
      attrs.putAll(parseMessage(message));
    }
    return attrs;
  }

  /**
   * Extract "label: value" pairs from a multi-line diagnostic message.
   * Each line is lower-cased and split on its first colon; the label has
   * spaces replaced by underscores.  Lines without a ": " separator are
   * ignored.
   *
   * @param message diagnostic message
   * @return parsed pairs; later lines replace earlier ones
   */
  public static Map<String, String> parseMessage(String message) {
    Map<String, String> pairs = new LinkedHashMap<String, String>();
    for (String line : message.toLowerCase().split("\n")) {
      if (!line.contains(MESSAGE_SEPARATOR)) {
        LOGGER.trace("Ignoring message line '{}'", line);
        continue;
      }
      int colon = line.indexOf(':');
      String key = line.substring(0, colon).trim().replace(' ', '_');
      String value = line.substring(colon + 1).trim();
      pairs.put(key, value);
    }
    return pairs;
  }

  /**
   * Flatten nested mappings into a single level, joining keys with the
   * given separator.  A mapping without nested values is returned
   * unchanged.
   *
   * @param map mapping that may contain nested mappings or
   *            {@link SummaryValue} instances
   * @param separator key separator
   * @return flat mapping in insertion order
   */
  public static Map<String, Object> flatten(
    Map<String, ?> map, String separator)
  {
    Map<String, Object> flat = new LinkedHashMap<String, Object>();
    flatten(null, map, separator, flat);
    return flat;
  }

  private static void flatten(String prefix, Map<?, ?> map,
    String separator, Map<String, Object> flat)
  {
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      String name = String.valueOf(entry.getKey());
      String key = prefix == null ? name : prefix + separator + name;
      Object value = entry.getValue();
      if (value instanceof SummaryValue.Nested) {
        flatten(key, ((SummaryValue.Nested) value).getEntries(),
          separator, flat);
      }
      else if (value instanceof SummaryValue) {
        flat.put(key, ((SummaryValue) value).getValue());
      }
      else if (value instanceof Map) {
        flatten(key, (Map<?, ?>) value, separator, flat);
      }
      else {
        flat.put(key, value);
      }
    }
  }

}
