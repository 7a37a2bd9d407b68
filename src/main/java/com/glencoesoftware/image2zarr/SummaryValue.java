/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single value in an artifact's summary metadata.  Values are either
 * scalars (numbers, booleans and numeric arrays), text (strings and string
 * arrays) or nested mappings of further summary values.
 */
public abstract class SummaryValue {

  /**
   * @return the wrapped value; nested values return a map of plain values
   */
  public abstract Object getValue();

  /**
   * @return true if this value is a nested mapping
   */
  public boolean isNested() {
    return false;
  }

  /**
   * @param value number, boolean or primitive array
   * @return scalar summary value
   */
  public static SummaryValue scalar(Object value) {
    return new Scalar(value);
  }

  /**
   * @param value string or string array
   * @return text summary value
   */
  public static SummaryValue text(Object value) {
    return new Text(value);
  }

  /**
   * @param entries nested summary values
   * @return nested summary value
   */
  public static SummaryValue nested(Map<String, SummaryValue> entries) {
    return new Nested(entries);
  }

  @Override
  public String toString() {
    return String.valueOf(getValue());
  }

  /** Numeric or boolean value, possibly an array. */
  public static final class Scalar extends SummaryValue {
    private final Object value;

    private Scalar(Object value) {
      this.value = value;
    }

    @Override
    public Object getValue() {
      return value;
    }
  }

  /** String value, possibly an array. */
  public static final class Text extends SummaryValue {
    private final Object value;

    private Text(Object value) {
      this.value = value;
    }

    @Override
    public Object getValue() {
      return value;
    }
  }

  /** Mapping of further summary values. */
  public static final class Nested extends SummaryValue {
    private final Map<String, SummaryValue> entries;

    private Nested(Map<String, SummaryValue> entries) {
      this.entries = Collections.unmodifiableMap(
        new LinkedHashMap<String, SummaryValue>(entries));
    }

    /**
     * @return the nested summary values, in insertion order
     */
    public Map<String, SummaryValue> getEntries() {
      return entries;
    }

    @Override
    public Object getValue() {
      Map<String, Object> plain = new LinkedHashMap<String, Object>();
      for (Map.Entry<String, SummaryValue> e : entries.entrySet()) {
        plain.put(e.getKey(), e.getValue().getValue());
      }
      return plain;
    }

    @Override
    public boolean isNested() {
      return true;
    }
  }
}
