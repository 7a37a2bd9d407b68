/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr.fits;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import loci.common.RandomAccessInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyword values from the primary header of a FITS file.
 */
public class FitsHeader {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(FitsHeader.class);

  // -- Constants --

  /** Size of a header or data block in bytes. */
  public static final int BLOCK_SIZE = 2880;

  /** Size of a header card in bytes. */
  public static final int CARD_SIZE = 80;

  private static final String VALUE_INDICATOR = "= ";

  // -- Fields --

  private final Map<String, Object> values;
  private final long dataOffset;

  // -- Constructor --

  /**
   * @param values keyword values in header order
   * @param dataOffset offset of the first data byte
   */
  public FitsHeader(Map<String, Object> values, long dataOffset) {
    this.values =
      Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
    this.dataOffset = dataOffset;
  }

  // -- FitsHeader API methods --

  /**
   * Parse the primary header starting at the beginning of the stream.
   *
   * @param in open stream
   * @return parsed header
   * @throws IOException if the stream is not a FITS file or the header is
   *         truncated
   */
  public static FitsHeader read(RandomAccessInputStream in)
    throws IOException
  {
    in.seek(0);
    Map<String, Object> values = new LinkedHashMap<String, Object>();
    byte[] block = new byte[BLOCK_SIZE];
    long offset = 0;
    boolean end = false;
    while (!end) {
      if (offset + BLOCK_SIZE > in.length()) {
        throw new IOException("Truncated FITS header: no END card");
      }
      in.readFully(block);
      offset += BLOCK_SIZE;
      String text = new String(block, StandardCharsets.US_ASCII);
      for (int c=0; c<BLOCK_SIZE; c+=CARD_SIZE) {
        String card = text.substring(c, c + CARD_SIZE);
        String keyword = card.substring(0, 8).trim();
        if (offset == BLOCK_SIZE && c == 0 && !keyword.equals("SIMPLE")) {
          throw new IOException("Not a FITS file: first keyword is '" +
            keyword + "'");
        }
        if (keyword.equals("END")) {
          end = true;
          break;
        }
        if (keyword.isEmpty() ||
          !card.substring(8, 10).equals(VALUE_INDICATOR))
        {
          continue;
        }
        Object value = parseValue(card.substring(10));
        if (value != null) {
          values.put(keyword, value);
        }
      }
    }
    LOGGER.debug("Read {} header keywords, data at {}", values.size(), offset);
    return new FitsHeader(values, offset);
  }

  /**
   * Parse the value field of a header card.
   *
   * @param field card contents after the value indicator
   * @return String, Boolean, Long, Double, or null for an undefined value
   */
  static Object parseValue(String field) {
    String s = field.trim();
    if (s.startsWith("'")) {
      StringBuilder sb = new StringBuilder();
      int i = 1;
      while (i < s.length()) {
        char c = s.charAt(i);
        if (c == '\'') {
          if (i + 1 < s.length() && s.charAt(i + 1) == '\'') {
            sb.append('\'');
            i += 2;
            continue;
          }
          break;
        }
        sb.append(c);
        i++;
      }
      // trailing spaces are not significant in FITS strings
      int len = sb.length();
      while (len > 0 && sb.charAt(len - 1) == ' ') {
        len--;
      }
      return sb.substring(0, len);
    }

    int comment = s.indexOf('/');
    if (comment >= 0) {
      s = s.substring(0, comment).trim();
    }
    if (s.isEmpty()) {
      return null;
    }
    if (s.equals("T")) {
      return Boolean.TRUE;
    }
    if (s.equals("F")) {
      return Boolean.FALSE;
    }
    try {
      return Long.parseLong(s.startsWith("+") ? s.substring(1) : s);
    }
    catch (NumberFormatException e) {
      LOGGER.trace("Not an integer: {}", s);
    }
    try {
      return Double.parseDouble(s.replace('D', 'E').replace('d', 'e'));
    }
    catch (NumberFormatException e) {
      LOGGER.trace("Not a real number: {}", s);
    }
    return s;
  }

  /**
   * @return offset of the first data byte, aligned to a block boundary
   */
  public long getDataOffset() {
    return dataOffset;
  }

  /**
   * @return all keyword values in header order
   */
  public Map<String, Object> getValues() {
    return values;
  }

  /**
   * @param keyword header keyword
   * @return true if the keyword has a defined value
   */
  public boolean containsKey(String keyword) {
    return values.containsKey(keyword);
  }

  /**
   * @param keyword required integer keyword
   * @return keyword value
   * @throws IOException if the keyword is missing or not an integer
   */
  public int getInt(String keyword) throws IOException {
    Object value = values.get(keyword);
    if (!(value instanceof Long)) {
      throw new IOException("Missing or invalid " + keyword + ": " + value);
    }
    return ((Long) value).intValue();
  }

  /**
   * @param keyword numeric keyword
   * @param defaultValue value to use if the keyword is missing
   * @return keyword value
   */
  public double getDouble(String keyword, double defaultValue) {
    Object value = values.get(keyword);
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    return defaultValue;
  }

  /**
   * @param keyword string keyword
   * @param defaultValue value to use if the keyword is missing
   * @return keyword value
   */
  public String getString(String keyword, String defaultValue) {
    Object value = values.get(keyword);
    return value == null ? defaultValue : value.toString();
  }

}
