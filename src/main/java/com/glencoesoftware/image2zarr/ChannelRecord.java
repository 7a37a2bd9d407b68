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
 * Everything written to an output store for one frequency channel:
 * one labeled array per artifact type, the coordinates narrowed to the
 * channel, and the store attributes (first channel only).
 */
public class ChannelRecord {

  private final Map<String, LabeledArray> variables;
  private final CoordinateSet coordinates;
  private final Map<String, Object> attributes;

  /**
   * @param variables data variables keyed by name
   * @param coordinates coordinates for this channel
   * @param attributes store attributes, empty unless this record
   *                   creates the store
   */
  public ChannelRecord(Map<String, LabeledArray> variables,
    CoordinateSet coordinates, Map<String, Object> attributes)
  {
    this.variables = Collections.unmodifiableMap(
      new LinkedHashMap<String, LabeledArray>(variables));
    this.coordinates = coordinates;
    this.attributes = Collections.unmodifiableMap(
      new LinkedHashMap<String, Object>(attributes));
  }

  /**
   * @return data variables keyed by name
   */
  public Map<String, LabeledArray> getVariables() {
    return variables;
  }

  /**
   * @return coordinates for this channel
   */
  public CoordinateSet getCoordinates() {
    return coordinates;
  }

  /**
   * @return store attributes
   */
  public Map<String, Object> getAttributes() {
    return attributes;
  }
}
