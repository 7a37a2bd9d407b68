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
import java.util.Set;

/**
 * Named world coordinates for every axis of an image.  Celestial axes
 * share multi-dimensional coordinates over synthetic dimensions
 * ("d0", "d1"); every other axis has a one-dimensional coordinate named
 * after its own dimension.
 */
public class CoordinateSet {

  private final Map<String, Coordinate> coordinates;

  /**
   * @param coordinates coordinates keyed by name, in insertion order
   */
  public CoordinateSet(Map<String, Coordinate> coordinates) {
    this.coordinates = Collections.unmodifiableMap(
      new LinkedHashMap<String, Coordinate>(coordinates));
  }

  /**
   * @param name coordinate name
   * @return the named coordinate, or null if there is no such coordinate
   */
  public Coordinate get(String name) {
    return coordinates.get(name);
  }

  /**
   * @return coordinate names in insertion order
   */
  public Set<String> names() {
    return coordinates.keySet();
  }

  /**
   * A coordinate is a dimension coordinate if it is one-dimensional and
   * its only dimension has the same name as the coordinate.
   *
   * @param name coordinate name
   * @return true if the named coordinate indexes its own dimension
   */
  public boolean isDimensionCoordinate(String name) {
    Coordinate c = coordinates.get(name);
    return c != null && c.getRank() == 1 && name.equals(c.getDims().get(0));
  }

  /**
   * Copy this set with one coordinate narrowed to a single position.
   *
   * @param name one-dimensional coordinate to narrow
   * @param index position to keep
   * @return a new coordinate set
   */
  public CoordinateSet narrow(String name, int index) {
    Coordinate c = coordinates.get(name);
    if (c == null) {
      throw new IllegalArgumentException("No coordinate named " + name);
    }
    Map<String, Coordinate> copy =
      new LinkedHashMap<String, Coordinate>(coordinates);
    copy.put(name, c.narrow(index));
    return new CoordinateSet(copy);
  }

  @Override
  public String toString() {
    return coordinates.toString();
  }
}
