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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * Snapshot of one artifact's structure: coordinates, shape, dimension
 * names and flattened attributes.
 */
public class ArtifactMetadata {

  private final CoordinateSet coordinates;
  private final int[] shape;
  private final ImmutableList<String> dims;
  private final Map<String, Object> attributes;

  /**
   * @param coordinates world coordinates for every axis
   * @param shape extent of each axis
   * @param dims dimension name of each axis
   * @param attributes flattened attributes
   */
  public ArtifactMetadata(CoordinateSet coordinates, int[] shape,
    List<String> dims, Map<String, Object> attributes)
  {
    this.coordinates = coordinates;
    this.shape = shape.clone();
    this.dims = ImmutableList.copyOf(dims);
    this.attributes = Collections.unmodifiableMap(
      new LinkedHashMap<String, Object>(attributes));
  }

  /**
   * @return world coordinates
   */
  public CoordinateSet getCoordinates() {
    return coordinates;
  }

  /**
   * @return extent of each axis
   */
  public int[] getShape() {
    return shape.clone();
  }

  /**
   * @return dimension name of each axis
   */
  public List<String> getDims() {
    return dims;
  }

  /**
   * @return flattened attributes
   */
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  /**
   * @param dimension dimension name
   * @return axis index of the named dimension
   * @throws IllegalArgumentException if there is no such dimension
   */
  public int getAxis(String dimension) {
    int axis = dims.indexOf(dimension);
    if (axis < 0) {
      throw new IllegalArgumentException(
        "No " + dimension + " dimension in " + dims);
    }
    return axis;
  }

  /**
   * Compare shapes only; coordinate values are not considered.
   *
   * @param other snapshot to compare against
   * @return true if both snapshots have the same shape
   */
  public boolean hasSameShape(ArtifactMetadata other) {
    return Arrays.equals(shape, other.shape);
  }

  @Override
  public String toString() {
    return "ArtifactMetadata" + dims + Arrays.toString(shape);
  }
}
