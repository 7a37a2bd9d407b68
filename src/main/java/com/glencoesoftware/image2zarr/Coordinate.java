/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * World coordinate values over one or more named dimensions.
 * Values are stored in row-major order.
 */
public class Coordinate {

  private final ImmutableList<String> dims;
  private final int[] shape;
  private final double[] values;

  /**
   * @param dims dimension names, one per entry in <code>shape</code>
   * @param shape extent of each dimension
   * @param values coordinate values in row-major order
   */
  public Coordinate(List<String> dims, int[] shape, double[] values) {
    if (dims.size() != shape.length) {
      throw new IllegalArgumentException(
        "Dimension names " + dims + " do not match shape " +
        Arrays.toString(shape));
    }
    int size = 1;
    for (int s : shape) {
      size *= s;
    }
    if (size != values.length) {
      throw new IllegalArgumentException("Expected " + size +
        " coordinate values, found " + values.length);
    }
    this.dims = ImmutableList.copyOf(dims);
    this.shape = shape.clone();
    this.values = values.clone();
  }

  /**
   * @return dimension names
   */
  public List<String> getDims() {
    return dims;
  }

  /**
   * @return extent of each dimension
   */
  public int[] getShape() {
    return shape.clone();
  }

  /**
   * @return the number of dimensions
   */
  public int getRank() {
    return shape.length;
  }

  /**
   * @return a copy of the coordinate values in row-major order
   */
  public double[] getValues() {
    return values.clone();
  }

  /**
   * @param index position along a one-dimensional coordinate
   * @return value at the given position
   */
  public double get(int index) {
    return values[index];
  }

  /**
   * Select a single position along a one-dimensional coordinate.
   *
   * @param index position to keep
   * @return a coordinate of length 1 over the same dimension
   */
  public Coordinate narrow(int index) {
    if (getRank() != 1) {
      throw new IllegalStateException(
        "Only one-dimensional coordinates can be narrowed: " + dims);
    }
    return new Coordinate(dims, new int[] {1}, new double[] {values[index]});
  }

  @Override
  public String toString() {
    return "Coordinate" + dims + Arrays.toString(shape);
  }
}
