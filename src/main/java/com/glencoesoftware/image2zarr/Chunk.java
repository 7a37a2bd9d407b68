/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.util.Arrays;

import com.bc.zarr.DataType;

/**
 * Block of pixel values read from an {@link ImageArtifact}, stored
 * in row-major order in a primitive array matching the data type.
 */
public class Chunk {

  private final DataType dataType;
  private final int[] shape;
  private final Object storage;

  /**
   * @param dataType element type
   * @param shape extent of each axis
   * @param storage primitive array of the matching type and total size
   */
  public Chunk(DataType dataType, int[] shape, Object storage) {
    this.dataType = dataType;
    this.shape = shape.clone();
    this.storage = storage;
  }

  /**
   * Allocate an empty chunk.
   *
   * @param dataType element type
   * @param shape extent of each axis
   * @return a zero-filled chunk
   */
  public static Chunk allocate(DataType dataType, int[] shape) {
    return new Chunk(dataType, shape,
      ZarrTypes.allocate(dataType, size(shape)));
  }

  /**
   * @param shape extent of each axis
   * @return product of all extents
   */
  public static int size(int[] shape) {
    int size = 1;
    for (int s : shape) {
      size *= s;
    }
    return size;
  }

  /**
   * @return element type
   */
  public DataType getDataType() {
    return dataType;
  }

  /**
   * @return extent of each axis
   */
  public int[] getShape() {
    return shape.clone();
  }

  /**
   * @return total number of elements
   */
  public int getSize() {
    return size(shape);
  }

  /**
   * @return backing primitive array
   */
  public Object getStorage() {
    return storage;
  }

  /**
   * @param index row-major element index
   * @return element widened to double
   */
  public double getDouble(int index) {
    switch (dataType) {
      case i1:
        return ((byte[]) storage)[index];
      case u1:
        return ((byte[]) storage)[index] & 0xff;
      case i2:
        return ((short[]) storage)[index];
      case u2:
        return ((short[]) storage)[index] & 0xffff;
      case i4:
        return ((int[]) storage)[index];
      case u4:
        return ((int[]) storage)[index] & 0xffffffffL;
      case f4:
        return ((float[]) storage)[index];
      case f8:
        return ((double[]) storage)[index];
      default:
        throw new IllegalArgumentException(
            "Unsupported data type: " + dataType);
    }
  }

  @Override
  public String toString() {
    return "Chunk[" + dataType + ", " + Arrays.toString(shape) + "]";
  }
}
