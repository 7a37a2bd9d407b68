/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.nio.ByteBuffer;

import com.bc.zarr.DataType;

public final class ZarrTypes {

  private ZarrTypes() {
  }

  /**
   * Convert a FITS BITPIX value to a Zarr data type.
   *
   * @param bitpix FITS BITPIX value
   * @param scaled true if BSCALE/BZERO must be applied to stored values
   * @return corresponding Zarr data type
   */
  public static DataType getZarrType(int bitpix, boolean scaled) {
    if (scaled) {
      return DataType.f8;
    }
    switch (bitpix) {
      case 8:
        return DataType.u1;
      case 16:
        return DataType.i2;
      case 32:
        return DataType.i4;
      case -32:
        return DataType.f4;
      case -64:
        return DataType.f8;
      default:
        throw new IllegalArgumentException("Unsupported BITPIX: " + bitpix);
    }
  }

  /**
   * Allocate a primitive array suitable for reading or writing
   * the given number of elements with JZarr.
   *
   * @param dataType element type
   * @param size number of elements
   * @return byte[], short[], int[], float[] or double[]
   */
  public static Object allocate(DataType dataType, int size) {
    switch (dataType) {
      case i1:
      case u1:
        return new byte[size];
      case i2:
      case u2:
        return new short[size];
      case i4:
      case u4:
        return new int[size];
      case f4:
        return new float[size];
      case f8:
        return new double[size];
      default:
        throw new IllegalArgumentException(
            "Unsupported data type: " + dataType);
    }
  }

  /**
   * Copy one big-endian value from a buffer into a primitive array.
   *
   * @param dataType element type of <code>storage</code>
   * @param src buffer positioned at the value to copy
   * @param storage array allocated by {@link #allocate(DataType, int)}
   * @param index destination index
   */
  public static void copy(
    DataType dataType, ByteBuffer src, Object storage, int index)
  {
    switch (dataType) {
      case i1:
      case u1:
        ((byte[]) storage)[index] = src.get();
        break;
      case i2:
      case u2:
        ((short[]) storage)[index] = src.getShort();
        break;
      case i4:
      case u4:
        ((int[]) storage)[index] = src.getInt();
        break;
      case f4:
        ((float[]) storage)[index] = src.getFloat();
        break;
      case f8:
        ((double[]) storage)[index] = src.getDouble();
        break;
      default:
        throw new IllegalArgumentException(
            "Unsupported data type: " + dataType);
    }
  }

}
