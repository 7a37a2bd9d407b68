/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Pixel data paired with the dimension name of each axis.
 */
public class LabeledArray {

  private final ImmutableList<String> dims;
  private final Chunk data;

  /**
   * @param dims dimension name of each axis
   * @param data pixel values
   */
  public LabeledArray(List<String> dims, Chunk data) {
    if (dims.size() != data.getShape().length) {
      throw new IllegalArgumentException("Dimension names " + dims +
        " do not match " + data);
    }
    this.dims = ImmutableList.copyOf(dims);
    this.data = data;
  }

  /**
   * @return dimension name of each axis
   */
  public List<String> getDims() {
    return dims;
  }

  /**
   * @return pixel values
   */
  public Chunk getData() {
    return data;
  }
}
