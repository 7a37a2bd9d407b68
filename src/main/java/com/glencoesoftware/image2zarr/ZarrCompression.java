/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.bc.zarr.Compressor;
import com.bc.zarr.CompressorFactory;

public enum ZarrCompression {
  raw("null"),
  zlib("zlib"),
  blosc("blosc");

  private final String value;

  private ZarrCompression(final String value) {
    this.value = value;
  }

  /**
   * Default compressor properties.  Blosc uses zstd at level 2 without
   * byte shuffling.
   *
   * @return properties as defined by jzarr
   */
  public Map<String, Object> getProperties() {
    Map<String, Object> properties = new HashMap<String, Object>();
    switch (this) {
      case blosc:
        properties.put("cname", "zstd");
        properties.put("clevel", 2);
        properties.put("shuffle", 0);
        break;
      case zlib:
        properties.put("level", 1);
        break;
      default:
        break;
    }
    return Collections.unmodifiableMap(properties);
  }

  /**
   * @return a new compressor with the default properties
   */
  public Compressor createCompressor() {
    return CompressorFactory.create(
      value, new HashMap<String, Object>(getProperties()));
  }

  @Override
  public String toString() {
    return value;
  }
}
