/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

/**
 * Thrown when an artifact's coordinate system cannot convert pixel
 * positions to world coordinates.
 */
public class CoordinateException extends Exception {

  private static final long serialVersionUID = 1L;

  /**
   * @param message description of the unresolvable coordinate
   */
  public CoordinateException(String message) {
    super(message);
  }

  /**
   * @param message description of the unresolvable coordinate
   * @param cause underlying failure
   */
  public CoordinateException(String message, Throwable cause) {
    super(message, cause);
  }

}
