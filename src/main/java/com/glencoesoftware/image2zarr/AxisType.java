/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

/**
 * Classification of an image axis for world coordinate calculation.
 */
public enum AxisType {
  SPHERICAL,
  LINEAR;

  /** Unit reported by celestial axes. */
  public static final String ANGULAR_UNIT = "rad";

  /**
   * @param unit physical unit of the axis
   * @return {@link #SPHERICAL} if the unit is exactly {@link #ANGULAR_UNIT},
   *         otherwise {@link #LINEAR}
   */
  public static AxisType classify(String unit) {
    return ANGULAR_UNIT.equals(unit) ? SPHERICAL : LINEAR;
  }
}
