/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr.fits;

import java.util.Arrays;
import java.util.List;

import com.glencoesoftware.image2zarr.CoordinateException;

/**
 * World coordinate system described by the CTYPE, CRVAL, CDELT, CRPIX and
 * CUNIT keywords of a FITS header.
 *
 * Non-celestial axes are linear.  A single celestial longitude/latitude
 * pair using the SIN or TAN zenithal projection is supported; celestial
 * world coordinates are returned in radians.  Rotation keywords (PCi_j,
 * CDi_j, CROTAi) are ignored.
 */
public class FitsCoordinateSystem {

  // -- Constants --

  private static final List<String> LONGITUDE_TYPES =
    Arrays.asList("RA", "GLON", "ELON");
  private static final List<String> LATITUDE_TYPES =
    Arrays.asList("DEC", "GLAT", "ELAT");
  private static final List<String> PROJECTIONS = Arrays.asList("SIN", "TAN");

  // -- Fields --

  private final int naxis;
  private final String[] ctype;
  private final String[] cunit;
  private final double[] crval;
  private final double[] cdelt;
  private final double[] crpix;
  private final double lonpole;

  // -- Constructor --

  /**
   * @param header parsed header
   * @param naxis number of axes
   */
  public FitsCoordinateSystem(FitsHeader header, int naxis) {
    this.naxis = naxis;
    ctype = new String[naxis];
    cunit = new String[naxis];
    crval = new double[naxis];
    cdelt = new double[naxis];
    crpix = new double[naxis];
    for (int a=0; a<naxis; a++) {
      int n = a + 1;
      ctype[a] = header.getString("CTYPE" + n, "").trim();
      cunit[a] = header.getString("CUNIT" + n, "").trim();
      crval[a] = header.getDouble("CRVAL" + n, 0.0);
      cdelt[a] = header.getDouble("CDELT" + n, 1.0);
      crpix[a] = header.getDouble("CRPIX" + n, 0.0);
    }
    lonpole = header.getDouble("LONPOLE", Double.NaN);
  }

  // -- FitsCoordinateSystem API methods --

  /**
   * Extract the coordinate type from a CTYPE value, e.g. "RA" from
   * "RA---SIN".
   *
   * @param type CTYPE value
   * @return coordinate type without projection code or padding
   */
  public static String coordinateType(String type) {
    int dash = type.indexOf('-');
    String prefix = dash >= 0 ? type.substring(0, dash) : type;
    return prefix.trim().toUpperCase();
  }

  /**
   * @param type CTYPE value
   * @return projection code, e.g. "SIN", or an empty string
   */
  public static String projection(String type) {
    return type.length() >= 8 ? type.substring(5, 8).toUpperCase() : "";
  }

  /**
   * @param axis axis index
   * @return true if the axis is a celestial longitude or latitude
   */
  public boolean isCelestial(int axis) {
    String t = coordinateType(ctype[axis]);
    return LONGITUDE_TYPES.contains(t) || LATITUDE_TYPES.contains(t);
  }

  /**
   * @param axis axis index
   * @return CTYPE value of the axis
   */
  public String getType(int axis) {
    return ctype[axis];
  }

  /**
   * @param axis axis index
   * @return CUNIT value of the axis
   */
  public String getUnit(int axis) {
    return cunit[axis];
  }

  /**
   * @param axis axis index
   * @return reference value; celestial axes in radians
   */
  public double getReferenceValue(int axis) {
    return isCelestial(axis) ?
      Math.toRadians(crval[axis] * degreesPerUnit(cunit[axis])) : crval[axis];
  }

  /**
   * @param axis axis index
   * @return increment per pixel; celestial axes in radians
   */
  public double getIncrement(int axis) {
    return isCelestial(axis) ?
      Math.toRadians(cdelt[axis] * degreesPerUnit(cunit[axis])) : cdelt[axis];
  }

  /**
   * @param axis axis index
   * @return 0-based reference pixel
   */
  public double getReferencePixel(int axis) {
    return crpix[axis] - 1;
  }

  /**
   * Convert 0-based pixel positions to world coordinates.
   *
   * @param pixels pixel positions indexed as [axis][point]
   * @return world coordinates indexed as [axis][point]
   * @throws CoordinateException if the celestial axes are incomplete,
   *         duplicated or use an unsupported projection
   */
  public double[][] toWorldMany(double[][] pixels) throws CoordinateException {
    if (pixels.length != naxis) {
      throw new CoordinateException("Expected " + naxis +
        " pixel axes, found " + pixels.length);
    }
    int points = naxis == 0 ? 0 : pixels[0].length;
    double[][] world = new double[naxis][points];

    int lon = -1;
    int lat = -1;
    for (int a=0; a<naxis; a++) {
      String t = coordinateType(ctype[a]);
      if (LONGITUDE_TYPES.contains(t)) {
        if (lon >= 0) {
          throw new CoordinateException("Duplicate celestial longitude axis: "
            + ctype[lon] + ", " + ctype[a]);
        }
        lon = a;
      }
      else if (LATITUDE_TYPES.contains(t)) {
        if (lat >= 0) {
          throw new CoordinateException("Duplicate celestial latitude axis: "
            + ctype[lat] + ", " + ctype[a]);
        }
        lat = a;
      }
      else {
        for (int p=0; p<points; p++) {
          world[a][p] = crval[a] + cdelt[a] * (pixels[a][p] + 1 - crpix[a]);
        }
      }
    }

    if (lon >= 0 || lat >= 0) {
      if (lon < 0 || lat < 0) {
        throw new CoordinateException("Celestial axis " +
          ctype[lon >= 0 ? lon : lat] + " has no matching partner axis");
      }
      celestialToWorld(pixels, world, lon, lat);
    }
    return world;
  }

  // -- Helper methods --

  private void celestialToWorld(double[][] pixels, double[][] world,
    int lon, int lat) throws CoordinateException
  {
    String code = projection(ctype[lon]);
    if (!PROJECTIONS.contains(code) || !code.equals(projection(ctype[lat]))) {
      throw new CoordinateException("Unsupported projection: " +
        ctype[lon] + ", " + ctype[lat]);
    }
    double lonScale;
    double latScale;
    try {
      lonScale = degreesPerUnit(cunit[lon]);
      latScale = degreesPerUnit(cunit[lat]);
    }
    catch (IllegalArgumentException e) {
      throw new CoordinateException("Invalid celestial unit", e);
    }
    double alpha0 = Math.toRadians(crval[lon] * lonScale);
    double delta0 = Math.toRadians(crval[lat] * latScale);
    double phiP = Math.toRadians(Double.isNaN(lonpole) ?
      (crval[lat] * latScale >= 90 ? 0 : 180) : lonpole);

    for (int p=0; p<pixels[lon].length; p++) {
      // intermediate world coordinates in degrees
      double x = cdelt[lon] * lonScale * (pixels[lon][p] + 1 - crpix[lon]);
      double y = cdelt[lat] * latScale * (pixels[lat][p] + 1 - crpix[lat]);
      double r = Math.hypot(x, y);
      double phi = Math.atan2(x, -y);
      double theta;
      if (code.equals("TAN")) {
        theta = Math.atan2(Math.toDegrees(1.0), r);
      }
      else {
        double cosTheta = Math.toRadians(r);
        theta = cosTheta > 1 ? Double.NaN : Math.acos(cosTheta);
      }

      double dphi = phi - phiP;
      double alpha = alpha0 + Math.atan2(
        -Math.cos(theta) * Math.sin(dphi),
        Math.sin(theta) * Math.cos(delta0) -
        Math.cos(theta) * Math.sin(delta0) * Math.cos(dphi));
      double delta = Math.asin(
        Math.sin(theta) * Math.sin(delta0) +
        Math.cos(theta) * Math.cos(delta0) * Math.cos(dphi));

      alpha = alpha % (2 * Math.PI);
      if (alpha < 0) {
        alpha += 2 * Math.PI;
      }
      world[lon][p] = alpha;
      world[lat][p] = delta;
    }
  }

  /**
   * @param unit angular CUNIT value
   * @return number of degrees in one unit; 1 for unspecified units
   */
  static double degreesPerUnit(String unit) {
    switch (unit.toLowerCase()) {
      case "":
      case "deg":
        return 1.0;
      case "rad":
        return Math.toDegrees(1.0);
      case "arcmin":
        return 1.0 / 60;
      case "arcsec":
        return 1.0 / 3600;
      default:
        throw new IllegalArgumentException("Unsupported angular unit: " + unit);
    }
  }

}
