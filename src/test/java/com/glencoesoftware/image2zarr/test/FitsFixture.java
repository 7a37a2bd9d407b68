/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr.test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes small FITS cubes for use as test input.
 *
 * Pixel values default to <code>offset + 1000*c + 100*s + 10*y + x</code>
 * for position (x, y, s, c), which are exact in 32-bit floating point.
 */
public class FitsFixture {

  static final double RA = 180.0;
  static final double DEC = 45.0;
  static final double FREQ = 1.4e9;
  static final double FREQ_STEP = 1.0e6;

  private final Map<String, Object> cards = new LinkedHashMap<String, Object>();
  private final int[] shape;
  private double offset = 0;

  private FitsFixture(int[] shape) {
    this.shape = shape.clone();
    cards.put("SIMPLE", Boolean.TRUE);
    cards.put("BITPIX", -32);
    cards.put("NAXIS", shape.length);
    for (int a=0; a<shape.length; a++) {
      cards.put("NAXIS" + (a + 1), shape[a]);
    }
  }

  /**
   * Create a (RA, Dec, Stokes, Frequency) cube with a SIN projection
   * centred on the middle pixel.
   *
   * @param nx number of RA pixels
   * @param ny number of Dec pixels
   * @param ns number of Stokes planes
   * @param nc number of frequency channels
   * @return fixture ready to be written
   */
  static FitsFixture cube(int nx, int ny, int ns, int nc) {
    FitsFixture f = new FitsFixture(new int[] {nx, ny, ns, nc});
    f.set("CTYPE1", "RA---SIN").set("CRVAL1", RA).set("CDELT1", -0.001)
      .set("CRPIX1", nx / 2 + 1.0).set("CUNIT1", "deg");
    f.set("CTYPE2", "DEC--SIN").set("CRVAL2", DEC).set("CDELT2", 0.001)
      .set("CRPIX2", ny / 2 + 1.0).set("CUNIT2", "deg");
    f.set("CTYPE3", "STOKES").set("CRVAL3", 1.0).set("CDELT3", 1.0)
      .set("CRPIX3", 1.0).set("CUNIT3", "");
    f.set("CTYPE4", "FREQ").set("CRVAL4", FREQ).set("CDELT4", FREQ_STEP)
      .set("CRPIX4", 1.0).set("CUNIT4", "Hz");
    f.set("BUNIT", "Jy/beam").set("BMAJ", 0.01).set("BMIN", 0.005)
      .set("BPA", -30.0);
    f.set("OBJECT", "N5921").set("TELESCOP", "VLA")
      .set("DATE-OBS", "1995-04-13T09:33:00");
    return f;
  }

  /**
   * Create a (RA, Dec, Frequency, Stokes) cube, the axis order most
   * radio imagers write.
   *
   * @param nx number of RA pixels
   * @param ny number of Dec pixels
   * @param nc number of frequency channels
   * @param ns number of Stokes planes
   * @return fixture ready to be written
   */
  static FitsFixture spectralCube(int nx, int ny, int nc, int ns) {
    FitsFixture f = cube(nx, ny, nc, ns);
    f.set("CTYPE3", "FREQ").set("CRVAL3", FREQ).set("CDELT3", FREQ_STEP)
      .set("CRPIX3", 1.0).set("CUNIT3", "Hz");
    f.set("CTYPE4", "STOKES").set("CRVAL4", 1.0).set("CDELT4", 1.0)
      .set("CRPIX4", 1.0).set("CUNIT4", "");
    return f;
  }

  /**
   * @param key header keyword
   * @param value String, Boolean, Integer or Double
   * @return this fixture
   */
  FitsFixture set(String key, Object value) {
    cards.put(key, value);
    return this;
  }

  /**
   * @param key header keyword to drop
   * @return this fixture
   */
  FitsFixture remove(String key) {
    cards.remove(key);
    return this;
  }

  /**
   * @param value amount added to every pixel
   * @return this fixture
   */
  FitsFixture offset(double value) {
    offset = value;
    return this;
  }

  /**
   * Expected pixel value at a position.
   *
   * @param offset fixture offset
   * @param x RA index
   * @param y Dec index
   * @param s Stokes index
   * @param c channel index
   * @return pixel value
   */
  static double value(double offset, int x, int y, int s, int c) {
    return offset + 1000 * c + 100 * s + 10 * y + x;
  }

  /**
   * Write the fixture.
   *
   * @param path destination file
   * @return <code>path</code>
   */
  Path write(Path path) throws IOException {
    List<String> lines = new ArrayList<String>();
    for (Map.Entry<String, Object> card : cards.entrySet()) {
      lines.add(card(card.getKey(), card.getValue()));
    }
    lines.add(pad("END"));
    StringBuilder header = new StringBuilder();
    for (String line : lines) {
      header.append(line);
    }
    while (header.length() % 2880 != 0) {
      header.append(' ');
    }

    int size = 1;
    for (int s : shape) {
      size *= s;
    }
    int dataLength = size * 4;
    int padded = ((dataLength + 2879) / 2880) * 2880;
    ByteBuffer data = ByteBuffer.allocate(padded);
    int[] position = new int[shape.length];
    for (int i=0; i<size; i++) {
      int x = position[0];
      int y = shape.length > 1 ? position[1] : 0;
      int s = shape.length > 2 ? position[2] : 0;
      int c = shape.length > 3 ? position[3] : 0;
      data.putFloat((float) value(offset, x, y, s, c));
      // FITS order: first axis fastest
      for (int a=0; a<shape.length; a++) {
        if (++position[a] < shape[a]) {
          break;
        }
        position[a] = 0;
      }
    }

    byte[] headerBytes =
      header.toString().getBytes(StandardCharsets.US_ASCII);
    byte[] bytes = new byte[headerBytes.length + padded];
    System.arraycopy(headerBytes, 0, bytes, 0, headerBytes.length);
    System.arraycopy(data.array(), 0, bytes, headerBytes.length, padded);
    Files.write(path, bytes);
    return path;
  }

  private static String card(String key, Object value) {
    String formatted;
    if (value instanceof String) {
      formatted = "'" + value.toString().replace("'", "''") + "'";
    }
    else if (value instanceof Boolean) {
      formatted = String.format("%20s", (Boolean) value ? "T" : "F");
    }
    else {
      formatted = String.format("%20s", value);
    }
    return pad(String.format("%-8s= %s", key, formatted));
  }

  private static String pad(String card) {
    StringBuilder sb = new StringBuilder(card);
    while (sb.length() < 80) {
      sb.append(' ');
    }
    return sb.toString();
  }
}
