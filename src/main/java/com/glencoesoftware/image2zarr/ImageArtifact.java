/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * An opened image product (the primary image or one of its auxiliary
 * artifacts such as mask, model or psf).  Instances hold an open file
 * handle and must be closed after use.
 */
public interface ImageArtifact extends Closeable {

  /** Index value selecting the full extent of an axis in {@link #getChunk}. */
  int FULL_RANGE = -1;

  /**
   * @return artifact type name, e.g. "mask" or "fits"
   */
  String getType();

  /**
   * @return path from which this artifact was opened
   */
  Path getPath();

  /**
   * @return number of axes
   */
  int getAxisCount();

  /**
   * @return extent of each axis; the array length equals
   *         {@link #getAxisCount()}
   */
  int[] getShape();

  /**
   * @return physical name of each axis, e.g. "Right Ascension"
   */
  List<String> getAxisNames();

  /**
   * @return physical unit of each axis; celestial axes report "rad"
   */
  List<String> getAxisUnits();

  /**
   * Retrieve the nested summary metadata, including the free-text
   * diagnostic block under the "messages" key.
   *
   * @return summary keyed by metadata name
   */
  Map<String, SummaryValue> getSummary();

  /**
   * @return free-text diagnostic messages; each may span multiple lines
   */
  List<String> getMessages();

  /**
   * Read the box between two inclusive corner indices.
   * A corner value of {@link #FULL_RANGE} selects the whole axis.
   *
   * @param start first index along each axis
   * @param end last index along each axis
   * @return pixel values in row-major order over this artifact's axes
   * @throws IOException if the pixel data cannot be read
   */
  Chunk getChunk(int[] start, int[] end) throws IOException;

  /**
   * Convert a batch of 0-based pixel positions to world coordinates.
   *
   * @param pixels pixel positions indexed as [axis][point]
   * @return world coordinates indexed as [axis][point]; celestial
   *         values are in radians
   * @throws CoordinateException if the coordinate system cannot resolve
   *         one of the axes
   */
  double[][] toWorldMany(double[][] pixels) throws CoordinateException;

}
