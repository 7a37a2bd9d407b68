/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes world coordinates for every axis of an {@link ImageArtifact}.
 *
 * Axes are split into spherical (celestial) and linear groups by unit.
 * Each group is converted with a single batch call to
 * {@link ImageArtifact#toWorldMany(double[][])}, using a grid that spans
 * the group's axes and holds every other axis at index 0.  Spherical
 * coordinates keep the joint shape of all spherical axes, while each linear
 * axis gets its own one-dimensional vector.
 */
public class CoordinateResolver {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(CoordinateResolver.class);

  /**
   * Normalize a physical axis name for use as a dimension or coordinate
   * name, e.g. "Right Ascension" becomes "right_ascension".
   *
   * @param axisName physical axis name
   * @return lower-case name with spaces replaced by underscores
   */
  public static String coordinateName(String axisName) {
    return axisName.replace(' ', '_').toLowerCase();
  }

  /**
   * @param axis axis index
   * @return synthetic dimension name used for spherical axes
   */
  public static String sphericalDimension(int axis) {
    return "d" + axis;
  }

  /**
   * @param units physical unit of each axis
   * @return classification of each axis
   */
  public static AxisType[] classify(List<String> units) {
    AxisType[] types = new AxisType[units.size()];
    for (int i=0; i<types.length; i++) {
      types[i] = AxisType.classify(units.get(i));
    }
    return types;
  }

  /**
   * Build the dimension names for an artifact's axes: spherical axes use
   * synthetic names, linear axes use their normalized physical name.
   *
   * @param artifact open artifact
   * @return one dimension name per axis
   */
  public List<String> dimensions(ImageArtifact artifact) {
    AxisType[] types = classify(artifact.getAxisUnits());
    List<String> names = artifact.getAxisNames();
    List<String> dims = new ArrayList<String>();
    for (int i=0; i<types.length; i++) {
      dims.add(types[i] == AxisType.SPHERICAL ?
        sphericalDimension(i) : coordinateName(names.get(i)));
    }
    return dims;
  }

  /**
   * Compute coordinates for all axes of the given artifact.
   *
   * @param artifact open artifact
   * @return spherical coordinates first, then one vector per linear axis
   * @throws CoordinateException if the artifact's coordinate system
   *         cannot resolve an axis
   */
  public CoordinateSet resolve(ImageArtifact artifact)
    throws CoordinateException
  {
    int[] shape = artifact.getShape();
    AxisType[] types = classify(artifact.getAxisUnits());
    List<String> names = artifact.getAxisNames();

    Map<String, Coordinate> coords = new LinkedHashMap<String, Coordinate>();

    int[] sphericalAxes = axesOfType(types, AxisType.SPHERICAL);
    if (sphericalAxes.length > 0) {
      int[] groupShape = groupShape(shape, sphericalAxes);
      double[][] world =
        artifact.toWorldMany(indexGrid(shape, sphericalAxes));
      List<String> dims = new ArrayList<String>();
      for (int axis : sphericalAxes) {
        dims.add(sphericalDimension(axis));
      }
      for (int axis : sphericalAxes) {
        coords.put(coordinateName(names.get(axis)),
          new Coordinate(dims, groupShape, world[axis]));
      }
    }

    int[] linearAxes = axesOfType(types, AxisType.LINEAR);
    if (linearAxes.length > 0) {
      int[] groupShape = groupShape(shape, linearAxes);
      double[][] world = artifact.toWorldMany(indexGrid(shape, linearAxes));
      for (int g=0; g<linearAxes.length; g++) {
        int axis = linearAxes[g];
        // stride of this axis within the row-major group grid
        int stride = 1;
        for (int k=g+1; k<groupShape.length; k++) {
          stride *= groupShape[k];
        }
        double[] vector = new double[shape[axis]];
        for (int i=0; i<vector.length; i++) {
          vector[i] = world[axis][i * stride];
        }
        String name = coordinateName(names.get(axis));
        List<String> dims = new ArrayList<String>();
        dims.add(name);
        coords.put(name,
          new Coordinate(dims, new int[] {shape[axis]}, vector));
      }
    }

    LOGGER.debug("Resolved coordinates for {}: {}",
      artifact.getType(), coords.keySet());
    return new CoordinateSet(coords);
  }

  private static int[] axesOfType(AxisType[] types, AxisType type) {
    List<Integer> axes = new ArrayList<Integer>();
    for (int i=0; i<types.length; i++) {
      if (types[i] == type) {
        axes.add(i);
      }
    }
    return axes.stream().mapToInt(Integer::intValue).toArray();
  }

  private static int[] groupShape(int[] shape, int[] axes) {
    int[] groupShape = new int[axes.length];
    for (int i=0; i<axes.length; i++) {
      groupShape[i] = shape[axes[i]];
    }
    return groupShape;
  }

  /**
   * Build a row-major grid of pixel indices spanning the given axes,
   * with all other axes fixed at 0.
   *
   * @param shape full image shape
   * @param axes axes to span
   * @return pixel positions indexed as [axis][point]
   */
  static double[][] indexGrid(int[] shape, int[] axes) {
    int[] extent = new int[shape.length];
    for (int i=0; i<extent.length; i++) {
      extent[i] = 1;
    }
    for (int axis : axes) {
      extent[axis] = shape[axis];
    }
    int points = Chunk.size(extent);
    double[][] grid = new double[shape.length][points];
    int[] position = new int[shape.length];
    for (int p=0; p<points; p++) {
      for (int a=0; a<shape.length; a++) {
        grid[a][p] = position[a];
      }
      // advance the last axis fastest
      for (int a=shape.length-1; a>=0; a--) {
        if (++position[a] < extent[a]) {
          break;
        }
        position[a] = 0;
      }
    }
    return grid;
  }

}
