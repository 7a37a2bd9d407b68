/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import com.bc.zarr.ArrayParams;
import com.bc.zarr.Compressor;
import com.bc.zarr.DataType;
import com.bc.zarr.DimensionSeparator;
import com.bc.zarr.ZarrArray;
import com.bc.zarr.ZarrGroup;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ucar.ma2.InvalidRangeException;

/**
 * {@link ArrayStore} writing Zarr v2 groups in the layout read by xarray.
 *
 * Each data variable and coordinate is stored as an array in the root
 * group, with its dimension names in the "_ARRAY_DIMENSIONS" attribute.
 * Data variables list their non-dimension coordinates in a "coordinates"
 * attribute.  Appending rewrites the "shape" of every array that includes
 * the append dimension and writes the new slab after the previous extent.
 */
public class ZarrArrayStore implements ArrayStore {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(ZarrArrayStore.class);

  /** Attribute holding an array's dimension names. */
  public static final String DIMENSIONS_KEY = "_ARRAY_DIMENSIONS";

  /** Attribute listing a data variable's non-dimension coordinates. */
  public static final String COORDINATES_KEY = "coordinates";

  private static final String ARRAY_METADATA = ".zarray";

  private final JsonMapper mapper = JsonMapper.builder()
    .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
    .build();

  @Override
  public void delete(Path store) throws IOException {
    if (!Files.exists(store)) {
      return;
    }
    LOGGER.warn("Overwriting output path {}", store);
    try (Stream<Path> paths = Files.walk(store)) {
      paths.sorted(Comparator.reverseOrder())
        .map(Path::toFile)
        .forEach(File::delete);
    }
    if (Files.exists(store)) {
      throw new IOException("Could not delete " + store);
    }
  }

  @Override
  public void create(Path store, ChannelRecord record,
    ZarrCompression compression) throws IOException
  {
    Slf4JStopWatch t0 = stopWatch();
    try {
      ZarrGroup root = ZarrGroup.create(store, record.getAttributes());
      Compressor compressor = compression.createCompressor();

      CoordinateSet coords = record.getCoordinates();
      for (String name : coords.names()) {
        Coordinate c = coords.get(name);
        ArrayParams params = new ArrayParams()
          .shape(c.getShape())
          .chunks(c.getShape())
          .dataType(DataType.f8)
          .dimensionSeparator(DimensionSeparator.DOT)
          .compressor(compressor);
        ZarrArray array =
          root.createArray(name, params, dimensionAttributes(c.getDims()));
        write(array, name, c.getValues(), c.getShape(), new int[c.getRank()]);
      }

      String coordinateNames = nonDimensionCoordinates(coords);
      for (Map.Entry<String, LabeledArray> v :
        record.getVariables().entrySet())
      {
        Chunk data = v.getValue().getData();
        Map<String, Object> attributes =
          dimensionAttributes(v.getValue().getDims());
        if (!coordinateNames.isEmpty()) {
          attributes.put(COORDINATES_KEY, coordinateNames);
        }
        ArrayParams params = new ArrayParams()
          .shape(data.getShape())
          .chunks(data.getShape())
          .dataType(data.getDataType())
          .dimensionSeparator(DimensionSeparator.DOT)
          .compressor(compressor);
        ZarrArray array = root.createArray(v.getKey(), params, attributes);
        write(array, v.getKey(), data.getStorage(), data.getShape(),
          new int[data.getShape().length]);
      }
    }
    finally {
      t0.stop("create");
    }
  }

  @Override
  public void append(Path store, ChannelRecord record, String dimension)
    throws IOException
  {
    Slf4JStopWatch t0 = stopWatch();
    try {
      CoordinateSet coords = record.getCoordinates();
      for (String name : coords.names()) {
        Coordinate c = coords.get(name);
        if (c.getDims().contains(dimension)) {
          appendArray(store, name, c.getDims(), c.getValues(),
            c.getShape(), dimension);
        }
      }
      for (Map.Entry<String, LabeledArray> v :
        record.getVariables().entrySet())
      {
        LabeledArray array = v.getValue();
        if (array.getDims().contains(dimension)) {
          appendArray(store, v.getKey(), array.getDims(),
            array.getData().getStorage(), array.getData().getShape(),
            dimension);
        }
      }
    }
    finally {
      t0.stop("append");
    }
  }

  private void appendArray(Path store, String name, List<String> dims,
    Object storage, int[] shape, String dimension) throws IOException
  {
    Path arrayPath = store.resolve(name);
    if (!Files.exists(arrayPath.resolve(ARRAY_METADATA))) {
      throw new IOException("Cannot append " + name +
        ": no such array in " + store);
    }
    ZarrArray existing = ZarrArray.open(arrayPath);
    int[] existingShape = existing.getShape();
    if (existingShape.length != shape.length) {
      throw new IOException("Cannot append " + name + ": expected " +
        existingShape.length + " dimensions, found " + shape.length);
    }
    int axis = dims.indexOf(dimension);
    int[] newShape = existingShape.clone();
    int[] offset = new int[shape.length];
    for (int i=0; i<shape.length; i++) {
      if (i != axis && shape[i] != existingShape[i]) {
        throw new IOException("Cannot append " + name + ": dimension " +
          dims.get(i) + " has length " + shape[i] + ", expected " +
          existingShape[i]);
      }
    }
    offset[axis] = existingShape[axis];
    newShape[axis] += shape[axis];
    resize(arrayPath, newShape);
    write(ZarrArray.open(arrayPath), name, storage, shape, offset);
  }

  /**
   * Update the shape recorded in an array's metadata.  Existing chunks
   * are not touched.
   *
   * @param arrayPath array location
   * @param shape new shape
   */
  private void resize(Path arrayPath, int[] shape) throws IOException {
    File metadata = arrayPath.resolve(ARRAY_METADATA).toFile();
    JsonNode root = mapper.readTree(metadata);
    if (!(root instanceof ObjectNode)) {
      throw new IOException("Invalid array metadata in " + metadata);
    }
    ArrayNode shapeNode = ((ObjectNode) root).putArray("shape");
    for (int s : shape) {
      shapeNode.add(s);
    }
    mapper.writeValue(metadata, root);
  }

  private static void write(ZarrArray array, String name, Object storage,
    int[] shape, int[] offset) throws IOException
  {
    try {
      array.write(storage, shape, offset);
    }
    catch (InvalidRangeException e) {
      throw new IOException("Invalid range while writing " + name, e);
    }
  }

  private static Map<String, Object> dimensionAttributes(List<String> dims) {
    Map<String, Object> attributes = new HashMap<String, Object>();
    attributes.put(DIMENSIONS_KEY, new ArrayList<String>(dims));
    return attributes;
  }

  private static String nonDimensionCoordinates(CoordinateSet coords) {
    List<String> names = new ArrayList<String>();
    for (String name : coords.names()) {
      if (!coords.isDimensionCoordinate(name)) {
        names.add(name);
      }
    }
    return String.join(" ", names);
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
