/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.bc.zarr.DataType;
import com.bc.zarr.ZarrArray;
import com.bc.zarr.ZarrGroup;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glencoesoftware.image2zarr.ChannelRecord;
import com.glencoesoftware.image2zarr.Chunk;
import com.glencoesoftware.image2zarr.Coordinate;
import com.glencoesoftware.image2zarr.CoordinateSet;
import com.glencoesoftware.image2zarr.LabeledArray;
import com.glencoesoftware.image2zarr.ZarrArrayStore;
import com.glencoesoftware.image2zarr.ZarrCompression;

import loci.common.LogbackTools;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ZarrArrayStoreTest {

  private static final List<String> DIMS =
    Arrays.asList("d0", "d1", "stokes", "frequency");

  private Path store;
  private ZarrArrayStore arrayStore;

  /**
   * Set logging to warn before all methods.
   *
   * @param tmp temporary directory for output stores
   */
  @BeforeEach
  public void setup(@TempDir Path tmp) {
    LogbackTools.setRootLevel("warn");
    store = tmp.resolve("test.zarr");
    arrayStore = new ZarrArrayStore();
  }

  /**
   * Build one 2x3 channel with pixel values
   * <code>100 * channel + index</code>.
   */
  private static ChannelRecord channel(int channel,
    Map<String, Object> attributes)
  {
    float[] pixels = new float[6];
    double[] ra = new double[6];
    for (int i=0; i<pixels.length; i++) {
      pixels[i] = 100 * channel + i;
      ra[i] = 0.1 * i;
    }
    Map<String, Coordinate> coords = new LinkedHashMap<String, Coordinate>();
    coords.put("right_ascension", new Coordinate(
      Arrays.asList("d0", "d1"), new int[] {2, 3}, ra));
    coords.put("stokes", new Coordinate(
      Arrays.asList("stokes"), new int[] {1}, new double[] {1}));
    coords.put("frequency", new Coordinate(Arrays.asList("frequency"),
      new int[] {1}, new double[] {1.0e9 + channel}));

    Map<String, LabeledArray> variables =
      new LinkedHashMap<String, LabeledArray>();
    variables.put("image", new LabeledArray(DIMS,
      new Chunk(DataType.f4, new int[] {2, 3, 1, 1}, pixels)));
    return new ChannelRecord(variables, new CoordinateSet(coords), attributes);
  }

  private static Object readAll(Path array) throws Exception {
    ZarrArray zarray = ZarrArray.open(array);
    int[] shape = zarray.getShape();
    return zarray.read(shape, new int[shape.length]);
  }

  @Test
  public void testCreate() throws Exception {
    arrayStore.create(store, channel(0,
      Collections.<String, Object>singletonMap("object", "n5921")),
      ZarrCompression.zlib);

    assertEquals("n5921", ZarrGroup.open(store).getAttributes().get("object"));

    ZarrArray image = ZarrArray.open(store.resolve("image"));
    assertArrayEquals(new int[] {2, 3, 1, 1}, image.getShape());
    Map<String, Object> attrs = image.getAttributes();
    assertEquals(DIMS, attrs.get(ZarrArrayStore.DIMENSIONS_KEY));
    assertEquals("right_ascension",
      attrs.get(ZarrArrayStore.COORDINATES_KEY));

    ZarrArray ra = ZarrArray.open(store.resolve("right_ascension"));
    assertEquals(Arrays.asList("d0", "d1"),
      ra.getAttributes().get(ZarrArrayStore.DIMENSIONS_KEY));
    assertArrayEquals(new double[] {0, 0.1, 0.2, 0.3, 0.4, 0.5},
      (double[]) readAll(store.resolve("right_ascension")), 1e-15);
    assertArrayEquals(new float[] {0, 1, 2, 3, 4, 5},
      (float[]) readAll(store.resolve("image")), 0f);
  }

  @Test
  public void testCompressorRecorded() throws Exception {
    arrayStore.create(store, channel(0, Collections.<String, Object>emptyMap()),
      ZarrCompression.zlib);
    JsonNode zarray = new ObjectMapper().readTree(
      store.resolve("image").resolve(".zarray").toFile());
    assertEquals("zlib", zarray.get("compressor").get("id").asText());
  }

  @Test
  public void testAppend() throws Exception {
    arrayStore.create(store, channel(0, Collections.<String, Object>emptyMap()),
      ZarrCompression.zlib);
    arrayStore.append(store,
      channel(1, Collections.<String, Object>emptyMap()), "frequency");
    arrayStore.append(store,
      channel(2, Collections.<String, Object>emptyMap()), "frequency");

    assertArrayEquals(new int[] {2, 3, 1, 3},
      ZarrArray.open(store.resolve("image")).getShape());
    assertArrayEquals(new double[] {1.0e9, 1.0e9 + 1, 1.0e9 + 2},
      (double[]) readAll(store.resolve("frequency")), 0);
    // coordinates without the append dimension are unchanged
    assertArrayEquals(new int[] {2, 3},
      ZarrArray.open(store.resolve("right_ascension")).getShape());
    assertArrayEquals(new int[] {1},
      ZarrArray.open(store.resolve("stokes")).getShape());

    float[] image = (float[]) readAll(store.resolve("image"));
    for (int i=0; i<6; i++) {
      for (int c=0; c<3; c++) {
        assertEquals(100 * c + i, image[i * 3 + c], 0f);
      }
    }
  }

  @Test
  public void testAppendMissingArray() {
    assertThrows(IOException.class, () -> arrayStore.append(store,
      channel(1, Collections.<String, Object>emptyMap()), "frequency"));
  }

  @Test
  public void testAppendShapeMismatch() throws Exception {
    arrayStore.create(store, channel(0, Collections.<String, Object>emptyMap()),
      ZarrCompression.zlib);
    Map<String, LabeledArray> variables =
      new LinkedHashMap<String, LabeledArray>();
    variables.put("image", new LabeledArray(DIMS,
      Chunk.allocate(DataType.f4, new int[] {2, 2, 1, 1})));
    ChannelRecord wrong = new ChannelRecord(variables,
      new CoordinateSet(Collections.<String, Coordinate>emptyMap()),
      Collections.<String, Object>emptyMap());
    assertThrows(IOException.class,
      () -> arrayStore.append(store, wrong, "frequency"));
  }

  @Test
  public void testDelete() throws Exception {
    arrayStore.delete(store);
    arrayStore.create(store, channel(0, Collections.<String, Object>emptyMap()),
      ZarrCompression.zlib);
    assertTrue(Files.exists(store.resolve("image")));
    arrayStore.delete(store);
    assertFalse(Files.exists(store));
  }

}
