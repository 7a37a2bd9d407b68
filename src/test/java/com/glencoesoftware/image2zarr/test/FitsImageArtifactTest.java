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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.bc.zarr.DataType;
import com.glencoesoftware.image2zarr.Chunk;
import com.glencoesoftware.image2zarr.ImageArtifact;
import com.glencoesoftware.image2zarr.MetadataNormalizer;
import com.glencoesoftware.image2zarr.SummaryValue;
import com.glencoesoftware.image2zarr.fits.FitsArtifactOpener;
import com.glencoesoftware.image2zarr.fits.FitsImageArtifact;

import loci.common.LogbackTools;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FitsImageArtifactTest {

  private static final int FULL = ImageArtifact.FULL_RANGE;

  private Path tmp;
  private Path input;

  /**
   * Set logging to warn and write a default cube before all methods.
   *
   * @param tmp temporary directory for input files
   */
  @BeforeEach
  public void setup(@TempDir Path tmp) throws IOException {
    LogbackTools.setRootLevel("warn");
    this.tmp = tmp;
    input = FitsFixture.cube(10, 10, 1, 5).write(tmp.resolve("c.fits"));
  }

  @Test
  public void testAxes() throws Exception {
    try (ImageArtifact artifact = new FitsImageArtifact(input, "fits")) {
      assertEquals("fits", artifact.getType());
      assertEquals(4, artifact.getAxisCount());
      assertArrayEquals(new int[] {10, 10, 1, 5}, artifact.getShape());
      assertEquals(Arrays.asList(
        "Right Ascension", "Declination", "Stokes", "Frequency"),
        artifact.getAxisNames());
      assertEquals(Arrays.asList("rad", "rad", "", "Hz"),
        artifact.getAxisUnits());
    }
  }

  @Test
  public void testUnnamedAxis() throws Exception {
    Path path = FitsFixture.cube(2, 2, 1, 1).remove("CTYPE3")
      .remove("CUNIT4").write(tmp.resolve("u.fits"));
    try (ImageArtifact artifact = new FitsImageArtifact(path, "fits")) {
      assertEquals("Axis 3", artifact.getAxisNames().get(2));
      // frequency defaults to Hz
      assertEquals("Hz", artifact.getAxisUnits().get(3));
    }
  }

  @Test
  public void testChannel() throws Exception {
    try (ImageArtifact artifact = new FitsImageArtifact(input, "fits")) {
      int[] window = {FULL, FULL, FULL, 2};
      Chunk chunk = artifact.getChunk(window, window);
      assertEquals(DataType.f4, chunk.getDataType());
      assertArrayEquals(new int[] {10, 10, 1, 1}, chunk.getShape());
      for (int x=0; x<10; x++) {
        for (int y=0; y<10; y++) {
          assertEquals(FitsFixture.value(0, x, y, 0, 2),
            chunk.getDouble(x * 10 + y), 0);
        }
      }
    }
  }

  @Test
  public void testChannelBeforeStokes() throws Exception {
    Path path = FitsFixture.spectralCube(4, 3, 5, 2)
      .write(tmp.resolve("f.fits"));
    try (ImageArtifact artifact = new FitsImageArtifact(path, "fits")) {
      assertEquals(Arrays.asList(
        "Right Ascension", "Declination", "Frequency", "Stokes"),
        artifact.getAxisNames());
      int[] window = {FULL, FULL, 2, FULL};
      Chunk chunk = artifact.getChunk(window, window);
      assertArrayEquals(new int[] {4, 3, 1, 2}, chunk.getShape());
      for (int x=0; x<4; x++) {
        for (int y=0; y<3; y++) {
          for (int s=0; s<2; s++) {
            // fixture values weight axis 2 by 100 and axis 3 by 1000
            assertEquals(1000 * s + 100 * 2 + 10 * y + x,
              chunk.getDouble((x * 3 + y) * 2 + s), 0);
          }
        }
      }
    }
  }

  @Test
  public void testBox() throws Exception {
    try (ImageArtifact artifact = new FitsImageArtifact(input, "fits")) {
      Chunk chunk =
        artifact.getChunk(new int[] {2, 3, 0, 1}, new int[] {4, 3, 0, 1});
      assertArrayEquals(new int[] {3, 1, 1, 1}, chunk.getShape());
      assertEquals(1032, chunk.getDouble(0), 0);
      assertEquals(1033, chunk.getDouble(1), 0);
      assertEquals(1034, chunk.getDouble(2), 0);
    }
  }

  @Test
  public void testInvalidRange() throws Exception {
    try (ImageArtifact artifact = new FitsImageArtifact(input, "fits")) {
      assertThrows(IllegalArgumentException.class, () ->
        artifact.getChunk(new int[] {0, 0, 0, 5}, new int[] {0, 0, 0, 5}));
      assertThrows(IllegalArgumentException.class, () ->
        artifact.getChunk(new int[] {0, 0, 0}, new int[] {0, 0, 0}));
    }
  }

  @Test
  public void testScaled() throws Exception {
    Path path = FitsFixture.cube(3, 3, 1, 2).set("BSCALE", 2.0)
      .set("BZERO", 1.0).write(tmp.resolve("s.fits"));
    try (ImageArtifact artifact = new FitsImageArtifact(path, "fits")) {
      int[] window = {FULL, FULL, FULL, 1};
      Chunk chunk = artifact.getChunk(window, window);
      assertEquals(DataType.f8, chunk.getDataType());
      assertEquals(2 * FitsFixture.value(0, 0, 1, 0, 1) + 1,
        chunk.getDouble(1), 0);
    }
  }

  @Test
  public void testSummary() throws Exception {
    try (ImageArtifact artifact = new FitsImageArtifact(input, "fits")) {
      Map<String, SummaryValue> summary = artifact.getSummary();
      assertTrue(summary.keySet().containsAll(Arrays.asList("axisnames",
        "incr", "ndim", "refpix", "refval", "shape", "tileshape",
        "messages", "unit", "imagetype")));
      assertEquals("Jy/beam", summary.get("unit").getValue());
      assertArrayEquals(new int[] {10, 10, 1, 1},
        (int[]) summary.get("tileshape").getValue());

      SummaryValue beam = summary.get("restoringbeam");
      assertTrue(beam.isNested());
      Map<String, Object> flat = MetadataNormalizer.flatten(
        ((SummaryValue.Nested) beam).getEntries(), ".");
      assertEquals(36.0, (Double) flat.get("major.value"), 1e-9);
      assertEquals("arcsec", flat.get("minor.unit"));
      assertEquals(-30.0, (Double) flat.get("positionangle.value"), 0);
    }
  }

  @Test
  public void testNoBeam() throws Exception {
    Path path = FitsFixture.cube(2, 2, 1, 1).remove("BMAJ")
      .write(tmp.resolve("b.fits"));
    try (ImageArtifact artifact = new FitsImageArtifact(path, "fits")) {
      assertTrue(!artifact.getSummary().containsKey("restoringbeam"));
    }
  }

  @Test
  public void testMessages() throws Exception {
    try (ImageArtifact artifact = new FitsImageArtifact(input, "fits")) {
      List<String> messages = artifact.getMessages();
      assertEquals(1, messages.size());
      Map<String, String> pairs =
        MetadataNormalizer.parseMessage(messages.get(0));
      assertEquals("c.fits", pairs.get("image_name"));
      assertEquals("n5921", pairs.get("object_name"));
      assertEquals("vla", pairs.get("telescope"));
      assertEquals("1995-04-13t09:33:00", pairs.get("date_observation"));
      assertEquals("jy/beam", pairs.get("image_units"));
      // the axis table is not made of label/value pairs
      for (String key : pairs.keySet()) {
        assertTrue(!key.startsWith("axis") && !key.startsWith("0"), key);
      }
    }
  }

  @Test
  public void testTruncated() throws Exception {
    byte[] bytes = Files.readAllBytes(input);
    Path path = tmp.resolve("t.fits");
    Files.write(path, Arrays.copyOf(bytes, 2880 + 100));
    assertThrows(IOException.class, () -> new FitsImageArtifact(path, "fits"));
  }

  @Test
  public void testOpener() throws Exception {
    FitsArtifactOpener opener = new FitsArtifactOpener();
    assertTrue(opener.exists(input));
    assertTrue(!opener.exists(tmp.resolve("c.mask")));
    assertTrue(!opener.exists(tmp));
    try (ImageArtifact artifact = opener.open(input, "mask")) {
      assertEquals("mask", artifact.getType());
      assertEquals(input, artifact.getPath());
    }
  }

}
