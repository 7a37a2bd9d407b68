/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr.fits;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.bc.zarr.DataType;
import com.glencoesoftware.image2zarr.AxisType;
import com.glencoesoftware.image2zarr.Chunk;
import com.glencoesoftware.image2zarr.CoordinateException;
import com.glencoesoftware.image2zarr.ImageArtifact;
import com.glencoesoftware.image2zarr.SummaryValue;
import com.glencoesoftware.image2zarr.ZarrTypes;

import loci.common.RandomAccessInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ImageArtifact} backed by the primary HDU of a FITS file.
 * Axis 0 corresponds to NAXIS1.
 */
public class FitsImageArtifact implements ImageArtifact {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(FitsImageArtifact.class);

  // -- Constants --

  /** Image type reported in the summary messages. */
  public static final String IMAGE_TYPE = "FITSImage";

  // -- Fields --

  private final String type;
  private final Path path;
  private final RandomAccessInputStream in;
  private final FitsHeader header;
  private final FitsCoordinateSystem coordinateSystem;

  private final int[] shape;
  private final int bitpix;
  private final double bscale;
  private final double bzero;
  private final DataType dataType;
  private final List<String> axisNames;
  private final List<String> axisUnits;

  // -- Constructor --

  /**
   * Open a FITS file and parse its primary header.
   *
   * @param path FITS file
   * @param type artifact type name
   * @throws IOException if the file cannot be read or is not a
   *         supported FITS image
   */
  public FitsImageArtifact(Path path, String type) throws IOException {
    this.type = type;
    this.path = path;
    in = new RandomAccessInputStream(path.toString());
    try {
      header = FitsHeader.read(in);
      int naxis = header.getInt("NAXIS");
      if (naxis == 0) {
        throw new IOException(path + " contains no image data");
      }
      shape = new int[naxis];
      for (int a=0; a<naxis; a++) {
        shape[a] = header.getInt("NAXIS" + (a + 1));
      }
      bitpix = header.getInt("BITPIX");
      bscale = header.getDouble("BSCALE", 1.0);
      bzero = header.getDouble("BZERO", 0.0);
      dataType = ZarrTypes.getZarrType(bitpix, isScaled());

      long pixels = 1;
      for (int length : shape) {
        pixels *= length;
      }
      long expected =
        header.getDataOffset() + pixels * (Math.abs(bitpix) / 8);
      if (in.length() < expected) {
        throw new IOException("Truncated FITS data in " + path +
          ": expected " + expected + " bytes, found " + in.length());
      }

      coordinateSystem = new FitsCoordinateSystem(header, naxis);
      axisNames = new ArrayList<String>();
      axisUnits = new ArrayList<String>();
      for (int a=0; a<naxis; a++) {
        String coordinateType =
          FitsCoordinateSystem.coordinateType(coordinateSystem.getType(a));
        axisNames.add(axisName(coordinateType, a));
        axisUnits.add(axisUnit(coordinateType, a));
      }
    }
    catch (IOException | RuntimeException e) {
      in.close();
      throw e;
    }
    LOGGER.debug("Opened {} artifact {} with shape {}",
      type, path, Arrays.toString(shape));
  }

  // -- ImageArtifact API methods --

  @Override
  public String getType() {
    return type;
  }

  @Override
  public Path getPath() {
    return path;
  }

  @Override
  public int getAxisCount() {
    return shape.length;
  }

  @Override
  public int[] getShape() {
    return shape.clone();
  }

  @Override
  public List<String> getAxisNames() {
    return Collections.unmodifiableList(axisNames);
  }

  @Override
  public List<String> getAxisUnits() {
    return Collections.unmodifiableList(axisUnits);
  }

  @Override
  public Map<String, SummaryValue> getSummary() {
    int naxis = shape.length;
    double[] incr = new double[naxis];
    double[] refpix = new double[naxis];
    double[] refval = new double[naxis];
    for (int a=0; a<naxis; a++) {
      incr[a] = coordinateSystem.getIncrement(a);
      refpix[a] = coordinateSystem.getReferencePixel(a);
      refval[a] = coordinateSystem.getReferenceValue(a);
    }
    int[] tileShape = shape.clone();
    tileShape[naxis - 1] = 1;

    Map<String, SummaryValue> summary =
      new LinkedHashMap<String, SummaryValue>();
    summary.put("axisnames",
      SummaryValue.text(axisNames.toArray(new String[naxis])));
    summary.put("axisunits",
      SummaryValue.text(axisUnits.toArray(new String[naxis])));
    summary.put("defaultmask", SummaryValue.text(""));
    summary.put("hasmask", SummaryValue.scalar(Boolean.FALSE));
    summary.put("imagetype", SummaryValue.text(getImageQuantity()));
    summary.put("incr", SummaryValue.scalar(incr));
    summary.put("masks", SummaryValue.text(new String[0]));
    summary.put("ndim", SummaryValue.scalar(naxis));
    summary.put("refpix", SummaryValue.scalar(refpix));
    summary.put("refval", SummaryValue.scalar(refval));
    if (header.containsKey("BMAJ") && header.containsKey("BMIN")) {
      Map<String, SummaryValue> beam =
        new LinkedHashMap<String, SummaryValue>();
      beam.put("major",
        quantity(header.getDouble("BMAJ", 0) * 3600, "arcsec"));
      beam.put("minor",
        quantity(header.getDouble("BMIN", 0) * 3600, "arcsec"));
      beam.put("positionangle", quantity(header.getDouble("BPA", 0), "deg"));
      summary.put("restoringbeam", SummaryValue.nested(beam));
    }
    summary.put("shape", SummaryValue.scalar(shape.clone()));
    summary.put("tileshape", SummaryValue.scalar(tileShape));
    summary.put("unit", SummaryValue.text(header.getString("BUNIT", "")));
    summary.put("messages",
      SummaryValue.text(getMessages().toArray(new String[0])));
    return summary;
  }

  @Override
  public List<String> getMessages() {
    List<String> lines = new ArrayList<String>();
    lines.add(label("Image name", 16) + path.getFileName());
    if (header.containsKey("OBJECT")) {
      lines.add(label("Object name", 16) + header.getString("OBJECT", ""));
    }
    lines.add(label("Image type", 16) + IMAGE_TYPE);
    lines.add(label("Image quantity", 16) + getImageQuantity());
    lines.add(label("Pixel mask(s)", 16) + "None");
    lines.add(label("Region(s)", 16) + "None");
    lines.add(label("Image units", 16) + header.getString("BUNIT", ""));
    if (header.containsKey("BMAJ") && header.containsKey("BMIN")) {
      lines.add(label("Restoring Beam", 16) + String.format(
        "%s arcsec, %s arcsec, %s deg",
        header.getDouble("BMAJ", 0) * 3600,
        header.getDouble("BMIN", 0) * 3600,
        header.getDouble("BPA", 0)));
    }
    addOptional(lines, "Direction reference", "RADESYS");
    addOptional(lines, "Spectral  reference", "SPECSYS");
    if (header.containsKey("RESTFRQ")) {
      lines.add(label("Rest frequency", 19) +
        header.getDouble("RESTFRQ", 0) + " Hz");
    }
    addOptional(lines, "Telescope", "TELESCOP");
    addOptional(lines, "Observer", "OBSERVER");
    addOptional(lines, "Date observation", "DATE-OBS");
    lines.add("");
    lines.add(String.format("%-4s %-16s %-4s %6s %16s %16s %s",
      "Axis", "Name", "Proj", "Shape", "Coord value", "Coord incr", "Units"));
    for (int a=0; a<shape.length; a++) {
      lines.add(String.format("%-4d %-16s %-4s %6d %16.8e %16.8e %s",
        a, axisNames.get(a),
        FitsCoordinateSystem.projection(coordinateSystem.getType(a)),
        shape[a], coordinateSystem.getReferenceValue(a),
        coordinateSystem.getIncrement(a), axisUnits.get(a)));
    }
    return Collections.singletonList(String.join("\n", lines));
  }

  @Override
  public Chunk getChunk(int[] start, int[] end) throws IOException {
    int naxis = shape.length;
    if (start.length != naxis || end.length != naxis) {
      throw new IllegalArgumentException("Expected " + naxis +
        " indexes, found " + start.length + " and " + end.length);
    }
    int[] lo = new int[naxis];
    int[] boxShape = new int[naxis];
    // FITS stores the first axis fastest
    long[] strides = new long[naxis];
    for (int a=0; a<naxis; a++) {
      lo[a] = start[a] == FULL_RANGE ? 0 : start[a];
      int hi = end[a] == FULL_RANGE ? shape[a] - 1 : end[a];
      if (lo[a] < 0 || hi < lo[a] || hi >= shape[a]) {
        throw new IllegalArgumentException("Invalid range [" + start[a] +
          ", " + end[a] + "] for axis " + a + " of length " + shape[a]);
      }
      boxShape[a] = hi - lo[a] + 1;
      strides[a] = a == 0 ? 1 : strides[a - 1] * shape[a - 1];
    }

    // row-major output: the last axis varies fastest
    int[] outputStrides = new int[naxis];
    outputStrides[naxis - 1] = 1;
    for (int a=naxis-2; a>=0; a--) {
      outputStrides[a] = outputStrides[a + 1] * boxShape[a + 1];
    }

    // read one contiguous run along the first FITS axis at a time
    int bytesPerPixel = Math.abs(bitpix) / 8;
    byte[] run = new byte[boxShape[0] * bytesPerPixel];
    ByteBuffer buffer = ByteBuffer.wrap(run).order(ByteOrder.BIG_ENDIAN);
    Chunk chunk = Chunk.allocate(dataType, boxShape);
    Object storage = chunk.getStorage();
    int runs = chunk.getSize() / boxShape[0];
    int[] position = new int[naxis];
    for (int r=0; r<runs; r++) {
      long first = lo[0];
      int output = 0;
      for (int a=1; a<naxis; a++) {
        first += (lo[a] + position[a]) * strides[a];
        output += position[a] * outputStrides[a];
      }
      in.seek(header.getDataOffset() + first * bytesPerPixel);
      in.readFully(run);
      buffer.rewind();
      for (int i=0; i<boxShape[0]; i++) {
        int index = output + i * outputStrides[0];
        if (isScaled()) {
          ((double[]) storage)[index] = readScaled(buffer);
        }
        else {
          ZarrTypes.copy(dataType, buffer, storage, index);
        }
      }
      for (int a=1; a<naxis; a++) {
        if (++position[a] < boxShape[a]) {
          break;
        }
        position[a] = 0;
      }
    }
    return chunk;
  }

  @Override
  public double[][] toWorldMany(double[][] pixels) throws CoordinateException {
    return coordinateSystem.toWorldMany(pixels);
  }

  @Override
  public void close() throws IOException {
    LOGGER.debug("Closing {} artifact {}", type, path);
    in.close();
  }

  // -- Helper methods --

  private boolean isScaled() {
    return bscale != 1.0 || bzero != 0.0;
  }

  private double readScaled(ByteBuffer buffer) {
    double raw;
    switch (bitpix) {
      case 8:
        raw = buffer.get() & 0xff;
        break;
      case 16:
        raw = buffer.getShort();
        break;
      case 32:
        raw = buffer.getInt();
        break;
      case -32:
        raw = buffer.getFloat();
        break;
      default:
        raw = buffer.getDouble();
        break;
    }
    return raw * bscale + bzero;
  }

  private String getImageQuantity() {
    return header.getString("BTYPE", "Intensity");
  }

  private String axisUnit(String coordinateType, int axis) {
    if (coordinateSystem.isCelestial(axis)) {
      return AxisType.ANGULAR_UNIT;
    }
    String unit = coordinateSystem.getUnit(axis);
    if (unit.isEmpty() && coordinateType.equals("FREQ")) {
      return "Hz";
    }
    return unit;
  }

  private void addOptional(List<String> lines, String label, String key) {
    if (header.containsKey(key)) {
      lines.add(label(label, 19) + header.getString(key, ""));
    }
  }

  private static String label(String name, int width) {
    return String.format("%-" + width + "s: ", name);
  }

  private static SummaryValue quantity(double value, String unit) {
    Map<String, SummaryValue> q = new LinkedHashMap<String, SummaryValue>();
    q.put("unit", SummaryValue.text(unit));
    q.put("value", SummaryValue.scalar(value));
    return SummaryValue.nested(q);
  }

  /**
   * @param coordinateType coordinate type from CTYPE
   * @param axis axis index
   * @return physical axis name
   */
  static String axisName(String coordinateType, int axis) {
    switch (coordinateType) {
      case "RA":
        return "Right Ascension";
      case "DEC":
        return "Declination";
      case "GLON":
      case "ELON":
        return "Longitude";
      case "GLAT":
      case "ELAT":
        return "Latitude";
      case "FREQ":
        return "Frequency";
      case "STOKES":
        return "Stokes";
      case "":
        return "Axis " + (axis + 1);
      default:
        return coordinateType;
    }
  }

}
