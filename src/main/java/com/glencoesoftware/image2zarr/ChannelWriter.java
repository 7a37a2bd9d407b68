/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams a group of artifacts that share one shape into a single output
 * store, one frequency channel at a time.
 *
 * The first channel creates the store, including the attributes; every
 * later channel is appended along the frequency dimension.  Artifacts are
 * opened and closed within each channel, so no handle outlives a channel
 * and at most one channel of each artifact is held in memory.  Channels
 * are written in increasing order as each append extends the store.
 */
public class ChannelWriter {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(ChannelWriter.class);

  /** Name of the dimension written one channel at a time. */
  public static final String FREQUENCY = "frequency";

  private final ArtifactOpener opener;
  private final ArrayStore store;
  private final ZarrCompression compression;
  private final IProgressListener progressListener;

  /**
   * @param opener artifact factory
   * @param store output store
   * @param compression compression for every array in the output
   * @param progressListener channel progress listener
   */
  public ChannelWriter(ArtifactOpener opener, ArrayStore store,
    ZarrCompression compression, IProgressListener progressListener)
  {
    this.opener = opener;
    this.store = store;
    this.compression = compression;
    this.progressListener = progressListener;
  }

  /**
   * Write every frequency channel of the given artifacts to one store.
   * Any existing store at the output path is deleted first.  Failures are
   * not retried and a partially written store is left in place.
   *
   * @param name group name used for logging and progress
   * @param metadata snapshot shared by all artifacts in the group
   * @param artifacts artifact locations keyed by data variable name
   * @param output store location
   * @throws IOException if an artifact cannot be read or the store
   *         cannot be written
   */
  public void write(String name, ArtifactMetadata metadata,
    Map<String, ArtifactLocation> artifacts, Path output)
    throws IOException
  {
    int frequencyAxis = metadata.getAxis(FREQUENCY);
    int[] shape = metadata.getShape();
    int channels = shape[frequencyAxis];

    store.delete(output);
    progressListener.notifyGroupStart(name, channels);

    int[] start = new int[shape.length];
    Arrays.fill(start, ImageArtifact.FULL_RANGE);
    for (int channel=0; channel<channels; channel++) {
      LOGGER.debug("processing {} channel {} of {}",
        name, channel + 1, channels);
      progressListener.notifyChannelStart(channel);
      start[frequencyAxis] = channel;

      Map<String, LabeledArray> variables =
        new LinkedHashMap<String, LabeledArray>();
      for (Map.Entry<String, ArtifactLocation> entry : artifacts.entrySet()) {
        variables.put(entry.getKey(),
          readChannel(entry.getValue(), metadata, start));
      }

      CoordinateSet coords =
        metadata.getCoordinates().narrow(FREQUENCY, channel);
      if (channel == 0) {
        store.create(output, new ChannelRecord(
          variables, coords, metadata.getAttributes()), compression);
      }
      else {
        store.append(output, new ChannelRecord(variables, coords,
          Collections.<String, Object>emptyMap()), FREQUENCY);
      }
      progressListener.notifyChannelEnd(channel);
    }
    progressListener.notifyGroupEnd(name);
  }

  private LabeledArray readChannel(ArtifactLocation location,
    ArtifactMetadata metadata, int[] window) throws IOException
  {
    Slf4JStopWatch t0 = stopWatch();
    try (ImageArtifact artifact =
      opener.open(location.getPath(), location.getType()))
    {
      Chunk chunk = artifact.getChunk(window, window);
      return new LabeledArray(metadata.getDims(), chunk);
    }
    finally {
      t0.stop("readChannel." + location.getType());
    }
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
