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
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions the artifacts that share a base name into those with the
 * same shape as the reference artifact and those that differ.
 *
 * The reference is the first candidate, in priority order, that exists
 * on disk.  Only shapes are compared; two artifacts with equal shapes
 * but different world coordinates are treated as compatible and share
 * the reference coordinates.
 */
public class CompatibilityGrouper {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(CompatibilityGrouper.class);

  private final ArtifactOpener opener;
  private final CoordinateResolver resolver;
  private final MetadataNormalizer normalizer;

  /**
   * @param opener artifact factory
   */
  public CompatibilityGrouper(ArtifactOpener opener) {
    this(opener, new CoordinateResolver(), new MetadataNormalizer());
  }

  /**
   * @param opener artifact factory
   * @param resolver world coordinate calculator
   * @param normalizer attribute flattener
   */
  public CompatibilityGrouper(ArtifactOpener opener,
    CoordinateResolver resolver, MetadataNormalizer normalizer)
  {
    this.opener = opener;
    this.resolver = resolver;
    this.normalizer = normalizer;
  }

  /**
   * Locate an artifact by the sibling path convention.
   *
   * @param prefix input path without its final extension
   * @param type artifact type name
   * @return path of the form <code>prefix.type</code>
   */
  public static Path artifactPath(String prefix, String type) {
    return Paths.get(prefix + "." + type);
  }

  /**
   * Group the candidate artifacts.
   *
   * @param prefix input path without its final extension
   * @param types candidate types in priority order, primary type first
   * @return reference snapshot with compatible and divergent artifacts
   * @throws IOException if an existing artifact cannot be read
   * @throws CoordinateException if an artifact's coordinates cannot be
   *         resolved
   * @throws IllegalArgumentException if none of the candidates exist
   */
  public ArtifactGroups group(String prefix, List<String> types)
    throws IOException, CoordinateException
  {
    ArtifactMetadata reference = null;
    List<String> compatible = new ArrayList<String>();
    List<DivergentArtifact> divergent = new ArrayList<DivergentArtifact>();

    LinkedHashSet<String> candidates = new LinkedHashSet<String>();
    for (String type : types) {
      if (!candidates.add(type)) {
        LOGGER.warn("Ignoring duplicate artifact type: {}", type);
      }
    }

    for (String type : candidates) {
      Path path = artifactPath(prefix, type);
      if (!opener.exists(path)) {
        LOGGER.debug("Skipping missing artifact {}", path);
        continue;
      }
      ArtifactMetadata snapshot;
      try (ImageArtifact artifact = opener.open(path, type)) {
        snapshot = snapshot(artifact);
      }

      if (reference == null) {
        reference = snapshot;
        compatible.add(type);
      }
      else if (reference.hasSameShape(snapshot)) {
        compatible.add(type);
      }
      else {
        LOGGER.debug("Artifact {} has shape {}, expected {}",
          type, snapshot, reference);
        divergent.add(new DivergentArtifact(type, snapshot));
      }
    }

    if (reference == null) {
      throw new IllegalArgumentException(
        "No image artifacts found with prefix " + prefix);
    }
    return new ArtifactGroups(reference, compatible, divergent);
  }

  /**
   * Capture the coordinates, shape, dimensions and attributes of an
   * open artifact.
   *
   * @param artifact open artifact
   * @return metadata snapshot
   * @throws CoordinateException if coordinates cannot be resolved
   */
  public ArtifactMetadata snapshot(ImageArtifact artifact)
    throws CoordinateException
  {
    CoordinateSet coords = resolver.resolve(artifact);
    List<String> dims = resolver.dimensions(artifact);
    Map<String, Object> attrs =
      normalizer.normalize(artifact.getSummary(), artifact.getMessages());
    return new ArtifactMetadata(coords, artifact.getShape(), dims, attrs);
  }

}
