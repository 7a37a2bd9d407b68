/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

/**
 * An artifact whose shape differs from the reference artifact,
 * paired with its own metadata snapshot.
 */
public class DivergentArtifact {

  private final String type;
  private final ArtifactMetadata metadata;

  /**
   * @param type artifact type name
   * @param metadata the artifact's own snapshot
   */
  public DivergentArtifact(String type, ArtifactMetadata metadata) {
    this.type = type;
    this.metadata = metadata;
  }

  /**
   * @return artifact type name
   */
  public String getType() {
    return type;
  }

  /**
   * @return the artifact's own snapshot
   */
  public ArtifactMetadata getMetadata() {
    return metadata;
  }

  @Override
  public String toString() {
    return type + "=" + metadata;
  }
}
