/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Result of grouping artifacts by shape: the reference snapshot, the
 * artifact types that share its shape, and every artifact that does not.
 */
public class ArtifactGroups {

  private final ArtifactMetadata reference;
  private final ImmutableList<String> compatible;
  private final ImmutableList<DivergentArtifact> divergent;

  /**
   * @param reference snapshot of the first existing artifact
   * @param compatible types sharing the reference shape, reference first
   * @param divergent artifacts with a different shape
   */
  public ArtifactGroups(ArtifactMetadata reference, List<String> compatible,
    List<DivergentArtifact> divergent)
  {
    this.reference = reference;
    this.compatible = ImmutableList.copyOf(compatible);
    this.divergent = ImmutableList.copyOf(divergent);
  }

  /**
   * @return snapshot of the first existing artifact
   */
  public ArtifactMetadata getReference() {
    return reference;
  }

  /**
   * @return types sharing the reference shape, in priority order
   */
  public List<String> getCompatible() {
    return compatible;
  }

  /**
   * @return artifacts with a different shape, in priority order
   */
  public List<DivergentArtifact> getDivergent() {
    return divergent;
  }

  /**
   * @return list of divergent type names
   */
  public List<String> getDivergentTypes() {
    ImmutableList.Builder<String> types = ImmutableList.builder();
    for (DivergentArtifact d : divergent) {
      types.add(d.getType());
    }
    return types.build();
  }
}
