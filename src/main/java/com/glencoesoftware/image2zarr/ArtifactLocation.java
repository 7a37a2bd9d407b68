/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.nio.file.Path;

/**
 * Type name and on-disk location of an artifact.
 */
public class ArtifactLocation {

  private final String type;
  private final Path path;

  /**
   * @param type artifact type name
   * @param path artifact location
   */
  public ArtifactLocation(String type, Path path) {
    this.type = type;
    this.path = path;
  }

  /**
   * @return artifact type name
   */
  public String getType() {
    return type;
  }

  /**
   * @return artifact location
   */
  public Path getPath() {
    return path;
  }

  @Override
  public String toString() {
    return type + ":" + path;
  }
}
