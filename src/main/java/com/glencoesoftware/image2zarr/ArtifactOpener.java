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

/**
 * Factory for {@link ImageArtifact} instances.
 */
public interface ArtifactOpener {

  /**
   * @param path candidate artifact location
   * @return true if an artifact exists at the given path
   */
  boolean exists(Path path);

  /**
   * Open the artifact at the given path.
   *
   * @param path artifact location
   * @param type artifact type name
   * @return an open artifact, which the caller must close
   * @throws IOException if the artifact cannot be opened or parsed
   */
  ImageArtifact open(Path path, String type) throws IOException;

}
