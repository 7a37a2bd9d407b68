/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr.fits;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.glencoesoftware.image2zarr.ArtifactOpener;
import com.glencoesoftware.image2zarr.ImageArtifact;

/**
 * Opens artifacts stored as FITS files.
 */
public class FitsArtifactOpener implements ArtifactOpener {

  @Override
  public boolean exists(Path path) {
    return Files.isRegularFile(path);
  }

  @Override
  public ImageArtifact open(Path path, String type) throws IOException {
    return new FitsImageArtifact(path, type);
  }

}
