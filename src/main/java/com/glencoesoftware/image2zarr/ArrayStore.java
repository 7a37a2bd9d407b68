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
 * Chunked, labeled array store that grows by appending along a dimension.
 */
public interface ArrayStore {

  /**
   * Remove any existing store at the given path.  Not atomic.
   *
   * @param store store location
   * @throws IOException if the store cannot be removed
   */
  void delete(Path store) throws IOException;

  /**
   * Create a new store from its first record.
   *
   * @param store store location
   * @param record initial contents, including store attributes
   * @param compression compression assigned to every array
   * @throws IOException if the store cannot be written
   */
  void create(Path store, ChannelRecord record, ZarrCompression compression)
    throws IOException;

  /**
   * Append a record along the named dimension.  Arrays that do not
   * include the dimension are left unchanged.
   *
   * @param store existing store location
   * @param record contents to append
   * @param dimension dimension to grow
   * @throws IOException if the store cannot be updated
   */
  void append(Path store, ChannelRecord record, String dimension)
    throws IOException;

}
