/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.util.EventListener;

public interface IProgressListener extends EventListener {

  /**
   * Indicates the total amount of work in this conversion operation.
   *
   * @param groupCount total number of output stores
   * @param channelCount total number of channels across all output stores
   */
  void notifyStart(int groupCount, long channelCount);

  /**
   * Indicates the beginning of processing a particular output store.
   *
   * @param group name of the group being written
   * @param channelCount total number of channels in this group
   */
  void notifyGroupStart(String group, int channelCount);

  /**
   * Indicates the end of processing a particular output store.
   *
   * @param group name of the group being written
   */
  void notifyGroupEnd(String group);

  /**
   * Indicates that the given channel is about to be processed.
   *
   * @param channel channel index
   */
  void notifyChannelStart(int channel);

  /**
   * Indicates that the given channel has been written.
   *
   * @param channel channel index
   */
  void notifyChannelEnd(int channel);

}
