/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr.test;

import com.glencoesoftware.image2zarr.IProgressListener;

import java.util.ArrayList;
import java.util.List;

public class TestProgressListener implements IProgressListener {

  private List<String> finishedGroups = new ArrayList<String>();
  private int startedChannels = 0;
  private int completedChannels = 0;
  private int expectedChannelCount = 0;
  private int groupCount = 0;
  private long totalChannels = 0;

  @Override
  public void notifyStart(int groups, long channelCount) {
    groupCount = groups;
    totalChannels = channelCount;
  }

  @Override
  public void notifyGroupStart(String group, int channelCount) {
    expectedChannelCount = channelCount;
  }

  @Override
  public void notifyChannelStart(int channel) {
    startedChannels++;
  }

  @Override
  public void notifyChannelEnd(int channel) {
    completedChannels++;
  }

  @Override
  public void notifyGroupEnd(String group) {
    if (startedChannels == completedChannels &&
      completedChannels == expectedChannelCount)
    {
      finishedGroups.add(group + ":" + completedChannels);
    }
    completedChannels = 0;
    startedChannels = 0;
  }

  /**
   * Get the groups whose channels were all started and completed.
   *
   * @return one "name:channels" element per completed group
   */
  public List<String> getFinishedGroups() {
    return finishedGroups;
  }

  /**
   * @return the reported number of output stores
   */
  public int getGroupCount() {
    return groupCount;
  }

  /**
   * @return the reported number of total channels for the conversion
   */
  public long getTotalChannelCount() {
    return totalChannels;
  }

}
