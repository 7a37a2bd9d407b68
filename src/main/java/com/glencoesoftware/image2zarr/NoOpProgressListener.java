/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

public class NoOpProgressListener implements IProgressListener {

  @Override
  public void notifyStart(int groupCount, long channelCount) {
  }

  @Override
  public void notifyGroupStart(String group, int channelCount) {
  }

  @Override
  public void notifyGroupEnd(String group) {
  }

  @Override
  public void notifyChannelStart(int channel) {
  }

  @Override
  public void notifyChannelEnd(int channel) {
  }

}
