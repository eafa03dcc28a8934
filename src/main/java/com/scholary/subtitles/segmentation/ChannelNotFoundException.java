package com.scholary.subtitles.segmentation;

/** Thrown when the requested channel is absent from a recognizer result. */
public class ChannelNotFoundException extends RuntimeException {

  private final int channelId;

  public ChannelNotFoundException(int channelId) {
    super(String.format("Channel %d not found in transcripts", channelId));
    this.channelId = channelId;
  }

  public int getChannelId() {
    return channelId;
  }
}
