package com.scholary.subtitles.media;

import java.io.IOException;
import java.nio.file.Path;

/** Fetches metadata for and downloads videos from a source page URL. */
public interface VideoSourceClient {

  VideoMetadata fetchMetadata(String sourceUrl) throws IOException;

  /**
   * Download every part of the video into {@code directory}, one file per part named by playlist
   * index ({@code 0.mp4} for a single video).
   */
  void download(String sourceUrl, Path directory) throws IOException;
}
