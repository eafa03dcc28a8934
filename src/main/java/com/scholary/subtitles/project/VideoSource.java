package com.scholary.subtitles.project;

/**
 * A parsed video source: the platform and the platform's video id.
 *
 * <p>The video id doubles as the project id.
 */
public record VideoSource(VideoPlatform platform, String videoId) {

  public String sourceUrl() {
    return platform.sourceUrl(videoId);
  }
}
