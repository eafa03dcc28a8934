package com.scholary.subtitles.project;

/** Video platforms a project can be sourced from. */
public enum VideoPlatform {
  BILIBILI("https://www.bilibili.com/video/"),
  TVER("https://tver.jp/episodes/"),
  YOUTUBE("https://www.youtube.com/watch?v=");

  private final String urlPrefix;

  VideoPlatform(String urlPrefix) {
    this.urlPrefix = urlPrefix;
  }

  /** Rebuild the canonical page URL for a video id on this platform. */
  public String sourceUrl(String videoId) {
    return urlPrefix + videoId;
  }
}
