package com.scholary.subtitles.translation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A file held by the Gemini Files API. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeminiFile(String name, String uri, String mimeType, String state) {

  public boolean isActive() {
    return "ACTIVE".equals(state);
  }

  public boolean isFailed() {
    return "FAILED".equals(state);
  }
}
