package com.scholary.subtitles.translation;

/** Text and stop reason of one model turn. */
public record GeminiReply(String text, String finishReason, UsageMetadata usage) {

  public boolean isComplete() {
    return "STOP".equals(finishReason);
  }

  public boolean isTruncated() {
    return "MAX_TOKENS".equals(finishReason);
  }
}
