package com.scholary.subtitles.segmentation;

/**
 * A timed subtitle entry ready for serialization.
 *
 * <p>Word-level detail is not retained; the text is already trimmed.
 */
public record DisplayCue(long beginTime, long endTime, String text) {

  public DisplayCue {
    text = text == null ? "" : text;
  }

  public boolean isBlank() {
    return text.isBlank();
  }
}
