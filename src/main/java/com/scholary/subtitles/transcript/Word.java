package com.scholary.subtitles.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single recognized word with its timing in milliseconds.
 *
 * <p>{@code punctuation} is the mark the recognizer attached after this word, or an empty string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Word(
    @JsonProperty(value = "begin_time", required = true) long beginTime,
    @JsonProperty(value = "end_time", required = true) long endTime,
    @JsonProperty(value = "text", required = true) String text,
    @JsonProperty("punctuation") String punctuation) {

  public Word {
    if (text == null) {
      text = "";
    }
    if (punctuation == null) {
      punctuation = "";
    }
  }

  /** The text as it is displayed: word followed by its punctuation. */
  public String displayText() {
    return text + punctuation;
  }
}
