package com.scholary.subtitles.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** A sentence segment from the recognizer, with its words ordered by begin time. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Sentence(
    @JsonProperty(value = "begin_time", required = true) long beginTime,
    @JsonProperty(value = "end_time", required = true) long endTime,
    @JsonProperty(value = "text", required = true) String text,
    @JsonProperty(value = "sentence_id", required = true) int sentenceId,
    @JsonProperty("speaker_id") Integer speakerId,
    @JsonProperty(value = "words", required = true) List<Word> words) {

  public Sentence {
    if (text == null) {
      text = "";
    }
    words = words == null ? List.of() : List.copyOf(words);
  }

  public boolean hasWords() {
    return !words.isEmpty();
  }

  public Word firstWord() {
    return words.get(0);
  }

  public Word lastWord() {
    return words.get(words.size() - 1);
  }
}
