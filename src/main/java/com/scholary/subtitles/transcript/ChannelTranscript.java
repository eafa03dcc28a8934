package com.scholary.subtitles.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** The recognized sentences of one audio channel, ordered by begin time. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelTranscript(
    @JsonProperty(value = "channel_id", required = true) int channelId,
    @JsonProperty("content_duration_in_milliseconds") Long contentDurationInMilliseconds,
    @JsonProperty("text") String text,
    @JsonProperty(value = "sentences", required = true) List<Sentence> sentences) {

  public ChannelTranscript {
    sentences = sentences == null ? List.of() : List.copyOf(sentences);
  }

  public static ChannelTranscript of(int channelId, List<Sentence> sentences) {
    return new ChannelTranscript(channelId, null, null, sentences);
  }
}
