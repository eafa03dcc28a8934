package com.scholary.subtitles.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Complete recognizer result for one audio file.
 *
 * <p>Mirrors the JSON document the recognizer publishes at its transcription URL. Time fields are
 * integer milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsrResult(
    @JsonProperty(value = "file_url", required = true) String fileUrl,
    @JsonProperty(value = "properties", required = true) AudioProperties properties,
    @JsonProperty(value = "transcripts", required = true) List<ChannelTranscript> transcripts) {

  public AsrResult {
    transcripts = transcripts == null ? List.of() : List.copyOf(transcripts);
  }

  public Optional<ChannelTranscript> channel(int channelId) {
    return transcripts.stream().filter(t -> t.channelId() == channelId).findFirst();
  }
}
