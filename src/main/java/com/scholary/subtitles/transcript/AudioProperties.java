package com.scholary.subtitles.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Properties of the recognized audio as reported by the recognizer. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AudioProperties(
    @JsonProperty("audio_format") String audioFormat,
    @JsonProperty("channels") List<Integer> channels,
    @JsonProperty("original_sampling_rate") Integer originalSamplingRate,
    @JsonProperty("original_duration_in_milliseconds") Long originalDurationInMilliseconds) {}
