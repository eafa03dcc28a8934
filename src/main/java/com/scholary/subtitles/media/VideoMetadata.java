package com.scholary.subtitles.media;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The subset of yt-dlp's info JSON the pipeline uses. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VideoMetadata(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("duration") Double durationSeconds,
    @JsonProperty("webpage_url") String webpageUrl) {}
