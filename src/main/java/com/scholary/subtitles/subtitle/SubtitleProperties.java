package com.scholary.subtitles.subtitle;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for subtitle output.
 *
 * @param dropEmptyCues when false, cues with blank text are kept as blocks with an empty text line
 *     so indexes stay aligned with the original timeline
 */
@ConfigurationProperties(prefix = "subtitle")
public record SubtitleProperties(boolean dropEmptyCues) {}
