package com.scholary.subtitles.translation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Token counts reported for one generation request. Absent counts are zero. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageMetadata(
    long promptTokenCount,
    long cachedContentTokenCount,
    long candidatesTokenCount,
    long thoughtsTokenCount) {}
