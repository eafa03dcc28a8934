package com.scholary.subtitles.api;

import java.time.Instant;

/** Error body returned by every failed API call. */
public record ApiError(String error, String message, String details, Instant timestamp) {}
