package com.scholary.subtitles.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to process a video.
 *
 * @param source page URL or bare video id
 * @param translationHint optional program description given to the translator
 */
public record ProjectSubmitRequest(@NotBlank String source, String translationHint) {}
