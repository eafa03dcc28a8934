package com.scholary.subtitles.translation;

/**
 * Outcome of one translation.
 *
 * @param continuations how many times the reply had to be continued
 * @param totalCostUsd estimated cost over all requests
 */
public record TranslationResult(int continuations, double totalCostUsd) {}
