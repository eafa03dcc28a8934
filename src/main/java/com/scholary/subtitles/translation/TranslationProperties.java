package com.scholary.subtitles.translation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gemini translator.
 *
 * @param baseUrl Gemini API root
 * @param apiKey API key; may be left empty until a run actually reaches translation
 * @param model model id, also used to look up pricing
 * @param maxContinuations how many times a reply cut off by the token limit may be continued
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout per-request timeout in seconds; generation can take tens of minutes
 * @param filePollIntervalSeconds delay between checks of an uploaded file's processing state
 * @param fileMaxWaitMinutes how long an uploaded file may stay in processing
 * @param instructionResource classpath location of the system instruction
 */
@ConfigurationProperties(prefix = "translation")
@Validated
public record TranslationProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int maxContinuations,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int filePollIntervalSeconds,
    @Positive int fileMaxWaitMinutes,
    @NotBlank String instructionResource) {}
