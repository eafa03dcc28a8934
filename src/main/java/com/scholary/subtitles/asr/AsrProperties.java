package com.scholary.subtitles.asr;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the DashScope speech recognizer.
 *
 * @param baseUrl DashScope HTTP API root
 * @param apiKey bearer token; may be left empty until a run actually reaches recognition
 * @param model recognizer model id
 * @param languageHints languages the audio is expected to contain
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout per-request timeout in seconds
 * @param maxRetries attempts per HTTP call before giving up
 * @param retryDelayMs fixed delay between attempts
 * @param pollIntervalSeconds delay between task status checks
 * @param maxWaitMinutes how long to wait for a task before failing the stage
 * @param fileUrlTtlHours lifetime of the presigned audio URL handed to the recognizer
 * @param objectKeyPrefix prefix of the temporary audio objects
 */
@ConfigurationProperties(prefix = "asr")
@Validated
public record AsrProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @NotEmpty List<String> languageHints,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @PositiveOrZero long retryDelayMs,
    @Positive int pollIntervalSeconds,
    @Positive int maxWaitMinutes,
    @Positive int fileUrlTtlHours,
    @NotBlank String objectKeyPrefix) {}
