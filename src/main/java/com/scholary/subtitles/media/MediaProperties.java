package com.scholary.subtitles.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external media tools.
 *
 * @param ffmpegBin ffmpeg executable
 * @param ytDlpBin yt-dlp executable
 * @param cookiesFile optional Netscape cookies file passed to yt-dlp
 * @param processTimeoutMinutes upper bound for a single tool invocation
 */
@ConfigurationProperties(prefix = "media")
@Validated
public record MediaProperties(
    @NotBlank String ffmpegBin,
    @NotBlank String ytDlpBin,
    Path cookiesFile,
    @Positive long processTimeoutMinutes) {}
