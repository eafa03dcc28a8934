package com.scholary.subtitles.config;

import com.scholary.subtitles.asr.AsrProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the speech recognizer client.
 *
 * <p>Enables the AsrProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(AsrProperties.class)
public class AsrConfig {}
