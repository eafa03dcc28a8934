package com.scholary.subtitles.config;

import com.scholary.subtitles.translation.TranslationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TranslationProperties.class)
public class TranslationConfig {}
