package com.scholary.subtitles.config;

import com.scholary.subtitles.media.MediaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the yt-dlp and ffmpeg settings. */
@Configuration
@EnableConfigurationProperties(MediaProperties.class)
public class MediaConfig {}
