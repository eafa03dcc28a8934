package com.scholary.subtitles.config;

import com.scholary.subtitles.objectstore.ObjectStoreClient;
import com.scholary.subtitles.objectstore.ObjectStoreProperties;
import com.scholary.subtitles.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>The recognizer reads audio from here, so the endpoint must be reachable from the recognizer's
 * network.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
