package com.scholary.discussion.config;

import com.scholary.discussion.archive.ObjectStoreProperties;
import com.scholary.discussion.archive.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the artifact archive.
 *
 * <p>The S3 client is only created with {@code archive.enabled=true}.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ArchiveConfig {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "archive", name = "enabled", havingValue = "true")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
