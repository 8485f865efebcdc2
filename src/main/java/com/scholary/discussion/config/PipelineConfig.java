package com.scholary.discussion.config;

import com.scholary.discussion.analysis.AnalysisProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Core pipeline configuration.
 *
 * <p>Enables the pipeline and analysis properties and provides the time source every component
 * reads "now" from.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, AnalysisProperties.class})
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
