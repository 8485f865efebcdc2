package com.scholary.discussion.config;

import com.scholary.discussion.analysis.AnalysisProperties;
import com.scholary.discussion.analysis.BoundedTaskRunner;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async session processing.
 *
 * <p>Sessions started from the REST API run on a bounded pool so that a burst of requests queues up
 * instead of spawning unbounded ffmpeg processes and HTTP calls. Model calls share one permit gate
 * sized by {@code analysis.max-concurrent-calls}, whichever pool they run on.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "pipelineExecutor")
  public Executor pipelineExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setQueueCapacity(properties.executorQueueSize());
    executor.setThreadNamePrefix("session-pipeline-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "analysisExecutor")
  public Executor analysisExecutor(AnalysisProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrentCalls());
    executor.setMaxPoolSize(properties.maxConcurrentCalls());
    executor.setThreadNamePrefix("session-analysis-");
    executor.initialize();
    return executor;
  }

  @Bean
  public BoundedTaskRunner analysisTaskRunner(
      AnalysisProperties properties, @Qualifier("analysisExecutor") Executor analysisExecutor) {
    return new BoundedTaskRunner(properties.maxConcurrentCalls(), analysisExecutor);
  }
}
