package com.scholary.censor.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for censor beans.
 *
 * <p>Enables {@link CensorProperties} and sets up the bounded pool that matches subtitle events
 * in parallel.
 */
@Configuration
@EnableConfigurationProperties(CensorProperties.class)
public class CensorConfig {

  @Bean(name = "maskingExecutor")
  public Executor maskingExecutor(CensorProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.masking().threads());
    executor.setMaxPoolSize(properties.masking().threads());
    executor.setQueueCapacity(properties.masking().queueSize());
    // A full queue runs the event on the submitting thread instead of failing the run
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setThreadNamePrefix("masking-");
    executor.initialize();
    return executor;
  }
}
