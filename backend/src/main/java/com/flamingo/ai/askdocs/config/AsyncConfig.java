package com.flamingo.ai.askdocs.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors used to bound calls that run outside the request thread. */
@Configuration
public class AsyncConfig {

  /** Runs document parsing so a stuck parse can be abandoned after the configured timeout. */
  @Bean(name = "documentParsingExecutor")
  public Executor documentParsingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(20);
    executor.setThreadNamePrefix("doc-parse-");
    executor.initialize();
    return executor;
  }
}
