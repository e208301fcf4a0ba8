package com.ospicorp.analyticsapi.config;

import com.ospicorp.analyticsapi.analytics.service.ModelingCapabilities;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ModelingConfig {

  private static final Logger log = LoggerFactory.getLogger(ModelingConfig.class);

  @Bean
  ModelingCapabilities modelingCapabilities(
      @Value("${analytics.modeling.arima.enabled:true}") boolean arimaEnabled,
      @Value("${analytics.modeling.isolation-forest.enabled:true}") boolean isolationForestEnabled) {
    log.info("Modeling capabilities: arima={}, isolation-forest={}", arimaEnabled,
        isolationForestEnabled);
    return new ModelingCapabilities(arimaEnabled, isolationForestEnabled);
  }

  /** Runs analytics requests off the servlet threads so one slow fit does not block others. */
  @Bean(name = "analyticsExecutor")
  ThreadPoolTaskExecutor analyticsExecutor(
      @Value("${analytics.executor.core-pool-size:4}") int corePoolSize,
      @Value("${analytics.executor.max-pool-size:8}") int maxPoolSize,
      @Value("${analytics.executor.queue-capacity:100}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("analytics-");
    executor.setTaskDecorator(copyMdc());
    executor.initialize();
    return executor;
  }

  private static TaskDecorator copyMdc() {
    return task -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          task.run();
        } finally {
          MDC.clear();
        }
      };
    };
  }
}
