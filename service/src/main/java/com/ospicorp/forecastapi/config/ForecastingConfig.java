package com.ospicorp.forecastapi.config;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.strategy.AutoRegression;
import com.ospicorp.forecastapi.forecasting.strategy.ExponentialSmoothing;
import com.ospicorp.forecastapi.forecasting.strategy.ForecastRegistry;
import com.ospicorp.forecastapi.forecasting.strategy.StrategyFactory;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
@EnableScheduling
public class ForecastingConfig {
  private static final Logger log = LoggerFactory.getLogger(ForecastingConfig.class);

  @Bean
  ForecastRegistry forecastRegistry(
      @Value("${forecasting.auto-regression.stationary:false}") boolean stationary,
      @Value("${forecasting.auto-regression.max-lags:15}") int maxLags,
      @Value("${forecasting.auto-regression.significance-level:0.05}") double significanceLevel,
      @Value("${forecasting.stationarity.max-differences:10}") int maxDifferences,
      @Value("${forecasting.exponential-smoothing.drop-zero-forecasts:true}") boolean dropZero) {
    log.info("Auto-regression: stationary={}, maxLags={}, significance={}, maxDifferences={}",
        stationary, maxLags, significanceLevel, maxDifferences);
    Map<AlgorithmId, StrategyFactory> factories = new EnumMap<>(AlgorithmId.class);
    factories.put(AlgorithmId.AUTO_REGRESSION,
        () -> new AutoRegression(stationary, maxLags, significanceLevel, maxDifferences));
    factories.put(AlgorithmId.EXPONENTIAL_SMOOTHING, () -> new ExponentialSmoothing(dropZero));
    return new ForecastRegistry(factories);
  }

  @Bean
  ThreadPoolTaskExecutor trainingExecutor(
      @Value("${forecasting.training.core-pool-size:2}") int corePoolSize,
      @Value("${forecasting.training.max-pool-size:4}") int maxPoolSize,
      @Value("${forecasting.training.queue-capacity:50}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("training-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }

  // Picked up by @Async; defining trainingExecutor switches off Boot's default task executor.
  @Bean
  @Primary
  ThreadPoolTaskExecutor taskExecutor(
      @Value("${forecasting.writes.pool-size:2}") int poolSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setThreadNamePrefix("forecast-write-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}
