package com.ospicorp.heartrate.config;

import com.ospicorp.heartrate.query.IntervalResolver;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class QueryConfig {

  @Bean
  Clock clock(@Value("${timeseries.zone-offset:Z}") ZoneOffset zoneOffset) {
    return Clock.system(zoneOffset);
  }

  @Bean
  IntervalResolver intervalResolver(
      @Value("${query.resolution.raw-below:2m}") Duration rawBelow,
      @Value("${query.resolution.minute-up-to:2h}") Duration minuteUpTo,
      @Value("${query.resolution.hour-up-to:7d}") Duration hourUpTo) {
    return new IntervalResolver(rawBelow, minuteUpTo, hourUpTo);
  }

  /** Fan-out pool sized to the connection pool so concurrent queries never outnumber connections. */
  @Bean
  ThreadPoolTaskExecutor queryFanoutExecutor(@Value("${spring.datasource.hikari.maximum-pool-size:10}") int poolSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setThreadNamePrefix("query-fanout-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}
