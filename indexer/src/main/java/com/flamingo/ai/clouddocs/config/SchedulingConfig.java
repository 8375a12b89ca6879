package com.flamingo.ai.clouddocs.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Configuration for the crawler's dispatcher thread and time source. */
@Configuration
public class SchedulingConfig {

  /**
   * Single-threaded scheduler that owns the rate controller's queue and state.
   *
   * @return the scheduler bean
   */
  @Bean(name = "rateControllerScheduler")
  public ThreadPoolTaskScheduler rateControllerScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("rate-ctl-");
    scheduler.setDaemon(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.initialize();
    return scheduler;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
