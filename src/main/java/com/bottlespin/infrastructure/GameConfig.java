package com.bottlespin.infrastructure;

import java.security.SecureRandom;
import java.util.Random;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class GameConfig {

  /** Source of all game randomness: room codes, first turn, spin results. */
  @Bean
  public Random gameRandom() {
    return new SecureRandom();
  }

  /** Runs delayed turn notifications and abandoned-room checks. */
  @Bean
  public ThreadPoolTaskScheduler gameTaskScheduler(
      @Value("${bottlespin.scheduler-pool-size:2}") int poolSize) {
    ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
    s.setPoolSize(poolSize);
    s.setThreadNamePrefix("game-tasks-");
    s.setRemoveOnCancelPolicy(true);
    s.setWaitForTasksToCompleteOnShutdown(false);
    return s;
  }
}
