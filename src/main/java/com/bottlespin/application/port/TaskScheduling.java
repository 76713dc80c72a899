package com.bottlespin.application.port;

import java.time.Duration;

public interface TaskScheduling {
  /** Run {@code task} once after {@code delay}; returns immediately. */
  ScheduledTask schedule(Runnable task, Duration delay);
}
