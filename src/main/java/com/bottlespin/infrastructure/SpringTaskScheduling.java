package com.bottlespin.infrastructure;

import com.bottlespin.application.port.ScheduledTask;
import com.bottlespin.application.port.TaskScheduling;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/** {@link TaskScheduling} on top of Spring's {@link TaskScheduler}. */
@Component
public class SpringTaskScheduling implements TaskScheduling {
  private final TaskScheduler scheduler;

  public SpringTaskScheduling(@Qualifier("gameTaskScheduler") TaskScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @Override
  public ScheduledTask schedule(Runnable task, Duration delay) {
    ScheduledFuture<?> f = scheduler.schedule(task, Instant.now().plus(delay));
    return new FutureTask(f);
  }

  private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {
    @Override
    public boolean cancel() {
      return future.cancel(false);
    }

    @Override
    public boolean isDone() {
      return future.isDone();
    }
  }
}
