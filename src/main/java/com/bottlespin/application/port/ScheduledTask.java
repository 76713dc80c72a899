package com.bottlespin.application.port;

/** Handle to a pending one-shot task. */
public interface ScheduledTask {
  /**
   * Cancel the task if it has not run yet.
   *
   * @return true if the task will no longer run
   */
  boolean cancel();

  boolean isDone();
}
