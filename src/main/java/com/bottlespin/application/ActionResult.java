package com.bottlespin.application;

/**
 * Outcome of a client request.
 *
 * <p>{@code IGNORED} means the request was dropped without any state change or notification,
 * which is how turn and phase violations are handled. {@code REJECTED} means an error was sent to
 * the caller.
 */
public record ActionResult(Outcome outcome, ErrorCode error) {
  private static final ActionResult APPLIED = new ActionResult(Outcome.APPLIED, null);
  private static final ActionResult IGNORED = new ActionResult(Outcome.IGNORED, null);

  public enum Outcome {
    APPLIED,
    IGNORED,
    REJECTED
  }

  public static ActionResult applied() {
    return APPLIED;
  }

  public static ActionResult ignored() {
    return IGNORED;
  }

  public static ActionResult rejected(ErrorCode error) {
    return new ActionResult(Outcome.REJECTED, error);
  }

  public boolean isApplied() {
    return outcome == Outcome.APPLIED;
  }

  public boolean isIgnored() {
    return outcome == Outcome.IGNORED;
  }

  public boolean isRejected() {
    return outcome == Outcome.REJECTED;
  }
}
