package callcampaign;

/**
 * Lifecycle status of a single {@link CallAttempt}.
 */
public enum AttemptStatus {
  PENDING,
  IN_PROGRESS,
  SUCCEEDED,
  FAILED,
  TIMED_OUT;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
  }
}
