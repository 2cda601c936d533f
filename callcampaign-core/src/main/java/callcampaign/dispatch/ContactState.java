package callcampaign.dispatch;

/**
 * States of the per-contact state machine driven by a dispatch worker.
 *
 * <pre>
 * QUEUED → NORMALIZING → NORMALIZE_FAILED
 *                      → DISPATCHING → AWAITING → SUCCEEDED
 *                                               → RETRYING → DISPATCHING
 *                                               → GAVE_UP | FAILED
 * any non-terminal state → CANCELLED
 * </pre>
 */
public enum ContactState {
  QUEUED,
  NORMALIZING,
  NORMALIZE_FAILED,
  DISPATCHING,
  AWAITING,
  RETRYING,
  SUCCEEDED,
  GAVE_UP,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == NORMALIZE_FAILED || this == SUCCEEDED || this == GAVE_UP
        || this == FAILED || this == CANCELLED;
  }
}
