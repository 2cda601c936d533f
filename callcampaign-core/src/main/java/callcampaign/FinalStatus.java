package callcampaign;

/**
 * Terminal status of a contact within a campaign run.
 */
public enum FinalStatus {
  /** A call attempt succeeded. */
  SUCCEEDED,
  /** A non-retryable error ended the contact (invalid number, auth, rejected request). */
  FAILED,
  /** Transient errors exhausted the retry budget. */
  GAVE_UP,
  /** The run was cancelled or aborted before the contact could finish. */
  CANCELLED
}
