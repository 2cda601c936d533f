package callcampaign.client;

/**
 * Call status as reported by the calling service.
 */
public enum RemoteCallStatus {
  /** Queued, ringing or in progress. */
  PENDING,
  /** Completed; a transcript may be fetched. */
  SUCCEEDED,
  /** Ended without a conversation (busy, no answer, carrier error). */
  FAILED
}
