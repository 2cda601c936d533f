package callcampaign;

/**
 * Every failure a contact or call attempt can end with.
 *
 * <p>Whether a kind is retried is decided by {@link callcampaign.retry.RetryPolicy};
 * {@link callcampaign.retry.DefaultRetryPolicy} classifies each constant explicitly.
 */
public enum ErrorKind {
  /** The raw phone number could not be normalized. Contact-level, never retried. */
  INVALID_PHONE_NUMBER,
  /** The calling service rejected the credentials. Aborts the whole run. */
  AUTH_ERROR,
  /** The calling service rejected the request itself (4xx other than auth or rate limiting). */
  REQUEST_REJECTED,
  /** The calling service is unreachable or failing (5xx, I/O). */
  SERVICE_UNAVAILABLE,
  /** The calling service asked us to slow down. Distinct from the local rate limiter. */
  RATE_LIMITED,
  /** The attempt did not reach a terminal remote status within the attempt timeout. */
  TIMED_OUT,
  /** The call was placed but the remote side reported it failed (busy, no answer). */
  CALL_FAILED
}
