package callcampaign.retry;

import callcampaign.AttemptStatus;
import callcampaign.CallAttempt;
import callcampaign.ErrorKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Retries transient errors with exponential backoff up to a maximum attempt count.
 *
 * <p>Transient: {@link ErrorKind#SERVICE_UNAVAILABLE}, {@link ErrorKind#RATE_LIMITED},
 * {@link ErrorKind#TIMED_OUT}, {@link ErrorKind#CALL_FAILED}. Terminal:
 * {@link ErrorKind#INVALID_PHONE_NUMBER}, {@link ErrorKind#AUTH_ERROR},
 * {@link ErrorKind#REQUEST_REJECTED}.
 *
 * <p>When a {@code RATE_LIMITED} attempt carries a {@code Retry-After} hint the delay is raised
 * to at least that hint, still capped at the backoff's maximum delay.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(30);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(10);

  private final int maxAttempts;
  private final ExponentialBackoff backoff;

  /**
   * @param maxAttempts maximum attempts per contact, including the first (&ge; 1)
   * @param backoff     delay schedule between attempts
   */
  public DefaultRetryPolicy(int maxAttempts, ExponentialBackoff backoff) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
    this.backoff = Objects.requireNonNull(backoff, "backoff");
  }

  public DefaultRetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
    this(maxAttempts, new ExponentialBackoff(baseDelay, maxDelay));
  }

  /**
   * Returns a policy with 3 attempts, 30 s base delay and a 10 minute cap.
   */
  public static DefaultRetryPolicy defaults() {
    return new DefaultRetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public RetryDecision shouldRetry(CallAttempt attempt, int attemptsSoFar) {
    Objects.requireNonNull(attempt, "attempt");
    AttemptStatus status = attempt.status();
    if (status != AttemptStatus.FAILED && status != AttemptStatus.TIMED_OUT) {
      throw new IllegalArgumentException("Attempt has not failed: " + attempt);
    }
    ErrorKind kind = attempt.errorKind()
        .orElseThrow(() -> new IllegalArgumentException("Failed attempt without error kind: " + attempt));
    if (!isTransient(kind)) {
      return RetryDecision.notRetryable();
    }
    if (attemptsSoFar >= maxAttempts) {
      return RetryDecision.exhausted();
    }
    Duration delay = backoff.delayAfter(attemptsSoFar);
    Duration hint = attempt.retryAfter().orElse(Duration.ZERO);
    if (hint.compareTo(delay) > 0) {
      delay = hint.compareTo(backoff.maxDelay()) > 0 ? backoff.maxDelay() : hint;
    }
    return RetryDecision.retry(delay);
  }

  /**
   * Classifies an error kind. Every constant of {@link ErrorKind} is listed.
   *
   * @param kind the error kind
   * @return {@code true} if retrying may succeed
   */
  public static boolean isTransient(ErrorKind kind) {
    return switch (kind) {
      case SERVICE_UNAVAILABLE, RATE_LIMITED, TIMED_OUT, CALL_FAILED -> true;
      case INVALID_PHONE_NUMBER, AUTH_ERROR, REQUEST_REJECTED -> false;
    };
  }
}
