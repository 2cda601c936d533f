package callcampaign.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with an optional upward jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}. With a jitter
 * fraction {@code j} the delay is multiplied by a random factor in {@code [1, 1 + j)} and capped
 * again, so jitter never shortens the nominal delay.
 */
public final class ExponentialBackoff {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  /**
   * @param baseDelay delay before the first retry
   * @param maxDelay  maximum delay cap
   */
  public ExponentialBackoff(Duration baseDelay, Duration maxDelay) {
    this(baseDelay, maxDelay, 0.0);
  }

  /**
   * @param baseDelay delay before the first retry
   * @param maxDelay  maximum delay cap
   * @param jitter    extra random fraction in {@code [0, 1]}
   */
  public ExponentialBackoff(Duration baseDelay, Duration maxDelay, double jitter) {
    long baseDelayMs = baseDelay.toMillis();
    long maxDelayMs = maxDelay.toMillis();
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelay must be >= 0, got: " + baseDelay);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
    }
    if (jitter < 0.0 || jitter > 1.0) {
      throw new IllegalArgumentException("jitter must be within [0, 1], got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  public Duration maxDelay() {
    return Duration.ofMillis(maxDelayMs);
  }

  /**
   * Computes the delay after the given number of attempts.
   *
   * @param attempts the number of attempts so far (1-based)
   * @return delay, never negative and never above {@code maxDelay}
   */
  public Duration delayAfter(int attempts) {
    if (attempts <= 0 || baseDelayMs == 0) {
      return Duration.ZERO;
    }
    long expDelay;
    if (attempts >= 31) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempts - 1);
      // shift > maxDelayMs / baseDelayMs would overflow or exceed the cap anyway
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (jitter > 0.0) {
      double factor = ThreadLocalRandom.current().nextDouble(1.0, 1.0 + jitter);
      capped = Math.min(maxDelayMs, (long) (capped * factor));
    }
    return Duration.ofMillis(capped);
  }
}
