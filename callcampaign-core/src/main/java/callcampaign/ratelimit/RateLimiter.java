package callcampaign.ratelimit;

import callcampaign.CancellationToken;

import java.util.concurrent.CancellationException;

/**
 * Caps the throughput of outbound call initiations.
 *
 * <p>Implementations are shared by all dispatch workers of a run (or, when injected into the
 * dispatcher, by all runs) and must be thread-safe.
 *
 * @see SlidingWindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Blocks until a permit is available. Permits are granted in request order.
     *
     * @param token cancellation signal observed while waiting
     * @return the granted permit
     * @throws InterruptedException  if the calling thread is interrupted
     * @throws CancellationException if {@code token} is cancelled before a permit is granted
     */
    Permit acquire(CancellationToken token) throws InterruptedException;

    /**
     * Returns a permit. Permits that were never {@linkplain Permit#markUsed() used} give their
     * slot back; used permits keep counting until they leave the window. Releasing a permit twice
     * has no effect.
     *
     * @param permit a permit obtained from this limiter
     */
    void release(Permit permit);

    /**
     * Returns the number of callers currently blocked in {@link #acquire}.
     */
    default int waitingCount() {
        return 0;
    }
}
