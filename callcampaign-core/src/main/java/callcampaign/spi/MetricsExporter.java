package callcampaign.spi;

import callcampaign.ErrorKind;

/**
 * Observability hook for exporting campaign counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of call initiations accepted by the calling service.
     */
    void incrementCallInitiated();

    /**
     * Increments the count of contacts whose call succeeded.
     */
    void incrementCallSucceeded();

    /**
     * Increments the count of failed attempts (each retry counts).
     *
     * @param kind why the attempt failed
     */
    void incrementAttemptFailed(ErrorKind kind);

    /**
     * Increments the count of contacts ended by a terminal error.
     */
    void incrementContactFailed();

    /**
     * Increments the count of contacts that exhausted their retry budget.
     */
    void incrementContactGaveUp();

    /**
     * Increments the count of contacts emitted as cancelled.
     */
    void incrementContactCancelled();

    /**
     * Records the number of contacts currently being worked on.
     *
     * @param inFlight contacts between pickup and final result
     */
    void recordInFlight(int inFlight);

    /**
     * Records how many workers are blocked on the rate limiter.
     *
     * @param waiting number of waiting workers
     */
    default void recordRateLimiterWaiting(int waiting) {
    }

    /**
     * Records the time from initiation to terminal remote status of one attempt.
     *
     * @param durationMs call duration in milliseconds (always non-negative)
     */
    default void recordCallDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementCallInitiated() {
        }

        @Override
        public void incrementCallSucceeded() {
        }

        @Override
        public void incrementAttemptFailed(ErrorKind kind) {
        }

        @Override
        public void incrementContactFailed() {
        }

        @Override
        public void incrementContactGaveUp() {
        }

        @Override
        public void incrementContactCancelled() {
        }

        @Override
        public void recordInFlight(int inFlight) {
        }
    }
}
