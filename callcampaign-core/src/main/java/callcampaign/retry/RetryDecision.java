package callcampaign.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Answer of a {@link RetryPolicy} for a failed attempt.
 *
 * <ul>
 *   <li>{@link Retry}: dispatch again after {@link Retry#delay()}.</li>
 *   <li>{@link GiveUp}: stop; {@link GiveUp#reason()} tells whether the retry budget ran out
 *       on a transient error or the error is not retryable at all.</li>
 * </ul>
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    static Retry retry(Duration delay) {
        return new Retry(delay);
    }

    static GiveUp exhausted() {
        return GiveUp.EXHAUSTED;
    }

    static GiveUp notRetryable() {
        return GiveUp.NOT_RETRYABLE;
    }

    /**
     * Retry after the given delay.
     *
     * @param delay non-negative wait before the next attempt
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }
    }

    /**
     * Do not retry.
     *
     * @param reason why retrying stopped
     */
    record GiveUp(Reason reason) implements RetryDecision {
        static final GiveUp EXHAUSTED = new GiveUp(Reason.EXHAUSTED);
        static final GiveUp NOT_RETRYABLE = new GiveUp(Reason.NOT_RETRYABLE);

        public GiveUp {
            Objects.requireNonNull(reason, "reason");
        }

        public enum Reason {
            /** The error was transient but the attempt count reached the maximum. */
            EXHAUSTED,
            /** The error is terminal; retrying cannot fix it. */
            NOT_RETRYABLE
        }
    }
}
