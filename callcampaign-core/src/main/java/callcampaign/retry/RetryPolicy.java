package callcampaign.retry;

import callcampaign.CallAttempt;

/**
 * Decides whether and when a failed call attempt is retried.
 *
 * @see DefaultRetryPolicy
 */
public interface RetryPolicy {

    /**
     * @param attempt       the attempt that just ended without success
     * @param attemptsSoFar number of attempts made for the contact, including {@code attempt}
     * @return the decision
     * @throws IllegalArgumentException if {@code attempt} did not fail or time out
     */
    RetryDecision shouldRetry(CallAttempt attempt, int attemptsSoFar);
}
