/**
 * Retry decisions for failed call attempts.
 *
 * <p>{@link callcampaign.retry.DefaultRetryPolicy#isTransient} is the single place where error
 * kinds are split into transient and terminal.
 *
 * @see callcampaign.retry.RetryPolicy
 * @see callcampaign.retry.RetryDecision
 */
package callcampaign.retry;
