/**
 * Bounded-concurrency campaign dispatch.
 *
 * <p>{@link callcampaign.dispatch.CampaignDispatcher} starts a
 * {@link callcampaign.dispatch.CampaignExecution} per run. Each execution drives every contact
 * through normalization, rate-limited initiation, status polling and retries on a fixed pool of
 * workers, and publishes one result per contact in completion order. Runs can be cancelled at any
 * time; an authentication failure from the calling service aborts the whole run.
 *
 * @see callcampaign.dispatch.CampaignDispatcher
 * @see callcampaign.dispatch.CampaignExecution
 * @see callcampaign.dispatch.ContactState
 */
package callcampaign.dispatch;
