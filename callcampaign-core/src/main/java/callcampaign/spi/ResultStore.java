package callcampaign.spi;

import callcampaign.CampaignResult;

import java.util.List;

/**
 * Sink for campaign results, written once per contact as results are produced.
 *
 * <p>Implementations must be thread-safe.
 *
 * @see callcampaign.store.InMemoryResultStore
 */
public interface ResultStore {

    /**
     * No-op store that keeps nothing.
     */
    ResultStore NONE = new ResultStore() {
        @Override
        public void save(String campaignId, CampaignResult result) {
        }

        @Override
        public List<CampaignResult> findByCampaign(String campaignId) {
            return List.of();
        }
    };

    /**
     * Persists one contact's result.
     *
     * @param campaignId the campaign
     * @param result     the result
     */
    void save(String campaignId, CampaignResult result);

    /**
     * Returns the stored results of a campaign in the order they were saved.
     *
     * @param campaignId the campaign
     * @return the results; empty if none
     */
    List<CampaignResult> findByCampaign(String campaignId);
}
