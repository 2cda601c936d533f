package callcampaign.store;

import callcampaign.CampaignResult;
import callcampaign.spi.ResultStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ConcurrentHashMap}-backed result store keeping results in save order. Thread-safe.
 */
public final class InMemoryResultStore implements ResultStore {
    private final Map<String, List<CampaignResult>> results = new ConcurrentHashMap<>();

    @Override
    public void save(String campaignId, CampaignResult result) {
        Objects.requireNonNull(campaignId, "campaignId");
        Objects.requireNonNull(result, "result");
        results.computeIfAbsent(campaignId, id -> new CopyOnWriteArrayList<>()).add(result);
    }

    @Override
    public List<CampaignResult> findByCampaign(String campaignId) {
        List<CampaignResult> stored = results.get(campaignId);
        return stored == null ? List.of() : List.copyOf(stored);
    }
}
