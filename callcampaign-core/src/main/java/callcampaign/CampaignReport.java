package callcampaign;

import callcampaign.aggregate.CampaignAnalytics;
import callcampaign.aggregate.CampaignSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a finished campaign run: final counts plus every contact's result in completion
 * order.
 */
public record CampaignReport(String campaignId, Instant startedAt, Instant finishedAt,
    CampaignSnapshot snapshot, List<CampaignResult> results) {

  public CampaignReport {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(finishedAt, "finishedAt");
    Objects.requireNonNull(snapshot, "snapshot");
    results = List.copyOf(results);
  }

  public Duration elapsed() {
    return Duration.between(startedAt, finishedAt);
  }

  /** Outcome counts, confirmation rate and total call length of this run. */
  public CampaignAnalytics analytics() {
    return CampaignAnalytics.of(results);
  }

  public Optional<CampaignResult> resultFor(String contactId) {
    return results.stream().filter(r -> r.contactId().equals(contactId)).findFirst();
  }

  public List<CampaignResult> resultsWith(FinalStatus status) {
    return results.stream().filter(r -> r.finalStatus() == status).toList();
  }
}
