package callcampaign.aggregate;

import callcampaign.CampaignResult;
import callcampaign.FinalStatus;
import callcampaign.transcript.CallOutcome;

import java.time.Duration;

/** Mutable counters behind {@link CampaignAnalytics}. Not thread-safe. */
final class OutcomeTally {
  private int totalCalls;
  private int confirmed;
  private int cancelled;
  private int rescheduled;
  private int busyOrVoicemail;
  private Duration totalCallLength = Duration.ZERO;

  void add(CampaignResult result) {
    if (result.finalStatus() == FinalStatus.CANCELLED) {
      return;
    }
    totalCalls++;
    totalCallLength = totalCallLength.plus(result.callLength());
    CallOutcome outcome = result.finalStatus() == FinalStatus.SUCCEEDED ? result.outcome() : null;
    if (outcome == CallOutcome.CONFIRMED) {
      confirmed++;
    } else if (outcome == CallOutcome.CANCELLED) {
      cancelled++;
    } else if (outcome == CallOutcome.RESCHEDULED) {
      rescheduled++;
    } else {
      busyOrVoicemail++;
    }
  }

  CampaignAnalytics toAnalytics() {
    return new CampaignAnalytics(totalCalls, confirmed, cancelled, rescheduled, busyOrVoicemail,
        totalCallLength);
  }
}
