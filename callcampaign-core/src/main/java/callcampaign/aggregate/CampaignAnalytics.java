package callcampaign.aggregate;

import callcampaign.CampaignResult;

import java.time.Duration;
import java.util.Objects;

/**
 * Appointment-level view of a campaign: what the called people said and how long the calls took.
 *
 * <p>Every contact that reached a final status other than {@code CANCELLED} counts as a call.
 * Calls end up in exactly one bucket: confirmed, cancelled or rescheduled when the transcript
 * says so, otherwise busy/voicemail, which includes calls that failed or gave up.
 *
 * @param totalCalls      contacts that were not cancelled by the run
 * @param confirmed       successful calls classified {@code CONFIRMED}
 * @param cancelled       successful calls classified {@code CANCELLED}
 * @param rescheduled     successful calls classified {@code RESCHEDULED}
 * @param busyOrVoicemail every other call
 * @param totalCallLength sum of the connected call lengths
 */
public record CampaignAnalytics(int totalCalls, int confirmed, int cancelled, int rescheduled,
    int busyOrVoicemail, Duration totalCallLength) {

  public CampaignAnalytics {
    Objects.requireNonNull(totalCallLength, "totalCallLength");
    if (confirmed + cancelled + rescheduled + busyOrVoicemail != totalCalls) {
      throw new IllegalArgumentException("Outcome counts must add up to totalCalls");
    }
  }

  /**
   * Computes analytics over finished results.
   *
   * @param results results of one run
   * @return the analytics
   */
  public static CampaignAnalytics of(Iterable<CampaignResult> results) {
    OutcomeTally tally = new OutcomeTally();
    for (CampaignResult result : results) {
      tally.add(result);
    }
    return tally.toAnalytics();
  }

  /**
   * Percentage of calls that were confirmed, rounded to one decimal; 0 when there were no calls.
   */
  public double confirmationRate() {
    if (totalCalls == 0) {
      return 0.0;
    }
    return Math.round(confirmed * 1000.0 / totalCalls) / 10.0;
  }
}
