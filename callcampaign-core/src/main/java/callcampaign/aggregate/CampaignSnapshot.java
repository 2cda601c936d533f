package callcampaign.aggregate;

/**
 * Point-in-time counts for a campaign run.
 *
 * @param total     contacts in the run
 * @param succeeded contacts whose call succeeded
 * @param failed    contacts ended by a terminal error
 * @param gaveUp    contacts that exhausted retries
 * @param cancelled contacts emitted as cancelled
 * @param inFlight  contacts picked up by a worker but not yet recorded
 */
public record CampaignSnapshot(int total, int succeeded, int failed, int gaveUp, int cancelled, int inFlight) {

  /** Contacts with a recorded result. */
  public int completed() {
    return succeeded + failed + gaveUp + cancelled;
  }

  /** Contacts not yet picked up. */
  public int pending() {
    return Math.max(0, total - completed() - inFlight);
  }

  /** Contacts that did not succeed, counting terminal failures and exhausted retries. */
  public int unsuccessful() {
    return failed + gaveUp;
  }

  /**
   * Percentage of recorded results whose call went through, rounded to one decimal; 0 when
   * nothing was recorded yet.
   *
   * @see CampaignAnalytics#confirmationRate()
   */
  public double successRate() {
    int completed = completed();
    if (completed == 0) {
      return 0.0;
    }
    return Math.round(succeeded * 1000.0 / completed) / 10.0;
  }

  public boolean isDone() {
    return completed() == total;
  }
}
