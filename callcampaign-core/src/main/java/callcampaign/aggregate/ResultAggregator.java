package callcampaign.aggregate;

import callcampaign.CampaignResult;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates per-contact results into campaign-level counts.
 *
 * <p>All mutations and snapshots are serialized by one lock, so a snapshot taken after
 * {@link #record} returns always reflects that record. Each contact may be recorded once.
 */
public final class ResultAggregator {
  private final ReentrantLock lock = new ReentrantLock();
  private final int total;
  private final Set<String> inFlight = new HashSet<>();
  private final Set<String> recorded = new HashSet<>();
  private int succeeded;
  private int failed;
  private int gaveUp;
  private int cancelled;
  private final OutcomeTally outcomes = new OutcomeTally();

  /**
   * @param total number of contacts in the run
   */
  public ResultAggregator(int total) {
    if (total < 0) {
      throw new IllegalArgumentException("total must be >= 0");
    }
    this.total = total;
  }

  /**
   * Marks a contact as picked up by a worker.
   *
   * @param contactId the contact
   */
  public void markInFlight(String contactId) {
    Objects.requireNonNull(contactId, "contactId");
    lock.lock();
    try {
      if (!recorded.contains(contactId)) {
        inFlight.add(contactId);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records a contact's final result.
   *
   * @param result the result
   * @throws IllegalStateException if the contact was already recorded or the run is full
   */
  public void record(CampaignResult result) {
    Objects.requireNonNull(result, "result");
    lock.lock();
    try {
      if (!recorded.add(result.contactId())) {
        throw new IllegalStateException("Contact already recorded: " + result.contactId());
      }
      if (recorded.size() > total) {
        recorded.remove(result.contactId());
        throw new IllegalStateException("More results than contacts (" + total + ")");
      }
      inFlight.remove(result.contactId());
      switch (result.finalStatus()) {
        case SUCCEEDED -> succeeded++;
        case FAILED -> failed++;
        case GAVE_UP -> gaveUp++;
        case CANCELLED -> cancelled++;
      }
      outcomes.add(result);
    } finally {
      lock.unlock();
    }
  }

  public CampaignSnapshot snapshot() {
    lock.lock();
    try {
      return new CampaignSnapshot(total, succeeded, failed, gaveUp, cancelled, inFlight.size());
    } finally {
      lock.unlock();
    }
  }

  /** Outcome counts and call lengths of the results recorded so far. */
  public CampaignAnalytics analytics() {
    lock.lock();
    try {
      return outcomes.toAnalytics();
    } finally {
      lock.unlock();
    }
  }
}
