package callcampaign.ratelimit;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A grant from a {@link RateLimiter}.
 *
 * <p>Call {@link #markUsed()} right before issuing the call initiation the permit was acquired
 * for. A permit released without being used is refunded to the limiter.
 */
public final class Permit {
  private final long sequence;
  private final long grantedAtNanos;
  private final AtomicBoolean used = new AtomicBoolean();
  private final AtomicBoolean released = new AtomicBoolean();

  Permit(long sequence, long grantedAtNanos) {
    this.sequence = sequence;
    this.grantedAtNanos = grantedAtNanos;
  }

  /** Grant order, starting at 1. */
  public long sequence() {
    return sequence;
  }

  long grantedAtNanos() {
    return grantedAtNanos;
  }

  public void markUsed() {
    used.set(true);
  }

  public boolean isUsed() {
    return used.get();
  }

  boolean markReleased() {
    return released.compareAndSet(false, true);
  }
}
