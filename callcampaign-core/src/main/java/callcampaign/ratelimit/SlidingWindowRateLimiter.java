package callcampaign.ratelimit;

import callcampaign.CancellationToken;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window rate limiter: at most {@code permits} grants in any rolling {@code window}.
 *
 * <p>Grant timestamps are kept in a deque and evicted once they are older than the window.
 * Callers queue in arrival order and only the head of the queue may take a free slot, which makes
 * grants strictly FIFO. Waiters wake at least every {@value #CANCEL_CHECK_MS} ms to observe
 * cancellation.
 *
 * <p>This class is thread-safe.
 */
public final class SlidingWindowRateLimiter implements RateLimiter {
  private static final long CANCEL_CHECK_MS = 50;

  private final int permits;
  private final long windowNanos;
  private final ReentrantLock lock = new ReentrantLock(true);
  private final Deque<Long> grants = new ArrayDeque<>();
  private final Deque<Condition> waiters = new ArrayDeque<>();
  private long sequence;

  /**
   * @param permits maximum grants per window (&ge; 1)
   * @param window  window length (&gt; 0)
   */
  public SlidingWindowRateLimiter(int permits, Duration window) {
    Objects.requireNonNull(window, "window");
    if (permits < 1) {
      throw new IllegalArgumentException("permits must be >= 1, got: " + permits);
    }
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be > 0, got: " + window);
    }
    this.permits = permits;
    this.windowNanos = window.toNanos();
  }

  /**
   * Creates a limiter allowing {@code permitsPerMinute} grants per rolling 60-second window.
   */
  public static SlidingWindowRateLimiter perMinute(int permitsPerMinute) {
    return new SlidingWindowRateLimiter(permitsPerMinute, Duration.ofMinutes(1));
  }

  @Override
  public Permit acquire(CancellationToken token) throws InterruptedException {
    Objects.requireNonNull(token, "token");
    lock.lockInterruptibly();
    try {
      Condition self = lock.newCondition();
      waiters.addLast(self);
      try {
        while (true) {
          if (token.isCancelled()) {
            throw new CancellationException("Cancelled while waiting for a rate limit permit");
          }
          long waitNanos = TimeUnit.MILLISECONDS.toNanos(CANCEL_CHECK_MS);
          if (waiters.peekFirst() == self) {
            long now = System.nanoTime();
            evictExpired(now);
            if (grants.size() < permits) {
              grants.addLast(now);
              return new Permit(++sequence, now);
            }
            long untilFree = grants.peekFirst() + windowNanos - now;
            waitNanos = Math.max(1L, Math.min(waitNanos, untilFree));
          }
          self.awaitNanos(waitNanos);
        }
      } finally {
        boolean wasHead = waiters.peekFirst() == self;
        waiters.remove(self);
        if (wasHead && !waiters.isEmpty()) {
          waiters.peekFirst().signal();
        }
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void release(Permit permit) {
    Objects.requireNonNull(permit, "permit");
    if (!permit.markReleased() || permit.isUsed()) {
      return;
    }
    lock.lock();
    try {
      Iterator<Long> it = grants.iterator();
      while (it.hasNext()) {
        if (it.next() == permit.grantedAtNanos()) {
          it.remove();
          break;
        }
      }
      if (!waiters.isEmpty()) {
        waiters.peekFirst().signal();
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int waitingCount() {
    lock.lock();
    try {
      return waiters.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of grants still inside the current window.
   */
  public int grantedInWindow() {
    lock.lock();
    try {
      evictExpired(System.nanoTime());
      return grants.size();
    } finally {
      lock.unlock();
    }
  }

  private void evictExpired(long now) {
    while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
      grants.removeFirst();
    }
  }
}
