package callcampaign;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cooperative cancellation signal passed through every suspension point of a campaign run.
 *
 * <p>Cancellation is one-way and idempotent. Listeners registered with {@link #onCancel} run
 * once, on the thread that calls {@link #cancel()}, or immediately if the token is already
 * cancelled. {@link #child()} derives a token that is cancelled together with its parent but can
 * also be cancelled on its own.
 *
 * <p>This class is thread-safe.
 */
public final class CancellationToken {
  private static final Logger logger = Logger.getLogger(CancellationToken.class.getName());

  private final CountDownLatch latch = new CountDownLatch(1);
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private volatile Runnable detachFromParent = () -> { };

  public void cancel() {
    if (latch.getCount() == 0) {
      return;
    }
    synchronized (this) {
      if (latch.getCount() == 0) {
        return;
      }
      latch.countDown();
    }
    for (Runnable listener : listeners) {
      runListener(listener);
    }
    listeners.clear();
  }

  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  /**
   * Registers a callback run when this token is cancelled.
   *
   * @param listener the callback
   */
  public void onCancel(Runnable listener) {
    synchronized (this) {
      if (latch.getCount() != 0) {
        listeners.add(listener);
        return;
      }
    }
    runListener(listener);
  }

  /**
   * Returns a new token cancelled whenever this one is, until the child is {@link #detach()
   * detached}.
   */
  public CancellationToken child() {
    CancellationToken child = new CancellationToken();
    Runnable link = child::cancel;
    child.detachFromParent = () -> listeners.remove(link);
    onCancel(link);
    return child;
  }

  /**
   * Stops following the parent token this one was derived from with {@link #child()}. Has no
   * effect on a token without a parent. The token itself can still be cancelled.
   */
  public void detach() {
    detachFromParent.run();
  }

  int listenerCount() {
    return listeners.size();
  }

  /**
   * Sleeps for up to {@code timeout}, waking early on cancellation.
   *
   * @param timeout how long to wait
   * @return {@code true} if the token was cancelled before or during the wait
   * @throws InterruptedException if the calling thread is interrupted
   */
  public boolean await(Duration timeout) throws InterruptedException {
    if (timeout.isNegative() || timeout.isZero()) {
      return isCancelled();
    }
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  private static void runListener(Runnable listener) {
    try {
      listener.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Cancellation listener failed", e);
    }
  }
}
