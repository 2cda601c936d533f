package callcampaign.ratelimit;

import callcampaign.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowRateLimiterTest {

    private final CancellationToken token = new CancellationToken();

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowRateLimiter(1, Duration.ZERO));
        assertThrows(NullPointerException.class, () -> new SlidingWindowRateLimiter(1, null));
    }

    @Test
    void grantsUpToLimitWithoutWaiting() throws Exception {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(3, Duration.ofMinutes(1));

        long start = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            limiter.acquire(token).markUsed();
        }

        assertTrue(System.nanoTime() - start < TimeUnit.MILLISECONDS.toNanos(500));
        assertEquals(3, limiter.grantedInWindow());
    }

    @Test
    void neverExceedsLimitInAnyWindow() throws Exception {
        Duration window = Duration.ofMillis(300);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2, window);
        List<Long> grantTimes = new CopyOnWriteArrayList<>();

        Thread[] threads = new Thread[6];
        for (int i = 0; i < threads.length; i++) {
            threads[i] = new Thread(() -> {
                try {
                    limiter.acquire(token).markUsed();
                    grantTimes.add(System.nanoTime());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            threads[i].start();
        }
        for (Thread t : threads) {
            t.join(5000);
        }

        assertEquals(6, grantTimes.size());
        List<Long> sorted = grantTimes.stream().sorted().toList();
        // with 2 grants per window, grant i and grant i+2 are at least one window apart
        long windowNanos = window.toNanos();
        long toleranceNanos = TimeUnit.MILLISECONDS.toNanos(50);
        for (int i = 2; i < sorted.size(); i++) {
            assertTrue(sorted.get(i) - sorted.get(i - 2) >= windowNanos - toleranceNanos,
                "grants " + (i - 2) + " and " + i + " inside one window");
        }
    }

    @Test
    void grantsInArrivalOrder() throws Exception {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1, Duration.ofMillis(200));
        limiter.acquire(token).markUsed();
        List<String> order = new CopyOnWriteArrayList<>();

        Thread first = waiter(limiter, "first", order);
        first.start();
        awaitWaiting(limiter, 1);
        Thread second = waiter(limiter, "second", order);
        second.start();
        awaitWaiting(limiter, 2);
        Thread third = waiter(limiter, "third", order);
        third.start();
        awaitWaiting(limiter, 3);

        first.join(5000);
        second.join(5000);
        third.join(5000);

        assertEquals(List.of("first", "second", "third"), order);
    }

    @Test
    void cancellationWakesWaiter() throws Exception {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1, Duration.ofMinutes(1));
        limiter.acquire(token).markUsed();
        CancellationToken waiting = new CancellationToken();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch finished = new CountDownLatch(1);

        Thread t = new Thread(() -> {
            try {
                limiter.acquire(waiting);
            } catch (Throwable e) {
                failure.set(e);
            } finally {
                finished.countDown();
            }
        });
        t.start();
        awaitWaiting(limiter, 1);
        waiting.cancel();

        assertTrue(finished.await(2, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, failure.get());
        assertEquals(0, limiter.waitingCount());
    }

    @Test
    void acquireWithCancelledTokenThrows() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(5, Duration.ofMinutes(1));
        token.cancel();

        assertThrows(CancellationException.class, () -> limiter.acquire(token));
        assertEquals(0, limiter.grantedInWindow());
    }

    @Test
    void unusedPermitIsRefunded() throws Exception {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1, Duration.ofMinutes(1));

        Permit permit = limiter.acquire(token);
        limiter.release(permit);

        assertEquals(0, limiter.grantedInWindow());
        Permit next = limiter.acquire(token);
        assertEquals(2, next.sequence());
    }

    @Test
    void usedPermitIsNotRefunded() throws Exception {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2, Duration.ofMinutes(1));

        Permit permit = limiter.acquire(token);
        permit.markUsed();
        limiter.release(permit);
        limiter.release(permit);

        assertEquals(1, limiter.grantedInWindow());
    }

    private Thread waiter(SlidingWindowRateLimiter limiter, String name, List<String> order) {
        return new Thread(() -> {
            try {
                limiter.acquire(token).markUsed();
                order.add(name);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    private static void awaitWaiting(SlidingWindowRateLimiter limiter, int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (limiter.waitingCount() < count) {
            if (System.nanoTime() > deadline) {
                fail("Expected " + count + " waiters, got " + limiter.waitingCount());
            }
            Thread.sleep(5);
        }
    }
}
