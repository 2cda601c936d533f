package callcampaign.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffTest {

  @Test
  void firstAttemptReturnsBaseDelay() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(10));

    assertEquals(Duration.ofMillis(100), backoff.delayAfter(1));
  }

  @Test
  void delayDoublesPerAttempt() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(100));

    assertEquals(Duration.ofMillis(200), backoff.delayAfter(2));
    assertEquals(Duration.ofMillis(400), backoff.delayAfter(3));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(100), Duration.ofMillis(500));

    assertEquals(Duration.ofMillis(500), backoff.delayAfter(10));
  }

  @Test
  void jitterOnlyLengthensDelay() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(100), 0.5);

    for (int i = 0; i < 20; i++) {
      long delay = backoff.delayAfter(1).toMillis();
      assertTrue(delay >= 1000 && delay < 1500, "Expected delay in [1000, 1500), got: " + delay);
    }
  }

  @Test
  void jitterNeverExceedsCap() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(2), 1.0);

    for (int i = 0; i < 20; i++) {
      assertTrue(backoff.delayAfter(5).toMillis() <= 2000);
    }
  }

  @Test
  void handlesAttemptCountAtOverflowBoundary() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(100), Duration.ofMinutes(1));

    // 2^(attempts-1) would overflow without the guard
    assertEquals(Duration.ofMinutes(1), backoff.delayAfter(31));
    assertEquals(Duration.ofMinutes(1), backoff.delayAfter(64));
    assertEquals(Duration.ofMinutes(1), backoff.delayAfter(Integer.MAX_VALUE));
  }

  @Test
  void zeroBaseDelayReturnsZero() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ZERO, Duration.ofSeconds(1));

    assertEquals(Duration.ZERO, backoff.delayAfter(3));
  }

  @Test
  void nonPositiveAttemptsReturnZero() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(10));

    assertEquals(Duration.ZERO, backoff.delayAfter(0));
    assertEquals(Duration.ZERO, backoff.delayAfter(-1));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoff(Duration.ofMillis(-1), Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(2), 1.5));
  }
}
