package callcampaign;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CallAttemptTest {

  @Test
  void successfulLifecycle() {
    CallAttempt attempt = new CallAttempt("c1", 1, Instant.now());
    assertEquals(AttemptStatus.PENDING, attempt.status());

    attempt.markInProgress("call-1");
    attempt.markSucceeded(Instant.now());

    assertEquals(AttemptStatus.SUCCEEDED, attempt.status());
    assertEquals("call-1", attempt.callId().orElseThrow());
    assertTrue(attempt.finishedAt().isPresent());
    assertTrue(attempt.errorKind().isEmpty());
  }

  @Test
  void failedBeforeInitiationKeepsRetryAfter() {
    CallAttempt attempt = new CallAttempt("c1", 2, Instant.now());

    attempt.markFailed(ErrorKind.RATE_LIMITED, "429", Duration.ofSeconds(5), Instant.now());

    assertEquals(AttemptStatus.FAILED, attempt.status());
    assertEquals(ErrorKind.RATE_LIMITED, attempt.errorKind().orElseThrow());
    assertEquals(Duration.ofSeconds(5), attempt.retryAfter().orElseThrow());
    assertTrue(attempt.callId().isEmpty());
  }

  @Test
  void timedOutCarriesTimedOutKind() {
    CallAttempt attempt = new CallAttempt("c1", 1, Instant.now());
    attempt.markInProgress("call-1");

    attempt.markTimedOut(Instant.now());

    assertEquals(AttemptStatus.TIMED_OUT, attempt.status());
    assertEquals(ErrorKind.TIMED_OUT, attempt.errorKind().orElseThrow());
  }

  @Test
  void rejectsIllegalTransitions() {
    CallAttempt pending = new CallAttempt("c1", 1, Instant.now());
    assertThrows(IllegalStateException.class, () -> pending.markSucceeded(Instant.now()));
    assertThrows(IllegalStateException.class, () -> pending.markTimedOut(Instant.now()));

    CallAttempt done = new CallAttempt("c1", 1, Instant.now());
    done.markFailed(ErrorKind.CALL_FAILED, "failed", Instant.now());
    assertThrows(IllegalStateException.class, () -> done.markInProgress("call-2"));
    assertThrows(IllegalStateException.class,
        () -> done.markFailed(ErrorKind.CALL_FAILED, "again", Instant.now()));
  }

  @Test
  void rejectsAttemptNumberBelowOne() {
    assertThrows(IllegalArgumentException.class, () -> new CallAttempt("c1", 0, Instant.now()));
  }
}
