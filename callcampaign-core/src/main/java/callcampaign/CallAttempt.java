package callcampaign;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One try at placing a call to a contact.
 *
 * <p>An attempt is created {@link AttemptStatus#PENDING} when dispatch begins, moves to
 * {@link AttemptStatus#IN_PROGRESS} once the calling service accepted it, and ends in
 * {@link AttemptStatus#SUCCEEDED}, {@link AttemptStatus#FAILED} or
 * {@link AttemptStatus#TIMED_OUT}. Once terminal it is immutable; further transitions throw
 * {@link IllegalStateException}.
 *
 * <p>Only the worker that owns the contact mutates an attempt. Methods are synchronized so that
 * readers on other threads (collector, consumers) always see a consistent state.
 */
public final class CallAttempt {
  private final String contactId;
  private final int attemptNumber;
  private final Instant startedAt;

  private AttemptStatus status = AttemptStatus.PENDING;
  private ErrorKind errorKind;
  private String errorMessage;
  private String callId;
  private Instant finishedAt;
  private Duration retryAfter;

  public CallAttempt(String contactId, int attemptNumber, Instant startedAt) {
    this.contactId = Objects.requireNonNull(contactId, "contactId");
    this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("attemptNumber must be >= 1, got: " + attemptNumber);
    }
    this.attemptNumber = attemptNumber;
  }

  public String contactId() {
    return contactId;
  }

  public int attemptNumber() {
    return attemptNumber;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public synchronized AttemptStatus status() {
    return status;
  }

  public synchronized Optional<ErrorKind> errorKind() {
    return Optional.ofNullable(errorKind);
  }

  public synchronized Optional<String> errorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public synchronized Optional<String> callId() {
    return Optional.ofNullable(callId);
  }

  public synchronized Optional<Instant> finishedAt() {
    return Optional.ofNullable(finishedAt);
  }

  /**
   * Remote back-off hint attached to a {@link ErrorKind#RATE_LIMITED} failure, if any.
   */
  public synchronized Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }

  public synchronized boolean isTerminal() {
    return status.isTerminal();
  }

  /**
   * Records that the calling service accepted the call.
   *
   * @param callId remote call identifier
   */
  public synchronized void markInProgress(String callId) {
    requireStatus(AttemptStatus.PENDING);
    this.callId = Objects.requireNonNull(callId, "callId");
    this.status = AttemptStatus.IN_PROGRESS;
  }

  public synchronized void markSucceeded(Instant at) {
    requireStatus(AttemptStatus.IN_PROGRESS);
    this.status = AttemptStatus.SUCCEEDED;
    this.finishedAt = Objects.requireNonNull(at, "at");
  }

  public synchronized void markFailed(ErrorKind kind, String message, Duration retryAfter, Instant at) {
    requireNotTerminal();
    this.status = AttemptStatus.FAILED;
    this.errorKind = Objects.requireNonNull(kind, "kind");
    this.errorMessage = message;
    this.retryAfter = retryAfter;
    this.finishedAt = Objects.requireNonNull(at, "at");
  }

  public void markFailed(ErrorKind kind, String message, Instant at) {
    markFailed(kind, message, null, at);
  }

  public synchronized void markTimedOut(Instant at) {
    requireStatus(AttemptStatus.IN_PROGRESS);
    this.status = AttemptStatus.TIMED_OUT;
    this.errorKind = ErrorKind.TIMED_OUT;
    this.errorMessage = "No terminal call status before attempt timeout";
    this.finishedAt = Objects.requireNonNull(at, "at");
  }

  private void requireStatus(AttemptStatus expected) {
    if (status != expected) {
      throw new IllegalStateException("Attempt " + attemptNumber + " for contact " + contactId
          + " is " + status + ", expected " + expected);
    }
  }

  private void requireNotTerminal() {
    if (status.isTerminal()) {
      throw new IllegalStateException("Attempt " + attemptNumber + " for contact " + contactId
          + " is already " + status);
    }
  }

  @Override
  public synchronized String toString() {
    return "CallAttempt{contactId=" + contactId + ", attempt=" + attemptNumber
        + ", status=" + status + (errorKind != null ? ", error=" + errorKind : "") + "}";
  }
}
