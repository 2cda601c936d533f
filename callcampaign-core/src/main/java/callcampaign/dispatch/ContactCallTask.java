package callcampaign.dispatch;

import callcampaign.AttemptStatus;
import callcampaign.CallAttempt;
import callcampaign.CampaignResult;
import callcampaign.Contact;
import callcampaign.ErrorKind;
import callcampaign.NormalizedPhone;
import callcampaign.ScriptConfig;
import callcampaign.client.CallClientException;
import callcampaign.client.CallDetails;
import callcampaign.client.CallHandle;
import callcampaign.client.RemoteCallStatus;
import callcampaign.phone.InvalidPhoneNumberException;
import callcampaign.ratelimit.Permit;
import callcampaign.retry.RetryDecision;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the state machine of one contact on the calling worker thread.
 *
 * <p>Cancellation is observed before every rate-limit wait and before every initiation; once a
 * call is initiated its status is awaited to the end, so in-flight attempts always finish. Retry
 * delays are cancellable.
 */
final class ContactCallTask {
  private static final Logger logger = Logger.getLogger(ContactCallTask.class.getName());
  private static final double POLL_BACKOFF_FACTOR = 1.5;

  private final Contact contact;
  private final DispatchContext ctx;
  private final List<CallAttempt> attempts = new ArrayList<>();
  private ContactState state = ContactState.QUEUED;
  private CallHandle lastHandle;

  ContactCallTask(Contact contact, DispatchContext ctx) {
    this.contact = contact;
    this.ctx = ctx;
  }

  ContactState state() {
    return state;
  }

  List<CallAttempt> attempts() {
    return attempts;
  }

  /**
   * Drives the contact to a terminal state.
   *
   * @return the contact's result, never null
   */
  CampaignResult call() {
    try {
      return execute();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      abandonInFlightAttempt();
      return cancelled();
    }
  }

  private CampaignResult execute() throws InterruptedException {
    if (ctx.token().isCancelled()) {
      return cancelled();
    }
    transition(ContactState.NORMALIZING);
    NormalizedPhone phone;
    try {
      phone = ctx.normalizer().normalize(contact.rawPhone(), ctx.run().defaultCountry());
    } catch (InvalidPhoneNumberException e) {
      transition(ContactState.NORMALIZE_FAILED);
      logger.fine(() -> "Contact " + contact.id() + ": " + e.getMessage());
      ctx.metrics().incrementContactFailed();
      return CampaignResult.failed(contact.id(), ErrorKind.INVALID_PHONE_NUMBER, attempts, Instant.now());
    }
    ScriptConfig script = ctx.run().scriptConfig().renderFor(contact);

    for (int attemptNumber = 1; ; attemptNumber++) {
      transition(ContactState.DISPATCHING);
      Optional<CallAttempt> dispatched = dispatch(phone, script, attemptNumber);
      if (dispatched.isEmpty()) {
        return cancelled();
      }
      CallAttempt attempt = dispatched.get();
      if (attempt.status() == AttemptStatus.SUCCEEDED) {
        return succeeded();
      }

      ErrorKind kind = attempt.errorKind().orElse(ErrorKind.SERVICE_UNAVAILABLE);
      ctx.metrics().incrementAttemptFailed(kind);
      if (kind == ErrorKind.AUTH_ERROR) {
        transition(ContactState.FAILED);
        ctx.metrics().incrementContactFailed();
        return CampaignResult.failed(contact.id(), kind, attempts, Instant.now());
      }

      RetryDecision decision = ctx.run().retryPolicy().shouldRetry(attempt, attemptNumber);
      if (decision instanceof RetryDecision.GiveUp giveUp) {
        if (giveUp.reason() == RetryDecision.GiveUp.Reason.EXHAUSTED) {
          transition(ContactState.GAVE_UP);
          ctx.metrics().incrementContactGaveUp();
          return CampaignResult.gaveUp(contact.id(), kind, attempts, Instant.now());
        }
        transition(ContactState.FAILED);
        ctx.metrics().incrementContactFailed();
        return CampaignResult.failed(contact.id(), kind, attempts, Instant.now());
      }

      Duration delay = ((RetryDecision.Retry) decision).delay();
      transition(ContactState.RETRYING);
      final int failedAttempt = attemptNumber;
      logger.fine(() -> "Contact " + contact.id() + " attempt " + failedAttempt + " failed with "
          + kind + "; retrying in " + delay.toMillis() + " ms");
      if (ctx.token().await(delay)) {
        return cancelled();
      }
    }
  }

  /**
   * Takes a rate-limit permit, initiates the call and awaits its outcome.
   *
   * @return the terminal attempt, or empty if the run was cancelled before initiation
   */
  private Optional<CallAttempt> dispatch(NormalizedPhone phone, ScriptConfig script, int attemptNumber)
      throws InterruptedException {
    if (ctx.token().isCancelled()) {
      return Optional.empty();
    }
    Permit permit;
    try {
      ctx.metrics().recordRateLimiterWaiting(ctx.rateLimiter().waitingCount() + 1);
      permit = ctx.rateLimiter().acquire(ctx.token());
    } catch (CancellationException e) {
      return Optional.empty();
    } finally {
      ctx.metrics().recordRateLimiterWaiting(ctx.rateLimiter().waitingCount());
    }

    CallAttempt attempt;
    CallHandle handle;
    try {
      if (ctx.token().isCancelled()) {
        return Optional.empty();
      }
      attempt = new CallAttempt(contact.id(), attemptNumber, Instant.now());
      attempts.add(attempt);
      permit.markUsed();
      handle = initiate(phone, script, attempt);
    } finally {
      ctx.rateLimiter().release(permit);
    }
    if (handle != null) {
      lastHandle = handle;
      attempt.markInProgress(handle.callId());
      ctx.metrics().incrementCallInitiated();
      transition(ContactState.AWAITING);
      await(handle, attempt);
      ctx.metrics().recordCallDurationMs(
          Math.max(0L, Duration.between(handle.initiatedAt(), Instant.now()).toMillis()));
    }
    return Optional.of(attempt);
  }

  private CallHandle initiate(NormalizedPhone phone, ScriptConfig script, CallAttempt attempt) {
    try {
      return ctx.callClient().initiate(phone, script);
    } catch (CallClientException e) {
      fail(attempt, e);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Unexpected error initiating call for contact " + contact.id(), e);
      attempt.markFailed(ErrorKind.SERVICE_UNAVAILABLE, String.valueOf(e.getMessage()), Instant.now());
    }
    return null;
  }

  private void await(CallHandle handle, CallAttempt attempt) throws InterruptedException {
    long deadline = System.nanoTime() + ctx.run().attemptTimeout().toNanos();
    long intervalNanos = ctx.run().pollInterval().toNanos();
    long maxIntervalNanos = ctx.run().maxPollInterval().toNanos();
    while (true) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        attempt.markTimedOut(Instant.now());
        return;
      }
      TimeUnit.NANOSECONDS.sleep(Math.min(intervalNanos, remaining));

      RemoteCallStatus status;
      try {
        status = ctx.callClient().pollStatus(handle);
      } catch (CallClientException e) {
        fail(attempt, e);
        return;
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Unexpected error polling call " + handle.callId(), e);
        attempt.markFailed(ErrorKind.SERVICE_UNAVAILABLE, String.valueOf(e.getMessage()), Instant.now());
        return;
      }
      switch (status) {
        case SUCCEEDED -> {
          attempt.markSucceeded(Instant.now());
          return;
        }
        case FAILED -> {
          attempt.markFailed(ErrorKind.CALL_FAILED, "Call " + handle.callId() + " failed", Instant.now());
          return;
        }
        case PENDING -> intervalNanos = Math.min(maxIntervalNanos, (long) (intervalNanos * POLL_BACKOFF_FACTOR));
      }
    }
  }

  private void fail(CallAttempt attempt, CallClientException e) {
    attempt.markFailed(e.kind(), e.getMessage(), e.retryAfter().orElse(null), Instant.now());
    if (e.kind() == ErrorKind.AUTH_ERROR) {
      ctx.abortHandler().accept(e);
    }
  }

  private CampaignResult succeeded() {
    CallDetails details = new CallDetails(null, Duration.ZERO);
    try {
      details = ctx.callClient().fetchDetails(lastHandle);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Could not fetch transcript for call " + lastHandle.callId(), e);
    }
    transition(ContactState.SUCCEEDED);
    ctx.metrics().incrementCallSucceeded();
    return CampaignResult.succeeded(contact.id(), attempts, details.transcript(),
        ctx.summarizer().summarize(details.transcript()), details.callLength(), Instant.now());
  }

  private CampaignResult cancelled() {
    transition(ContactState.CANCELLED);
    ctx.metrics().incrementContactCancelled();
    return CampaignResult.cancelled(contact.id(), attempts, Instant.now());
  }

  private void abandonInFlightAttempt() {
    if (!attempts.isEmpty()) {
      CallAttempt last = attempts.get(attempts.size() - 1);
      if (!last.isTerminal()) {
        last.markFailed(ErrorKind.TIMED_OUT, "Abandoned while awaiting call status", Instant.now());
      }
    }
  }

  private void transition(ContactState next) {
    ContactState previous = state;
    state = next;
    logger.fine(() -> "Contact " + contact.id() + ": " + previous + " -> " + next);
  }
}
