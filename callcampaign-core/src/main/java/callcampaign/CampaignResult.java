package callcampaign;

import callcampaign.transcript.CallOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Final outcome for one contact of a campaign run.
 *
 * <p>Exactly one result is produced per input contact. {@code errorKind} is set for
 * {@link FinalStatus#FAILED} and, for {@link FinalStatus#GAVE_UP}, names the last transient
 * error. {@code transcript} and {@code outcome} are only present for
 * {@link FinalStatus#SUCCEEDED}.
 *
 * @param contactId   the contact this result belongs to
 * @param finalStatus terminal status
 * @param errorKind   last error, or null
 * @param attempts    attempts in the order they were made; immutable
 * @param transcript  call transcript, or null
 * @param outcome     transcript classification, or null
 * @param callLength  connected length of the successful call as reported by the calling service
 * @param completedAt when the result was produced
 */
public record CampaignResult(String contactId, FinalStatus finalStatus, ErrorKind errorKind,
    List<CallAttempt> attempts, String transcript, CallOutcome outcome, Duration callLength,
    Instant completedAt) {

  public CampaignResult {
    Objects.requireNonNull(contactId, "contactId");
    Objects.requireNonNull(finalStatus, "finalStatus");
    Objects.requireNonNull(completedAt, "completedAt");
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
    callLength = callLength == null ? Duration.ZERO : callLength;
    if (finalStatus == FinalStatus.FAILED && errorKind == null) {
      throw new IllegalArgumentException("FAILED result requires an errorKind");
    }
  }

  public static CampaignResult succeeded(String contactId, List<CallAttempt> attempts,
      String transcript, CallOutcome outcome, Instant at) {
    return succeeded(contactId, attempts, transcript, outcome, Duration.ZERO, at);
  }

  public static CampaignResult succeeded(String contactId, List<CallAttempt> attempts,
      String transcript, CallOutcome outcome, Duration callLength, Instant at) {
    return new CampaignResult(contactId, FinalStatus.SUCCEEDED, null, attempts, transcript, outcome,
        callLength, at);
  }

  public static CampaignResult failed(String contactId, ErrorKind kind, List<CallAttempt> attempts, Instant at) {
    return new CampaignResult(contactId, FinalStatus.FAILED, kind, attempts, null, null, null, at);
  }

  public static CampaignResult gaveUp(String contactId, ErrorKind lastError, List<CallAttempt> attempts, Instant at) {
    return new CampaignResult(contactId, FinalStatus.GAVE_UP, lastError, attempts, null, null, null, at);
  }

  public static CampaignResult cancelled(String contactId, List<CallAttempt> attempts, Instant at) {
    return new CampaignResult(contactId, FinalStatus.CANCELLED, null, attempts, null, null, null, at);
  }

  public Optional<ErrorKind> error() {
    return Optional.ofNullable(errorKind);
  }

  public Optional<String> transcriptText() {
    return Optional.ofNullable(transcript);
  }

  public Optional<CallOutcome> callOutcome() {
    return Optional.ofNullable(outcome);
  }

  public boolean isSuccess() {
    return finalStatus == FinalStatus.SUCCEEDED;
  }
}
