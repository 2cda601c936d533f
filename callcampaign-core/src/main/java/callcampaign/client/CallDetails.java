package callcampaign.client;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * What the calling service recorded about a completed call.
 *
 * @param transcript the transcript, or null if none was recorded
 * @param callLength how long the call was connected; {@link Duration#ZERO} when unknown
 */
public record CallDetails(String transcript, Duration callLength) {

  public CallDetails {
    callLength = callLength == null ? Duration.ZERO : callLength;
    if (callLength.isNegative()) {
      throw new IllegalArgumentException("callLength must not be negative");
    }
  }

  public Optional<String> transcriptText() {
    return Optional.ofNullable(transcript);
  }

  static CallDetails ofTranscript(Optional<String> transcript) {
    Objects.requireNonNull(transcript, "transcript");
    return new CallDetails(transcript.orElse(null), Duration.ZERO);
  }
}
