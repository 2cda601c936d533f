package callcampaign.client;

import callcampaign.NormalizedPhone;

import java.time.Instant;
import java.util.Objects;

/**
 * Reference to a call accepted by the calling service.
 *
 * @param callId      remote call identifier
 * @param phone       number being called
 * @param initiatedAt when the service accepted the call
 */
public record CallHandle(String callId, NormalizedPhone phone, Instant initiatedAt) {

  public CallHandle {
    Objects.requireNonNull(callId, "callId");
    Objects.requireNonNull(phone, "phone");
    Objects.requireNonNull(initiatedAt, "initiatedAt");
  }
}
