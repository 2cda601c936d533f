package callcampaign.client;

import callcampaign.ErrorKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Failure reported by a {@link CallClient}.
 *
 * <p>The {@link #kind()} is one of {@link ErrorKind#AUTH_ERROR},
 * {@link ErrorKind#SERVICE_UNAVAILABLE}, {@link ErrorKind#RATE_LIMITED} or
 * {@link ErrorKind#REQUEST_REJECTED}. A {@code RATE_LIMITED} failure may carry the service's
 * {@code Retry-After} hint.
 */
public class CallClientException extends RuntimeException {
  private static final Set<ErrorKind> CLIENT_KINDS = EnumSet.of(
      ErrorKind.AUTH_ERROR, ErrorKind.SERVICE_UNAVAILABLE,
      ErrorKind.RATE_LIMITED, ErrorKind.REQUEST_REJECTED);

  private final ErrorKind kind;
  private final Duration retryAfter;

  public CallClientException(ErrorKind kind, String message) {
    this(kind, message, null, null);
  }

  public CallClientException(ErrorKind kind, String message, Throwable cause) {
    this(kind, message, null, cause);
  }

  /**
   * @throws IllegalArgumentException if {@code kind} is not a client-side error kind or
   *     {@code retryAfter} is negative
   */
  public CallClientException(ErrorKind kind, String message, Duration retryAfter, Throwable cause) {
    super(message, cause);
    Objects.requireNonNull(kind, "kind");
    if (!CLIENT_KINDS.contains(kind)) {
      throw new IllegalArgumentException("Not a call client error kind: " + kind);
    }
    if (retryAfter != null && retryAfter.isNegative()) {
      throw new IllegalArgumentException("retryAfter must not be negative");
    }
    this.kind = kind;
    this.retryAfter = retryAfter;
  }

  public static CallClientException authError(String message) {
    return new CallClientException(ErrorKind.AUTH_ERROR, message);
  }

  public static CallClientException serviceUnavailable(String message, Throwable cause) {
    return new CallClientException(ErrorKind.SERVICE_UNAVAILABLE, message, cause);
  }

  public static CallClientException rateLimited(String message, Duration retryAfter) {
    return new CallClientException(ErrorKind.RATE_LIMITED, message, retryAfter, null);
  }

  public static CallClientException rejected(String message) {
    return new CallClientException(ErrorKind.REQUEST_REJECTED, message);
  }

  public ErrorKind kind() {
    return kind;
  }

  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
