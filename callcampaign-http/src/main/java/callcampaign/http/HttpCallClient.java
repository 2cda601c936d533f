package callcampaign.http;

import callcampaign.NormalizedPhone;
import callcampaign.ScriptConfig;
import callcampaign.client.CallClient;
import callcampaign.client.CallClientException;
import callcampaign.client.CallDetails;
import callcampaign.client.CallHandle;
import callcampaign.client.RemoteCallStatus;
import callcampaign.util.JsonCodec;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CallClient} backed by a REST voice-calling API.
 *
 * <p>Calls are placed with {@code POST /v1/calls} and read back with {@code GET /v1/calls/{id}},
 * authenticated by a bearer API key. HTTP failures are mapped onto
 * {@link CallClientException} kinds:
 *
 * <ul>
 *   <li>401 and 403: {@code AUTH_ERROR}</li>
 *   <li>429: {@code RATE_LIMITED}, with the {@code Retry-After} header when present</li>
 *   <li>5xx and I/O failures: {@code SERVICE_UNAVAILABLE}</li>
 *   <li>any other 4xx: {@code REQUEST_REJECTED}</li>
 * </ul>
 *
 * <p>Thread-safe. Closing the client releases its connection pool unless the underlying
 * {@link CloseableHttpClient} was supplied by the caller.
 */
public final class HttpCallClient implements CallClient, AutoCloseable {
  private static final Logger logger = Logger.getLogger(HttpCallClient.class.getName());

  public static final URI DEFAULT_BASE_URI = URI.create("https://api.bland.ai");
  public static final String API_KEY_ENV = "BLAND_API_KEY";

  private static final Set<String> FAILURE_STATUSES =
      Set.of("failed", "error", "busy", "no-answer", "canceled");

  private final URI baseUri;
  private final String apiKey;
  private final JsonCodec jsonCodec;
  private final CloseableHttpClient httpClient;
  private final boolean ownsHttpClient;

  private HttpCallClient(Builder builder) {
    this.baseUri = stripTrailingSlash(builder.baseUri);
    this.apiKey = builder.apiKey;
    this.jsonCodec = builder.jsonCodec;
    if (builder.httpClient != null) {
      this.httpClient = builder.httpClient;
      this.ownsHttpClient = false;
    } else {
      this.httpClient = createHttpClient(builder.connectTimeout, builder.responseTimeout);
      this.ownsHttpClient = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a client for {@link #DEFAULT_BASE_URI} with the key from {@value #API_KEY_ENV}.
   *
   * @throws IllegalStateException if the environment variable is not set
   */
  public static HttpCallClient fromEnvironment() {
    String key = System.getenv(API_KEY_ENV);
    if (key == null || key.isBlank()) {
      throw new IllegalStateException(API_KEY_ENV + " is not set");
    }
    return builder().apiKey(key).build();
  }

  public URI baseUri() {
    return baseUri;
  }

  @Override
  public CallHandle initiate(NormalizedPhone phone, ScriptConfig script) {
    Objects.requireNonNull(phone, "phone");
    Objects.requireNonNull(script, "script");
    HttpPost post = new HttpPost(endpoint("/v1/calls"));
    post.setEntity(new StringEntity(jsonCodec.toJson(callRequest(phone, script)),
        ContentType.APPLICATION_JSON));
    Map<String, String> body = send(post, "initiate call to " + phone);
    String callId = body.get("call_id");
    if (callId == null || callId.isBlank()) {
      throw CallClientException.serviceUnavailable(
          "Calling service accepted call to " + phone + " without a call_id", null);
    }
    logger.fine(() -> "Call " + callId + " initiated to " + phone);
    return new CallHandle(callId, phone, Instant.now());
  }

  @Override
  public RemoteCallStatus pollStatus(CallHandle handle) {
    return statusOf(fetchCall(handle));
  }

  @Override
  public Optional<String> fetchTranscript(CallHandle handle) {
    return transcriptOf(fetchCall(handle));
  }

  /**
   * Reads the transcript and the {@code call_length} of a completed call in one request. The
   * service reports the length in minutes; a missing or malformed value reads as zero.
   */
  @Override
  public CallDetails fetchDetails(CallHandle handle) {
    Map<String, String> call = fetchCall(handle);
    return new CallDetails(transcriptOf(call).orElse(null), callLengthOf(call));
  }

  @Override
  public void close() {
    if (!ownsHttpClient) {
      return;
    }
    try {
      httpClient.close();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Failed to close HTTP client", e);
    }
  }

  static Optional<String> transcriptOf(Map<String, String> call) {
    String transcript = call.get("concatenated_transcript");
    if (transcript == null || transcript.isBlank()) {
      transcript = call.get("transcript");
    }
    if (transcript == null || transcript.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(transcript);
  }

  static Duration callLengthOf(Map<String, String> call) {
    String minutes = call.get("call_length");
    if (minutes == null || minutes.isBlank()) {
      return Duration.ZERO;
    }
    try {
      double value = Double.parseDouble(minutes.trim());
      if (!(value > 0) || Double.isInfinite(value)) {
        return Duration.ZERO;
      }
      return Duration.ofMillis(Math.round(value * 60_000));
    } catch (NumberFormatException e) {
      logger.fine(() -> "Ignoring malformed call_length: " + minutes);
      return Duration.ZERO;
    }
  }

  static RemoteCallStatus statusOf(Map<String, String> call) {
    String status = call.getOrDefault("status", "").trim().toLowerCase(Locale.ROOT);
    if (FAILURE_STATUSES.contains(status)) {
      return RemoteCallStatus.FAILED;
    }
    if (Boolean.parseBoolean(call.get("completed")) || "completed".equals(status)) {
      return RemoteCallStatus.SUCCEEDED;
    }
    return RemoteCallStatus.PENDING;
  }

  private Map<String, String> fetchCall(CallHandle handle) {
    Objects.requireNonNull(handle, "handle");
    String id = URLEncoder.encode(handle.callId(), StandardCharsets.UTF_8);
    return send(new HttpGet(endpoint("/v1/calls/" + id)), "read call " + handle.callId());
  }

  private Map<String, Object> callRequest(NormalizedPhone phone, ScriptConfig script) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("phone_number", phone.e164());
    fields.put("task", script.task());
    fields.put("voice", script.voice());
    fields.put("language", script.language());
    fields.put("max_duration", script.maxDurationSeconds());
    fields.put("answered_by_enabled", script.answeredByEnabled());
    fields.put("wait_for_greeting", script.waitForGreeting());
    fields.put("record", script.record());
    fields.put("amd", script.answeredByEnabled());
    if (script.firstSentence() != null) {
      fields.put("first_sentence", script.firstSentence());
    }
    if (script.voicemailMessage() != null) {
      fields.put("voicemail_message", script.voicemailMessage());
    }
    return fields;
  }

  private Map<String, String> send(HttpUriRequestBase request, String action) {
    request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
    request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
    Reply reply;
    try {
      reply = httpClient.execute(request, HttpCallClient::readReply);
    } catch (IOException e) {
      throw CallClientException.serviceUnavailable("Failed to " + action + ": " + e.getMessage(), e);
    }
    int code = reply.status();
    if (code >= 200 && code < 300) {
      try {
        return jsonCodec.parseObject(reply.body());
      } catch (IllegalArgumentException e) {
        throw CallClientException.serviceUnavailable(
            "Failed to " + action + ": malformed response body", e);
      }
    }
    String message = "Failed to " + action + ": HTTP " + code + describe(reply.body());
    if (code == 401 || code == 403) {
      throw CallClientException.authError(message);
    }
    if (code == 429) {
      throw CallClientException.rateLimited(message, reply.retryAfter());
    }
    if (code >= 500) {
      throw CallClientException.serviceUnavailable(message, null);
    }
    throw CallClientException.rejected(message);
  }

  private static Reply readReply(ClassicHttpResponse response) throws IOException {
    String body = "";
    if (response.getEntity() != null) {
      try {
        body = EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
      } catch (org.apache.hc.core5.http.ParseException e) {
        throw new IOException("Unreadable response body", e);
      }
    }
    return new Reply(response.getCode(), body, retryAfter(response.getFirstHeader(HttpHeaders.RETRY_AFTER)));
  }

  // Only the delta-seconds form is honoured; HTTP dates are ignored.
  static Duration retryAfter(Header header) {
    if (header == null || header.getValue() == null) {
      return null;
    }
    try {
      long seconds = Long.parseLong(header.getValue().trim());
      return seconds < 0 ? null : Duration.ofSeconds(seconds);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String describe(String body) {
    if (body == null || body.isBlank()) {
      return "";
    }
    String trimmed = body.strip();
    return " - " + (trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed);
  }

  private static CloseableHttpClient createHttpClient(Duration connectTimeout, Duration responseTimeout) {
    return HttpClients.custom()
        .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
                .build())
            .build())
        .setDefaultRequestConfig(RequestConfig.custom()
            .setResponseTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()))
            .build())
        .disableAutomaticRetries()
        .build();
  }

  private URI endpoint(String path) {
    return URI.create(baseUri + path);
  }

  private static URI stripTrailingSlash(URI uri) {
    String s = uri.toString();
    return s.endsWith("/") ? URI.create(s.substring(0, s.length() - 1)) : uri;
  }

  private record Reply(int status, String body, Duration retryAfter) {
  }

  /** Builder for {@link HttpCallClient}. */
  public static final class Builder {
    private URI baseUri = DEFAULT_BASE_URI;
    private String apiKey;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration responseTimeout = Duration.ofSeconds(30);
    private JsonCodec jsonCodec = JsonCodec.getDefault();
    private CloseableHttpClient httpClient;

    private Builder() {
    }

    /**
     * <p>Optional. Defaults to {@link #DEFAULT_BASE_URI}.
     *
     * @param baseUri scheme, host and port of the calling service
     * @return this builder
     */
    public Builder baseUri(URI baseUri) {
      this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
      return this;
    }

    public Builder baseUri(String baseUri) {
      return baseUri(URI.create(Objects.requireNonNull(baseUri, "baseUri")));
    }

    /**
     * Sets the bearer key sent with every request.
     *
     * <p><b>Required.</b>
     *
     * @param apiKey the API key
     * @return this builder
     */
    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    /**
     * <p>Optional. Defaults to 10 seconds. Ignored when {@link #httpClient} is set.
     *
     * @param connectTimeout TCP connect timeout
     * @return this builder
     */
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
      return this;
    }

    /**
     * <p>Optional. Defaults to 30 seconds. Ignored when {@link #httpClient} is set.
     *
     * @param responseTimeout socket read timeout per request
     * @return this builder
     */
    public Builder responseTimeout(Duration responseTimeout) {
      this.responseTimeout = Objects.requireNonNull(responseTimeout, "responseTimeout");
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
      return this;
    }

    /**
     * Uses a caller-managed HTTP client. It is not closed by {@link HttpCallClient#close()}.
     *
     * @param httpClient the HTTP client
     * @return this builder
     */
    public Builder httpClient(CloseableHttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    /**
     * @return a new {@link HttpCallClient}
     * @throws IllegalArgumentException if the API key is blank or a timeout is not positive
     */
    public HttpCallClient build() {
      if (apiKey == null || apiKey.isBlank()) {
        throw new IllegalArgumentException("apiKey is required");
      }
      if (connectTimeout.isNegative() || connectTimeout.isZero()) {
        throw new IllegalArgumentException("connectTimeout must be positive");
      }
      if (responseTimeout.isNegative() || responseTimeout.isZero()) {
        throw new IllegalArgumentException("responseTimeout must be positive");
      }
      return new HttpCallClient(this);
    }
  }
}
