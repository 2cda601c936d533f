package callcampaign;

import callcampaign.client.CallClient;
import callcampaign.dispatch.CampaignDispatcher;
import callcampaign.dispatch.CampaignExecution;
import callcampaign.phone.PhoneNumberNormalizer;
import callcampaign.ratelimit.RateLimiter;
import callcampaign.retry.RetryPolicy;
import callcampaign.spi.ContactListStore;
import callcampaign.spi.MetricsExporter;
import callcampaign.spi.ResultStore;
import callcampaign.transcript.TranscriptSummarizer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that loads a campaign's contacts from a {@link ContactListStore} and runs
 * them through a {@link CampaignDispatcher} with shared defaults.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (CampaignRunner runner = CampaignRunner.builder()
 *     .contactListStore(contacts)
 *     .callClient(client)
 *     .scriptConfig(script)
 *     .concurrencyLimit(4)
 *     .build()) {
 *   CampaignReport report = runner.runToCompletion("spring-reminders");
 * }
 * }</pre>
 *
 * @see CampaignDispatcher
 * @see CampaignReport
 */
public final class CampaignRunner implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CampaignRunner.class.getName());

  private final ContactListStore contactListStore;
  private final CampaignDispatcher dispatcher;
  private final MetricsExporter metrics;
  private final ScriptConfig scriptConfig;
  private final RetryPolicy retryPolicy;
  private final int concurrencyLimit;
  private final int rateLimitPerMinute;
  private final String defaultCountry;
  private final Duration attemptTimeout;
  private final Duration pollInterval;
  private final Duration maxPollInterval;

  private CampaignRunner(Builder builder, CampaignDispatcher dispatcher) {
    this.contactListStore = builder.contactListStore;
    this.dispatcher = dispatcher;
    this.metrics = builder.metrics;
    this.scriptConfig = builder.scriptConfig;
    this.retryPolicy = builder.retryPolicy;
    this.concurrencyLimit = builder.concurrencyLimit;
    this.rateLimitPerMinute = builder.rateLimitPerMinute;
    this.defaultCountry = builder.defaultCountry;
    this.attemptTimeout = builder.attemptTimeout;
    this.pollInterval = builder.pollInterval;
    this.maxPollInterval = builder.maxPollInterval;
  }

  public static Builder builder() {
    return new Builder();
  }

  public CampaignDispatcher dispatcher() {
    return dispatcher;
  }

  /**
   * Returns a run builder for the campaign's stored contacts, preset with this runner's defaults.
   *
   * @param campaignId the campaign
   * @return a run builder that may be adjusted before {@link CampaignRun.Builder#build()}
   * @throws IllegalStateException if the campaign has no contacts
   */
  public CampaignRun.Builder newRun(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    List<Contact> contacts = contactListStore.load(campaignId);
    if (contacts.isEmpty()) {
      throw new IllegalStateException("No contacts found in campaign " + campaignId);
    }
    CampaignRun.Builder run = CampaignRun.builder(campaignId)
        .contacts(contacts)
        .scriptConfig(scriptConfig)
        .concurrencyLimit(concurrencyLimit)
        .rateLimitPerMinute(rateLimitPerMinute)
        .defaultCountry(defaultCountry)
        .attemptTimeout(attemptTimeout)
        .pollInterval(pollInterval)
        .maxPollInterval(maxPollInterval);
    if (retryPolicy != null) {
      run.retryPolicy(retryPolicy);
    }
    return run;
  }

  /**
   * Starts the campaign with this runner's defaults.
   *
   * @param campaignId the campaign
   * @return the running execution
   * @throws IllegalStateException if the campaign has no contacts
   */
  public CampaignExecution start(String campaignId) {
    return dispatcher.run(newRun(campaignId).build());
  }

  /**
   * Runs the campaign and blocks until every contact has a result.
   *
   * @param campaignId the campaign
   * @return the report of the finished run
   * @throws IllegalStateException     if the campaign has no contacts
   * @throws CampaignAbortedException if the calling service rejected the credentials
   */
  public CampaignReport runToCompletion(String campaignId) {
    return runToCompletion(newRun(campaignId).build());
  }

  /**
   * Runs a prepared campaign and blocks until every contact has a result.
   *
   * @param run the campaign to run
   * @return the report of the finished run
   * @throws CampaignAbortedException if the calling service rejected the credentials
   */
  public CampaignReport runToCompletion(CampaignRun run) {
    List<CampaignResult> results = new ArrayList<>(run.contacts().size());
    CampaignReport report;
    try (CampaignExecution execution = dispatcher.run(run)) {
      for (CampaignResult result : execution) {
        results.add(result);
      }
      report = new CampaignReport(run.campaignId(), execution.startedAt(), Instant.now(),
          execution.snapshot(), results);
      if (execution.abortCause().isPresent()) {
        throw new CampaignAbortedException(report, execution.abortCause().get());
      }
    }
    return report;
  }

  /**
   * Closes the dispatcher, then the metrics exporter if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link CampaignRunner}. */
  public static final class Builder {
    private ContactListStore contactListStore;
    private CallClient callClient;
    private ScriptConfig scriptConfig;
    private ResultStore resultStore;
    private MetricsExporter metrics;
    private PhoneNumberNormalizer normalizer;
    private TranscriptSummarizer transcriptSummarizer;
    private RateLimiter rateLimiter;
    private RetryPolicy retryPolicy;
    private int concurrencyLimit = 4;
    private int rateLimitPerMinute = 60;
    private String defaultCountry;
    private Duration attemptTimeout = Duration.ofMinutes(5);
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration maxPollInterval = Duration.ofSeconds(15);
    private long drainTimeoutMs = 5000;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets where campaign contact lists are loaded from.
     *
     * <p><b>Required.</b>
     *
     * @param contactListStore the contact list store
     * @return this builder
     */
    public Builder contactListStore(ContactListStore contactListStore) {
      this.contactListStore = contactListStore;
      return this;
    }

    /**
     * Sets the calling service client.
     *
     * <p><b>Required.</b>
     *
     * @param callClient the client
     * @return this builder
     */
    public Builder callClient(CallClient callClient) {
      this.callClient = callClient;
      return this;
    }

    /**
     * Sets the script used for every call unless a run overrides it.
     *
     * <p><b>Required.</b>
     *
     * @param scriptConfig the script
     * @return this builder
     */
    public Builder scriptConfig(ScriptConfig scriptConfig) {
      this.scriptConfig = scriptConfig;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link ResultStore#NONE}.
     *
     * @param resultStore where results are saved as they are produced
     * @return this builder
     */
    public Builder resultStore(ResultStore resultStore) {
      this.resultStore = resultStore;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the runner when it is
     * {@link AutoCloseable}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder normalizer(PhoneNumberNormalizer normalizer) {
      this.normalizer = normalizer;
      return this;
    }

    public Builder transcriptSummarizer(TranscriptSummarizer transcriptSummarizer) {
      this.transcriptSummarizer = transcriptSummarizer;
      return this;
    }

    /**
     * Sets a rate limiter shared by every campaign this runner starts.
     *
     * <p>Optional. By default each campaign is limited on its own.
     *
     * @param rateLimiter the shared limiter
     * @return this builder
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link callcampaign.retry.DefaultRetryPolicy#defaults()}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 4}.
     *
     * @param concurrencyLimit maximum simultaneous contacts per campaign
     * @return this builder
     */
    public Builder concurrencyLimit(int concurrencyLimit) {
      this.concurrencyLimit = concurrencyLimit;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 60}.
     *
     * @param rateLimitPerMinute maximum initiations per rolling minute
     * @return this builder
     */
    public Builder rateLimitPerMinute(int rateLimitPerMinute) {
      this.rateLimitPerMinute = rateLimitPerMinute;
      return this;
    }

    /**
     * <p>Optional. Without it only numbers with an international prefix are accepted.
     *
     * @param defaultCountry calling code such as {@code "+1"} or {@code "44"}
     * @return this builder
     */
    public Builder defaultCountry(String defaultCountry) {
      this.defaultCountry = defaultCountry;
      return this;
    }

    public Builder attemptTimeout(Duration attemptTimeout) {
      this.attemptTimeout = attemptTimeout;
      return this;
    }

    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public Builder maxPollInterval(Duration maxPollInterval) {
      this.maxPollInterval = maxPollInterval;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs how long closing waits for calls in progress
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * @return a new {@link CampaignRunner}
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a run default is out of range
     * @throws IllegalStateException    if {@code build()} was already called
     */
    public CampaignRunner build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(contactListStore, "contactListStore");
      Objects.requireNonNull(scriptConfig, "scriptConfig");
      CampaignRun.checkSettings(concurrencyLimit, rateLimitPerMinute, defaultCountry,
          attemptTimeout, pollInterval, maxPollInterval);
      if (metrics == null) {
        metrics = MetricsExporter.NOOP;
      }
      CampaignDispatcher dispatcher = CampaignDispatcher.builder()
          .callClient(callClient)
          .normalizer(normalizer)
          .transcriptSummarizer(transcriptSummarizer)
          .resultStore(resultStore)
          .metrics(metrics)
          .rateLimiter(rateLimiter)
          .drainTimeoutMs(drainTimeoutMs)
          .build();
      logger.fine(() -> "Campaign runner built: concurrency " + concurrencyLimit + ", "
          + rateLimitPerMinute + " calls/min");
      return new CampaignRunner(this, dispatcher);
    }
  }
}
