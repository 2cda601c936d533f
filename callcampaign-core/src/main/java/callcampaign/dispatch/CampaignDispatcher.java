package callcampaign.dispatch;

import callcampaign.CampaignRun;
import callcampaign.CancellationToken;
import callcampaign.client.CallClient;
import callcampaign.phone.PhoneNumberNormalizer;
import callcampaign.ratelimit.RateLimiter;
import callcampaign.ratelimit.SlidingWindowRateLimiter;
import callcampaign.spi.MetricsExporter;
import callcampaign.spi.ResultStore;
import callcampaign.transcript.KeywordTranscriptSummarizer;
import callcampaign.transcript.TranscriptSummarizer;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Starts campaign runs against a {@link CallClient}.
 *
 * <p>Each call to {@link #run} starts an independent {@link CampaignExecution} with its own worker
 * pool sized to the run's concurrency limit. Calls are rate limited per run by a
 * {@link SlidingWindowRateLimiter} built from {@link CampaignRun#rateLimitPerMinute()}, unless a
 * shared {@link RateLimiter} is configured on the builder, in which case all runs draw from it.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe. Closing it closes every
 * run that has not finished yet.
 *
 * @see CampaignDispatcher.Builder
 */
public final class CampaignDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CampaignDispatcher.class.getName());

  private final Collaborators collaborators;
  private final Set<CampaignExecution> active = ConcurrentHashMap.newKeySet();

  private CampaignDispatcher(Builder builder) {
    CallClient callClient = Objects.requireNonNull(builder.callClient, "callClient");
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.collaborators = new Collaborators(
        callClient,
        builder.normalizer != null ? builder.normalizer : new PhoneNumberNormalizer(),
        builder.transcriptSummarizer != null ? builder.transcriptSummarizer : new KeywordTranscriptSummarizer(),
        builder.resultStore != null ? builder.resultStore : ResultStore.NONE,
        builder.metrics != null ? builder.metrics : MetricsExporter.NOOP,
        builder.rateLimiter,
        builder.drainTimeoutMs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts a run. Workers begin dispatching immediately.
   *
   * @param run the campaign to run
   * @return the running execution, whose results may be iterated once
   */
  public CampaignExecution run(CampaignRun run) {
    return run(run, new CancellationToken());
  }

  /**
   * Starts a run that is also cancelled when {@code cancellation} is. The run stops following
   * {@code cancellation} once it finishes, so one token may be reused for many runs.
   *
   * @param run          the campaign to run
   * @param cancellation an external cancellation source
   * @return the running execution
   */
  public CampaignExecution run(CampaignRun run, CancellationToken cancellation) {
    Objects.requireNonNull(run, "run");
    Objects.requireNonNull(cancellation, "cancellation");
    CampaignExecution execution = new CampaignExecution(run, collaborators, cancellation.child(), active::remove);
    active.add(execution);
    if (execution.isDone()) {
      active.remove(execution);
    }
    return execution;
  }

  /**
   * Returns the runs that have not finished yet.
   */
  public List<CampaignExecution> activeRuns() {
    return List.copyOf(active);
  }

  /**
   * Cancels and closes every unfinished run, waiting up to the drain timeout for each.
   */
  @Override
  public void close() {
    List<CampaignExecution> running = activeRuns();
    if (!running.isEmpty()) {
      logger.info(() -> "Closing dispatcher with " + running.size() + " active campaign(s)");
    }
    for (CampaignExecution execution : running) {
      execution.close();
    }
  }

  /** Dependencies handed to each run. */
  record Collaborators(
      CallClient callClient,
      PhoneNumberNormalizer normalizer,
      TranscriptSummarizer summarizer,
      ResultStore resultStore,
      MetricsExporter metrics,
      RateLimiter sharedRateLimiter,
      long drainTimeoutMs) {

    RateLimiter rateLimiterFor(CampaignRun run) {
      return sharedRateLimiter != null
          ? sharedRateLimiter : SlidingWindowRateLimiter.perMinute(run.rateLimitPerMinute());
    }
  }

  /** Builder for {@link CampaignDispatcher}. */
  public static final class Builder {
    private CallClient callClient;
    private PhoneNumberNormalizer normalizer;
    private TranscriptSummarizer transcriptSummarizer;
    private ResultStore resultStore;
    private MetricsExporter metrics;
    private RateLimiter rateLimiter;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the client used to place, poll and read calls.
     *
     * <p><b>Required.</b>
     *
     * @param callClient the calling service client
     * @return this builder
     */
    public Builder callClient(CallClient callClient) {
      this.callClient = callClient;
      return this;
    }

    /**
     * Sets the phone number normalizer.
     *
     * <p>Optional. Defaults to a new {@link PhoneNumberNormalizer}.
     *
     * @param normalizer the normalizer
     * @return this builder
     */
    public Builder normalizer(PhoneNumberNormalizer normalizer) {
      this.normalizer = normalizer;
      return this;
    }

    /**
     * Sets how transcripts of successful calls are classified.
     *
     * <p>Optional. Defaults to {@link KeywordTranscriptSummarizer}.
     *
     * @param transcriptSummarizer the summarizer
     * @return this builder
     */
    public Builder transcriptSummarizer(TranscriptSummarizer transcriptSummarizer) {
      this.transcriptSummarizer = transcriptSummarizer;
      return this;
    }

    /**
     * Sets where each contact's result is saved as it is produced.
     *
     * <p>Optional. Defaults to {@link ResultStore#NONE}.
     *
     * @param resultStore the result store
     * @return this builder
     */
    public Builder resultStore(ResultStore resultStore) {
      this.resultStore = resultStore;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets a rate limiter shared by all runs of this dispatcher.
     *
     * <p>Optional. When unset each run gets its own limiter of
     * {@link CampaignRun#rateLimitPerMinute()} calls per rolling minute.
     *
     * @param rateLimiter the shared limiter
     * @return this builder
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Sets how long closing waits for calls in progress before interrupting workers.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * @return a new {@link CampaignDispatcher}
     * @throws NullPointerException     if {@code callClient} is null
     * @throws IllegalArgumentException if {@code drainTimeoutMs} is negative
     */
    public CampaignDispatcher build() {
      return new CampaignDispatcher(this);
    }
  }
}
