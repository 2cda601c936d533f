package callcampaign.dispatch;

import callcampaign.CampaignResult;
import callcampaign.CampaignRun;
import callcampaign.CancellationToken;
import callcampaign.Contact;
import callcampaign.ErrorKind;
import callcampaign.aggregate.CampaignAnalytics;
import callcampaign.aggregate.CampaignSnapshot;
import callcampaign.aggregate.ResultAggregator;
import callcampaign.client.CallClientException;
import callcampaign.spi.MetricsExporter;
import callcampaign.spi.ResultStore;
import callcampaign.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One running campaign: a pool of workers driving contacts to their final results, and a
 * collector handing those results to the consumer in completion order.
 *
 * <p>Contacts wait in a shared queue; each worker takes the next one, runs its call state machine
 * and hands the result to a single collector thread. The collector records it in the
 * {@link ResultAggregator}, saves it to the {@link ResultStore} and publishes it to the iterator.
 * Every contact of the run is published exactly once, whether it completes, fails or is cancelled.
 *
 * <p>The results can be consumed once, either through {@link #iterator()} or {@link #stream()}.
 * Consuming is optional: the run proceeds on its own and {@link #awaitCompletion} waits for it.
 *
 * <p>Instances are created by {@link CampaignDispatcher#run}. Closing cancels the run if it is
 * still going and stops the workers within the dispatcher's drain timeout.
 */
public final class CampaignExecution implements Iterable<CampaignResult>, AutoCloseable {
  private static final Logger logger = Logger.getLogger(CampaignExecution.class.getName());

  private final CampaignRun run;
  private final DispatchContext ctx;
  private final ResultStore resultStore;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;
  private final Consumer<CampaignExecution> onFinish;

  private final BlockingQueue<Contact> queued;
  private final BlockingQueue<CampaignResult> completed = new LinkedBlockingQueue<>();
  private final BlockingQueue<CampaignResult> published = new LinkedBlockingQueue<>();
  private final ResultAggregator aggregator;
  private final CancellationToken token;
  private final AtomicReference<CallClientException> abortCause = new AtomicReference<>();
  private final AtomicBoolean consumed = new AtomicBoolean(false);
  private final AtomicInteger activeWorkers;
  private final CountDownLatch done = new CountDownLatch(1);
  private final ExecutorService workers;
  private final Thread collector;
  private final int total;
  private final Instant startedAt = Instant.now();

  CampaignExecution(CampaignRun run, CampaignDispatcher.Collaborators collaborators,
      CancellationToken token, Consumer<CampaignExecution> onFinish) {
    this.run = run;
    this.token = token;
    this.resultStore = collaborators.resultStore();
    this.metrics = collaborators.metrics();
    this.drainTimeoutMs = collaborators.drainTimeoutMs();
    this.onFinish = onFinish;
    this.total = run.contacts().size();
    this.queued = new LinkedBlockingQueue<>(run.contacts());
    this.aggregator = new ResultAggregator(total);
    this.ctx = new DispatchContext(run, collaborators.callClient(), collaborators.normalizer(),
        collaborators.rateLimiterFor(run), collaborators.summarizer(), metrics, token, this::abort);

    String prefix = "campaign-" + run.campaignId() + "-";
    int workerCount = Math.max(1, Math.min(run.concurrencyLimit(), total));
    this.activeWorkers = new AtomicInteger(workerCount);
    this.collector = new DaemonThreadFactory(prefix + "collector-").newThread(this::collectLoop);

    this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory(prefix + "worker-"));

    logger.info(() -> "Starting campaign " + run.campaignId() + ": " + total + " contacts, "
        + "concurrency " + run.concurrencyLimit() + ", " + run.rateLimitPerMinute() + " calls/min");
    for (int i = 0; i < workerCount; i++) {
      workers.submit(this::workerLoop);
    }
    collector.start();
    token.onCancel(this::drainQueued);
  }

  public String campaignId() {
    return run.campaignId();
  }

  public Instant startedAt() {
    return startedAt;
  }

  /**
   * Returns the lazy sequence of results in completion order. May be called once.
   *
   * @throws IllegalStateException if the results were already consumed
   */
  @Override
  public Iterator<CampaignResult> iterator() {
    if (!consumed.compareAndSet(false, true)) {
      throw new IllegalStateException("Results of campaign " + run.campaignId() + " already consumed");
    }
    return new ResultIterator();
  }

  /**
   * Returns the results as a sequential stream. Shares the single-use restriction of
   * {@link #iterator()}.
   */
  public Stream<CampaignResult> stream() {
    return StreamSupport.stream(
        Spliterators.spliterator(iterator(), total, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  /**
   * Requests cancellation. No call is initiated after this returns; calls already in progress
   * run to their outcome and contacts still waiting are published as cancelled.
   */
  public void cancel() {
    token.cancel();
  }

  public boolean isCancelled() {
    return token.isCancelled();
  }

  /**
   * Returns the authentication failure that aborted the run, if any.
   */
  public Optional<CallClientException> abortCause() {
    return Optional.ofNullable(abortCause.get());
  }

  public CampaignSnapshot snapshot() {
    return aggregator.snapshot();
  }

  /** Outcome counts and total call length of the results emitted so far. */
  public CampaignAnalytics analytics() {
    return aggregator.analytics();
  }

  /**
   * Waits until every contact has a recorded result.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the run completed within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public boolean isDone() {
    return done.getCount() == 0;
  }

  private void abort(CallClientException cause) {
    if (abortCause.compareAndSet(null, cause)) {
      logger.log(Level.SEVERE, "Campaign " + run.campaignId()
          + " aborted: calling service rejected credentials", cause);
      token.cancel();
    }
  }

  private void workerLoop() {
    try {
      while (!token.isCancelled() && !Thread.currentThread().isInterrupted()) {
        Contact contact = queued.poll();
        if (contact == null) {
          break;
        }
        aggregator.markInFlight(contact.id());
        metrics.recordInFlight(aggregator.snapshot().inFlight());
        completed.add(runContact(contact));
      }
    } finally {
      if (activeWorkers.decrementAndGet() == 0) {
        drainQueued();
      }
    }
  }

  private CampaignResult runContact(Contact contact) {
    try {
      return new ContactCallTask(contact, ctx).call();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Worker error for contact " + contact.id(), t);
      metrics.incrementContactFailed();
      return CampaignResult.failed(contact.id(), ErrorKind.SERVICE_UNAVAILABLE, List.of(), Instant.now());
    }
  }

  private void drainQueued() {
    Contact contact;
    while ((contact = queued.poll()) != null) {
      metrics.incrementContactCancelled();
      completed.add(CampaignResult.cancelled(contact.id(), List.of(), Instant.now()));
    }
  }

  private void collectLoop() {
    int collected = 0;
    while (collected < total) {
      CampaignResult result;
      try {
        result = completed.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        int pending = total - collected;
        logger.warning(() -> "Collector for campaign " + run.campaignId() + " interrupted with "
            + pending + " results pending");
        return;
      }
      collected++;
      try {
        aggregator.record(result);
      } catch (IllegalStateException e) {
        logger.log(Level.SEVERE, "Rejected result for contact " + result.contactId(), e);
        continue;
      }
      metrics.recordInFlight(aggregator.snapshot().inFlight());
      try {
        resultStore.save(run.campaignId(), result);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to save result for contact " + result.contactId(), e);
      }
      published.add(result);
    }
    CampaignSnapshot snapshot = aggregator.snapshot();
    logger.info(() -> "Campaign " + run.campaignId() + " finished: " + snapshot.succeeded() + " succeeded, "
        + snapshot.failed() + " failed, " + snapshot.gaveUp() + " gave up, " + snapshot.cancelled()
        + " cancelled");
    token.detach();
    done.countDown();
    finish();
  }

  private void finish() {
    workers.shutdown();
    onFinish.accept(this);
  }

  /**
   * Cancels the run if still going, then waits up to the drain timeout for in-progress calls
   * before interrupting the workers.
   */
  @Override
  public void close() {
    if (!isDone()) {
      token.cancel();
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded for campaign " + run.campaignId()
            + "; forcing shutdown. In flight: " + aggregator.snapshot().inFlight());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
      done.await(drainTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private final class ResultIterator implements Iterator<CampaignResult> {
    private int emitted;

    @Override
    public boolean hasNext() {
      return emitted < total && !(isDone() && published.isEmpty());
    }

    @Override
    public CampaignResult next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      try {
        CampaignResult result = published.take();
        emitted++;
        return result;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new NoSuchElementException("Interrupted while waiting for the next result of campaign "
            + run.campaignId());
      }
    }
  }
}
