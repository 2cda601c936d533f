package callcampaign.micrometer;

import callcampaign.ErrorKind;
import callcampaign.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code callcampaign.call.initiated}: calls accepted by the calling service</li>
 *   <li>{@code callcampaign.call.succeeded}: contacts whose call succeeded</li>
 *   <li>{@code callcampaign.attempt.failed}: failed attempts, tagged {@code kind}</li>
 *   <li>{@code callcampaign.contact.failed}: contacts ended by a terminal error</li>
 *   <li>{@code callcampaign.contact.gave_up}: contacts that ran out of retries</li>
 *   <li>{@code callcampaign.contact.cancelled}: contacts emitted as cancelled</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code callcampaign.contacts.in_flight}: contacts currently being worked on</li>
 *   <li>{@code callcampaign.ratelimit.waiting}: workers blocked on the rate limiter</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code callcampaign.call.duration}: initiation to terminal remote status</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter callInitiated;
  private final Counter callSucceeded;
  private final Map<ErrorKind, Counter> attemptFailed = new EnumMap<>(ErrorKind.class);
  private final Counter contactFailed;
  private final Counter contactGaveUp;
  private final Counter contactCancelled;
  private final Gauge inFlightGauge;
  private final Gauge rateLimiterWaitingGauge;
  private final Timer callDuration;

  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger rateLimiterWaiting = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "callcampaign"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "callcampaign");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "reminders.campaign"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.callInitiated = Counter.builder(namePrefix + ".call.initiated")
        .description("Calls accepted by the calling service")
        .register(registry);
    this.callSucceeded = Counter.builder(namePrefix + ".call.succeeded")
        .description("Contacts whose call succeeded")
        .register(registry);
    for (ErrorKind kind : ErrorKind.values()) {
      attemptFailed.put(kind, Counter.builder(namePrefix + ".attempt.failed")
          .description("Failed call attempts")
          .tag("kind", kind.name())
          .register(registry));
    }
    this.contactFailed = Counter.builder(namePrefix + ".contact.failed")
        .description("Contacts ended by a terminal error")
        .register(registry);
    this.contactGaveUp = Counter.builder(namePrefix + ".contact.gave_up")
        .description("Contacts that exhausted their retries")
        .register(registry);
    this.contactCancelled = Counter.builder(namePrefix + ".contact.cancelled")
        .description("Contacts emitted as cancelled")
        .register(registry);

    this.inFlightGauge = Gauge.builder(namePrefix + ".contacts.in_flight", inFlight, AtomicInteger::get)
        .register(registry);
    this.rateLimiterWaitingGauge = Gauge.builder(namePrefix + ".ratelimit.waiting",
            rateLimiterWaiting, AtomicInteger::get)
        .register(registry);
    this.callDuration = Timer.builder(namePrefix + ".call.duration")
        .description("Time from initiation to terminal call status")
        .register(registry);
  }

  @Override
  public void incrementCallInitiated() {
    if (closed) return;
    callInitiated.increment();
  }

  @Override
  public void incrementCallSucceeded() {
    if (closed) return;
    callSucceeded.increment();
  }

  @Override
  public void incrementAttemptFailed(ErrorKind kind) {
    if (closed) return;
    attemptFailed.get(Objects.requireNonNull(kind, "kind")).increment();
  }

  @Override
  public void incrementContactFailed() {
    if (closed) return;
    contactFailed.increment();
  }

  @Override
  public void incrementContactGaveUp() {
    if (closed) return;
    contactGaveUp.increment();
  }

  @Override
  public void incrementContactCancelled() {
    if (closed) return;
    contactCancelled.increment();
  }

  @Override
  public void recordInFlight(int inFlight) {
    if (closed) return;
    this.inFlight.set(inFlight);
  }

  @Override
  public void recordRateLimiterWaiting(int waiting) {
    if (closed) return;
    this.rateLimiterWaiting.set(waiting);
  }

  @Override
  public void recordCallDurationMs(long durationMs) {
    if (closed) return;
    callDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link callcampaign.CampaignRunner} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(callInitiated, callSucceeded, contactFailed,
        contactGaveUp, contactCancelled, inFlightGauge, rateLimiterWaitingGauge, callDuration));
    meters.addAll(attemptFailed.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
