package callcampaign;

import callcampaign.client.CallClientException;
import callcampaign.dispatch.CampaignExecution;
import callcampaign.dispatch.StubCallClient;
import callcampaign.retry.DefaultRetryPolicy;
import callcampaign.spi.MetricsExporter;
import callcampaign.store.InMemoryContactListStore;
import callcampaign.store.InMemoryResultStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CampaignRunnerTest {

  private final StubCallClient client = new StubCallClient();
  private final InMemoryContactListStore contacts = new InMemoryContactListStore();
  private final ScriptConfig script = ScriptConfig.builder().task("Reminder for {{display_name}}").build();

  @Test
  void runToCompletionReportsEveryContact() {
    contacts.save("spring", List.of(
        new Contact("a", "415 555 0101", "Ana", null),
        new Contact("b", "415 555 0102", "Ben", null),
        new Contact("c", "n/a", "Cy", null)));
    InMemoryResultStore results = new InMemoryResultStore();

    try (CampaignRunner runner = runner().resultStore(results).build()) {
      CampaignReport report = runner.runToCompletion("spring");

      assertEquals("spring", report.campaignId());
      assertEquals(3, report.results().size());
      assertEquals(2, report.snapshot().succeeded());
      assertEquals(1, report.snapshot().failed());
      assertEquals(66.7, report.snapshot().successRate());
      assertEquals(ErrorKind.INVALID_PHONE_NUMBER, report.resultFor("c").orElseThrow().errorKind());
      assertEquals(2, report.resultsWith(FinalStatus.SUCCEEDED).size());
      assertFalse(report.elapsed().isNegative());
      assertEquals(3, results.findByCampaign("spring").size());
      assertEquals(3, report.analytics().totalCalls());
      assertEquals(3, report.analytics().busyOrVoicemail());
      assertEquals(0.0, report.analytics().confirmationRate());
    }
  }

  @Test
  void startAppliesRunnerDefaults() throws Exception {
    contacts.save("spring", List.of(new Contact("a", "415 555 0101", "Ana", null)));

    try (CampaignRunner runner = runner().build()) {
      CampaignExecution execution = runner.start("spring");

      assertTrue(execution.awaitCompletion(Duration.ofSeconds(5)));
      assertEquals("+14155550101", client.initiations().get(0).phone().e164());
      assertEquals("Reminder for Ana", client.initiations().get(0).script().task());
    }
  }

  @Test
  void emptyCampaignIsRejected() {
    try (CampaignRunner runner = runner().build()) {
      IllegalStateException e = assertThrows(IllegalStateException.class, () -> runner.start("missing"));
      assertTrue(e.getMessage().contains("No contacts found"));
    }
  }

  @Test
  void authFailureThrowsWithPartialReport() {
    contacts.save("spring", List.of(
        new Contact("a", "415 555 0101", "Ana", null),
        new Contact("b", "415 555 0102", "Ben", null)));
    client.failAllInitiates(() -> CallClientException.authError("401"));

    try (CampaignRunner runner = runner().concurrencyLimit(1).build()) {
      CampaignAbortedException e = assertThrows(CampaignAbortedException.class,
          () -> runner.runToCompletion("spring"));

      assertEquals(ErrorKind.AUTH_ERROR, e.getCause().kind());
      assertEquals(2, e.report().results().size());
      assertEquals(1, e.report().snapshot().failed());
      assertEquals(1, e.report().snapshot().cancelled());
    }
  }

  @Test
  void newRunCanBeAdjustedBeforeRunning() {
    contacts.save("spring", List.of(new Contact("a", "415 555 0101", "Ana", null)));

    try (CampaignRunner runner = runner().build()) {
      CampaignRun run = runner.newRun("spring")
          .scriptConfig(ScriptConfig.builder().task("Override").build())
          .build();
      runner.runToCompletion(run);

      assertEquals("Override", client.initiations().get(0).script().task());
    }
  }

  @Test
  void closeClosesAutoCloseableMetrics() {
    AtomicBoolean closed = new AtomicBoolean();
    MetricsExporter metrics = new ClosingMetrics(closed);

    runner().metrics(metrics).build().close();

    assertTrue(closed.get());
  }

  @Test
  void builderRejectsMissingCollaboratorsAndReuse() {
    assertThrows(NullPointerException.class, () -> CampaignRunner.builder().callClient(client).build());
    assertThrows(NullPointerException.class,
        () -> CampaignRunner.builder().contactListStore(contacts).scriptConfig(script).build());

    CampaignRunner.Builder builder = runner();
    builder.build().close();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void builderValidatesRunDefaults() {
    assertThrows(IllegalArgumentException.class, () -> runner().defaultCountry("+999").build());
    assertThrows(IllegalArgumentException.class, () -> runner().concurrencyLimit(0).build());
    assertThrows(IllegalArgumentException.class, () -> runner().rateLimitPerMinute(0).build());
  }

  @Test
  void builderChangesAfterBuildDoNotReachRunner() {
    contacts.save("spring", List.of(new Contact("a", "415 555 0101", "Ana", null)));
    CampaignRunner.Builder builder = runner().concurrencyLimit(2);

    try (CampaignRunner runner = builder.build()) {
      builder.concurrencyLimit(0).defaultCountry("+999").scriptConfig(null);

      CampaignRun run = runner.newRun("spring").build();

      assertEquals(2, run.concurrencyLimit());
      assertEquals("+1", run.defaultCountry());
      assertSame(script, run.scriptConfig());
    }
  }

  private CampaignRunner.Builder runner() {
    return CampaignRunner.builder()
        .contactListStore(contacts)
        .callClient(client)
        .scriptConfig(script)
        .defaultCountry("+1")
        .pollInterval(Duration.ofMillis(5))
        .maxPollInterval(Duration.ofMillis(20))
        .retryPolicy(new DefaultRetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(20)));
  }

  private static final class ClosingMetrics implements MetricsExporter, AutoCloseable {
    private final AtomicBoolean closed;

    ClosingMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

    @Override
    public void incrementCallInitiated() {}

    @Override
    public void incrementCallSucceeded() {}

    @Override
    public void incrementAttemptFailed(ErrorKind kind) {}

    @Override
    public void incrementContactFailed() {}

    @Override
    public void incrementContactGaveUp() {}

    @Override
    public void incrementContactCancelled() {}

    @Override
    public void recordInFlight(int inFlight) {}

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
