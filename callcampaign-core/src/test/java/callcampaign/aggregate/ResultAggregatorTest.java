package callcampaign.aggregate;

import callcampaign.CampaignResult;
import callcampaign.ErrorKind;
import callcampaign.transcript.CallOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

  @Test
  void countsEachFinalStatus() {
    ResultAggregator aggregator = new ResultAggregator(4);

    aggregator.record(CampaignResult.succeeded("a", List.of(), null, null, Instant.now()));
    aggregator.record(CampaignResult.failed("b", ErrorKind.INVALID_PHONE_NUMBER, List.of(), Instant.now()));
    aggregator.record(CampaignResult.gaveUp("c", ErrorKind.SERVICE_UNAVAILABLE, List.of(), Instant.now()));
    aggregator.record(CampaignResult.cancelled("d", List.of(), Instant.now()));

    assertEquals(new CampaignSnapshot(4, 1, 1, 1, 1, 0), aggregator.snapshot());
    assertTrue(aggregator.snapshot().isDone());
    assertEquals(2, aggregator.snapshot().unsuccessful());
  }

  @Test
  void inFlightClearsWhenRecorded() {
    ResultAggregator aggregator = new ResultAggregator(3);

    aggregator.markInFlight("a");
    aggregator.markInFlight("b");
    assertEquals(2, aggregator.snapshot().inFlight());
    assertEquals(1, aggregator.snapshot().pending());

    aggregator.record(CampaignResult.cancelled("a", List.of(), Instant.now()));

    CampaignSnapshot snapshot = aggregator.snapshot();
    assertEquals(1, snapshot.inFlight());
    assertEquals(1, snapshot.completed());
    assertEquals(1, snapshot.pending());
  }

  @Test
  void rejectsDuplicateContact() {
    ResultAggregator aggregator = new ResultAggregator(2);
    aggregator.record(CampaignResult.cancelled("a", List.of(), Instant.now()));

    assertThrows(IllegalStateException.class,
        () -> aggregator.record(CampaignResult.cancelled("a", List.of(), Instant.now())));
    assertEquals(1, aggregator.snapshot().completed());
  }

  @Test
  void rejectsMoreResultsThanContacts() {
    ResultAggregator aggregator = new ResultAggregator(1);
    aggregator.record(CampaignResult.cancelled("a", List.of(), Instant.now()));

    assertThrows(IllegalStateException.class,
        () -> aggregator.record(CampaignResult.cancelled("b", List.of(), Instant.now())));
    assertEquals(1, aggregator.snapshot().completed());
  }

  @Test
  void successRateIsRoundedToOneDecimal() {
    assertEquals(66.7, new CampaignSnapshot(3, 2, 1, 0, 0, 0).successRate());
    assertEquals(0.0, new CampaignSnapshot(3, 0, 0, 0, 0, 0).successRate());
    assertEquals(100.0, new CampaignSnapshot(1, 1, 0, 0, 0, 0).successRate());
  }

  @Test
  void analyticsBucketOutcomesAndSumCallLength() {
    ResultAggregator aggregator = new ResultAggregator(6);
    Instant now = Instant.now();

    aggregator.record(CampaignResult.succeeded("a", List.of(), "yes", CallOutcome.CONFIRMED, Duration.ofSeconds(40), now));
    aggregator.record(CampaignResult.succeeded("b", List.of(), "cancel", CallOutcome.CANCELLED, Duration.ofSeconds(25), now));
    aggregator.record(CampaignResult.succeeded("c", List.of(), "hm", CallOutcome.CONTACTED, Duration.ofSeconds(10), now));
    aggregator.record(CampaignResult.succeeded("d", List.of(), null, CallOutcome.NO_ANSWER_OR_VOICEMAIL, now));
    aggregator.record(CampaignResult.gaveUp("e", ErrorKind.CALL_FAILED, List.of(), now));
    aggregator.record(CampaignResult.cancelled("f", List.of(), now));

    CampaignAnalytics analytics = aggregator.analytics();
    assertEquals(new CampaignAnalytics(5, 1, 1, 0, 3, Duration.ofSeconds(75)), analytics);
    assertEquals(20.0, analytics.confirmationRate());
    assertEquals(analytics, CampaignAnalytics.of(List.of(
        CampaignResult.succeeded("a", List.of(), "yes", CallOutcome.CONFIRMED, Duration.ofSeconds(40), now),
        CampaignResult.succeeded("b", List.of(), "cancel", CallOutcome.CANCELLED, Duration.ofSeconds(25), now),
        CampaignResult.succeeded("c", List.of(), "hm", CallOutcome.CONTACTED, Duration.ofSeconds(10), now),
        CampaignResult.succeeded("d", List.of(), null, CallOutcome.NO_ANSWER_OR_VOICEMAIL, now),
        CampaignResult.gaveUp("e", ErrorKind.CALL_FAILED, List.of(), now),
        CampaignResult.cancelled("f", List.of(), now))));
  }

  @Test
  void confirmationRateIsRoundedAndCountsMustAddUp() {
    CampaignAnalytics analytics = new CampaignAnalytics(3, 1, 0, 0, 2, Duration.ZERO);

    assertEquals(33.3, analytics.confirmationRate());
    assertEquals(0.0, new CampaignAnalytics(0, 0, 0, 0, 0, Duration.ZERO).confirmationRate());
    assertThrows(IllegalArgumentException.class,
        () -> new CampaignAnalytics(3, 1, 0, 0, 0, Duration.ZERO));
  }

  @Test
  void concurrentRecordsAreAllCounted() throws Exception {
    int total = 200;
    ResultAggregator aggregator = new ResultAggregator(total);
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> threads = new ArrayList<>();
    for (int t = 0; t < 4; t++) {
      int offset = t;
      Thread thread = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int i = offset; i < total; i += 4) {
          aggregator.record(CampaignResult.succeeded("c" + i, List.of(), null, null, Instant.now()));
        }
      });
      thread.start();
      threads.add(thread);
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join(5000);
    }

    assertEquals(total, aggregator.snapshot().succeeded());
    assertTrue(aggregator.snapshot().isDone());
  }
}
