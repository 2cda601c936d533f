package callcampaign.spring.boot;

import callcampaign.CampaignReport;
import callcampaign.CampaignRunner;
import callcampaign.Contact;
import callcampaign.FinalStatus;
import callcampaign.ScriptConfig;
import callcampaign.retry.DefaultRetryPolicy;
import callcampaign.retry.RetryPolicy;
import callcampaign.spi.ContactListStore;
import callcampaign.spi.ResultStore;
import callcampaign.store.InMemoryContactListStore;
import callcampaign.store.InMemoryResultStore;
import callcampaign.transcript.CallOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CallCampaignAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(CallCampaignAutoConfiguration.class))
      .withPropertyValues(
          "callcampaign.script.task=Hi {{display_name}}, confirming your {{appointment_date}} visit",
          "callcampaign.dispatcher.poll-interval=10ms");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(CallClientConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("campaignRunner"));
      assertTrue(ctx.containsBean("scriptConfig"));
      assertTrue(ctx.containsBean("retryPolicy"));
      assertTrue(ctx.containsBean("phoneNumberNormalizer"));
      assertTrue(ctx.containsBean("transcriptSummarizer"));

      assertInstanceOf(InMemoryContactListStore.class, ctx.getBean(ContactListStore.class));
      assertInstanceOf(InMemoryResultStore.class, ctx.getBean(ResultStore.class));
      assertEquals(3, ((DefaultRetryPolicy) ctx.getBean(RetryPolicy.class)).maxAttempts());
      assertEquals("maya", ctx.getBean(ScriptConfig.class).voice());
    });
  }

  @Test
  void runsCampaignFromContext() {
    runner.withUserConfiguration(CallClientConfig.class).run(ctx -> {
      ctx.getBean(ContactListStore.class).save("spring", List.of(
          new Contact("a", "415 555 0101", "Ana", null, Map.of("appointment_date", "May 3")),
          new Contact("b", "(415) 555-0102", "Ben", null)));

      CampaignReport report = ctx.getBean(CampaignRunner.class).runToCompletion("spring");

      assertEquals(2, report.resultsWith(FinalStatus.SUCCEEDED).size());
      assertEquals(CallOutcome.CONFIRMED, report.resultFor("a").orElseThrow().outcome());
      assertEquals(2, ctx.getBean(ResultStore.class).findByCampaign("spring").size());
      StubCallClient client = ctx.getBean(StubCallClient.class);
      assertTrue(client.scripts.stream().anyMatch(s -> s.task().equals("Hi Ana, confirming your May 3 visit")));
    });
  }

  @Test
  void customRetryAndScriptProperties() {
    runner
        .withPropertyValues("callcampaign.retry.max-attempts=5",
            "callcampaign.script.voice=nat",
            "callcampaign.script.first-sentence=Hello!",
            "callcampaign.script.voicemail-message=Please call us back.",
            "callcampaign.dispatcher.rate-limit-scope=GLOBAL")
        .withUserConfiguration(CallClientConfig.class).run(ctx -> {
          assertEquals(5, ((DefaultRetryPolicy) ctx.getBean(RetryPolicy.class)).maxAttempts());
          assertEquals("nat", ctx.getBean(ScriptConfig.class).voice());
          assertEquals("Hello!", ctx.getBean(ScriptConfig.class).firstSentence());
          assertEquals("Please call us back.", ctx.getBean(ScriptConfig.class).voicemailMessage());
          assertNotNull(ctx.getBean(CampaignRunner.class));
        });
  }

  @Test
  void missingTaskFailsStartup() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CallCampaignAutoConfiguration.class))
        .withUserConfiguration(CallClientConfig.class)
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void notLoadedWithoutCallClient() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("campaignRunner"));
      assertTrue(ctx.getBeansOfType(CampaignRunner.class).isEmpty());
    });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CallClientConfig.class, CustomStoreConfig.class).run(ctx -> {
      assertEquals("myContacts", ctx.getBeanNamesForType(ContactListStore.class)[0]);
      assertEquals(1, ctx.getBeanNamesForType(ContactListStore.class).length);
    });
  }

  // ── Test configurations ──────────────────────────────────────

  @Configuration
  static class CallClientConfig {
    @Bean
    StubCallClient callClient() {
      return new StubCallClient();
    }
  }

  @Configuration
  static class CustomStoreConfig {
    @Bean("myContacts")
    ContactListStore contactListStore() {
      return new InMemoryContactListStore();
    }
  }

  static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
