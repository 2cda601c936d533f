package callcampaign.spring.boot;

import callcampaign.CampaignRunner;
import callcampaign.ScriptConfig;
import callcampaign.client.CallClient;
import callcampaign.phone.PhoneNumberNormalizer;
import callcampaign.ratelimit.SlidingWindowRateLimiter;
import callcampaign.retry.DefaultRetryPolicy;
import callcampaign.retry.RetryPolicy;
import callcampaign.spi.ContactListStore;
import callcampaign.spi.MetricsExporter;
import callcampaign.spi.ResultStore;
import callcampaign.store.InMemoryContactListStore;
import callcampaign.store.InMemoryResultStore;
import callcampaign.transcript.KeywordTranscriptSummarizer;
import callcampaign.transcript.TranscriptSummarizer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for call campaigns.
 *
 * <p>Wires a {@link CampaignRunner} from a {@link CallClient} bean and
 * {@link CallCampaignProperties}. Contact lists and results live in memory unless
 * {@link CallCampaignJdbcAutoConfiguration} or the application provides stores.
 *
 * @see CallCampaignProperties
 * @see CallCampaignHttpAutoConfiguration
 * @see CallCampaignJdbcAutoConfiguration
 * @see CallCampaignMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {CallCampaignHttpAutoConfiguration.class, CallCampaignJdbcAutoConfiguration.class})
@ConditionalOnClass(CampaignRunner.class)
@ConditionalOnBean(CallClient.class)
@EnableConfigurationProperties(CallCampaignProperties.class)
public class CallCampaignAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ContactListStore contactListStore() {
        return new InMemoryContactListStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultStore resultStore() {
        return new InMemoryResultStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(CallCampaignProperties props) {
        CallCampaignProperties.Retry retry = props.getRetry();
        return new DefaultRetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay());
    }

    @Bean
    @ConditionalOnMissingBean
    public PhoneNumberNormalizer phoneNumberNormalizer() {
        return new PhoneNumberNormalizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public TranscriptSummarizer transcriptSummarizer() {
        return new KeywordTranscriptSummarizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScriptConfig scriptConfig(CallCampaignProperties props) {
        CallCampaignProperties.Script script = props.getScript();
        if (script.getTask() == null || script.getTask().isBlank()) {
            throw new IllegalStateException("callcampaign.script.task must be set");
        }
        return ScriptConfig.builder()
                .task(script.getTask())
                .voice(script.getVoice())
                .language(script.getLanguage())
                .maxDurationSeconds(script.getMaxDurationSeconds())
                .record(script.isRecord())
                .waitForGreeting(script.isWaitForGreeting())
                .answeredByEnabled(script.isAnsweredByEnabled())
                .firstSentence(script.getFirstSentence())
                .voicemailMessage(script.getVoicemailMessage())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public CampaignRunner campaignRunner(CallCampaignProperties props,
                                         CallClient callClient,
                                         ContactListStore contactListStore,
                                         ResultStore resultStore,
                                         ScriptConfig scriptConfig,
                                         RetryPolicy retryPolicy,
                                         PhoneNumberNormalizer normalizer,
                                         TranscriptSummarizer transcriptSummarizer,
                                         ObjectProvider<MetricsExporter> metricsProvider) {
        CallCampaignProperties.Dispatcher dispatcher = props.getDispatcher();
        CampaignRunner.Builder builder = CampaignRunner.builder()
                .contactListStore(contactListStore)
                .resultStore(resultStore)
                .callClient(callClient)
                .scriptConfig(scriptConfig)
                .retryPolicy(retryPolicy)
                .normalizer(normalizer)
                .transcriptSummarizer(transcriptSummarizer)
                .concurrencyLimit(dispatcher.getConcurrencyLimit())
                .rateLimitPerMinute(dispatcher.getRateLimitPerMinute())
                .defaultCountry(props.getPhone().getDefaultCountry())
                .attemptTimeout(dispatcher.getAttemptTimeout())
                .pollInterval(dispatcher.getPollInterval())
                .maxPollInterval(dispatcher.getMaxPollInterval())
                .drainTimeoutMs(dispatcher.getDrainTimeoutMs());
        if (dispatcher.getRateLimitScope() == CallCampaignProperties.RateLimitScope.GLOBAL) {
            builder.rateLimiter(SlidingWindowRateLimiter.perMinute(dispatcher.getRateLimitPerMinute()));
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }
}
