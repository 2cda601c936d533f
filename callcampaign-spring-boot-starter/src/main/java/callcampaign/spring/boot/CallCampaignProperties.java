package callcampaign.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration properties for call campaigns.
 *
 * @see CallCampaignAutoConfiguration
 */
@ConfigurationProperties(prefix = "callcampaign")
public class CallCampaignProperties {

    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final Phone phone = new Phone();
    private final Script script = new Script();
    private final Http http = new Http();
    private final Jdbc jdbc = new Jdbc();
    private final Metrics metrics = new Metrics();

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public Phone getPhone() {
        return phone;
    }

    public Script getScript() {
        return script;
    }

    public Http getHttp() {
        return http;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Whether each campaign gets its own rate limit or all campaigns share one.
     */
    public enum RateLimitScope {
        CAMPAIGN,
        GLOBAL
    }

    public static class Dispatcher {
        private int concurrencyLimit = 4;
        private int rateLimitPerMinute = 60;
        private RateLimitScope rateLimitScope = RateLimitScope.CAMPAIGN;
        private Duration attemptTimeout = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofSeconds(2);
        private Duration maxPollInterval = Duration.ofSeconds(15);
        private long drainTimeoutMs = 5000;

        public int getConcurrencyLimit() {
            return concurrencyLimit;
        }

        public void setConcurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
        }

        public int getRateLimitPerMinute() {
            return rateLimitPerMinute;
        }

        public void setRateLimitPerMinute(int rateLimitPerMinute) {
            this.rateLimitPerMinute = rateLimitPerMinute;
        }

        public RateLimitScope getRateLimitScope() {
            return rateLimitScope;
        }

        public void setRateLimitScope(RateLimitScope rateLimitScope) {
            this.rateLimitScope = rateLimitScope;
        }

        public Duration getAttemptTimeout() {
            return attemptTimeout;
        }

        public void setAttemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getMaxPollInterval() {
            return maxPollInterval;
        }

        public void setMaxPollInterval(Duration maxPollInterval) {
            this.maxPollInterval = maxPollInterval;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(30);
        private Duration maxDelay = Duration.ofMinutes(10);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Phone {
        /**
         * Calling code applied to numbers without an international prefix.
         */
        private String defaultCountry = "+1";

        public String getDefaultCountry() {
            return defaultCountry;
        }

        public void setDefaultCountry(String defaultCountry) {
            this.defaultCountry = defaultCountry;
        }
    }

    public static class Script {
        /**
         * Script the voice agent follows; may contain {{placeholders}}. Required.
         */
        private String task;
        private String voice = "maya";
        private String language = "en-US";
        private int maxDurationSeconds = 300;
        private boolean record = true;
        private boolean waitForGreeting = true;
        private boolean answeredByEnabled = true;
        private String firstSentence;
        /** Message left on an answering machine; may contain placeholders. */
        private String voicemailMessage;

        public String getTask() {
            return task;
        }

        public void setTask(String task) {
            this.task = task;
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public int getMaxDurationSeconds() {
            return maxDurationSeconds;
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = maxDurationSeconds;
        }

        public boolean isRecord() {
            return record;
        }

        public void setRecord(boolean record) {
            this.record = record;
        }

        public boolean isWaitForGreeting() {
            return waitForGreeting;
        }

        public void setWaitForGreeting(boolean waitForGreeting) {
            this.waitForGreeting = waitForGreeting;
        }

        public boolean isAnsweredByEnabled() {
            return answeredByEnabled;
        }

        public void setAnsweredByEnabled(boolean answeredByEnabled) {
            this.answeredByEnabled = answeredByEnabled;
        }

        public String getFirstSentence() {
            return firstSentence;
        }

        public void setFirstSentence(String firstSentence) {
            this.firstSentence = firstSentence;
        }

        public String getVoicemailMessage() {
            return voicemailMessage;
        }

        public void setVoicemailMessage(String voicemailMessage) {
            this.voicemailMessage = voicemailMessage;
        }
    }

    public static class Http {
        private URI baseUrl = URI.create("https://api.bland.ai");
        /**
         * Bearer key for the calling service. The HTTP client is only created when this is set.
         */
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration responseTimeout = Duration.ofSeconds(30);

        public URI getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(URI baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getResponseTimeout() {
            return responseTimeout;
        }

        public void setResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
        }
    }

    public static class Jdbc {
        private boolean enabled = true;
        private String contactTable = "campaign_contact";
        private String resultTable = "campaign_result";
        private String attemptTable = "campaign_call_attempt";
        /** Schema holding the tables; the data source default when unset. */
        private String schema;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getContactTable() {
            return contactTable;
        }

        public void setContactTable(String contactTable) {
            this.contactTable = contactTable;
        }

        public String getResultTable() {
            return resultTable;
        }

        public void setResultTable(String resultTable) {
            this.resultTable = resultTable;
        }

        public String getAttemptTable() {
            return attemptTable;
        }

        public void setAttemptTable(String attemptTable) {
            this.attemptTable = attemptTable;
        }

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "callcampaign";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
