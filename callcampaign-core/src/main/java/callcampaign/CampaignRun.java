package callcampaign;

import callcampaign.phone.PhoneNumberNormalizer;
import callcampaign.retry.DefaultRetryPolicy;
import callcampaign.retry.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything needed to execute one campaign: the contact list and the run's policies.
 *
 * <p>Create instances via {@link #builder(String)}. Contact ids must be unique; the list order is
 * the order contacts are handed to workers, not the order results are emitted.
 */
public final class CampaignRun {
  private final String campaignId;
  private final List<Contact> contacts;
  private final int concurrencyLimit;
  private final int rateLimitPerMinute;
  private final RetryPolicy retryPolicy;
  private final ScriptConfig scriptConfig;
  private final String defaultCountry;
  private final Duration attemptTimeout;
  private final Duration pollInterval;
  private final Duration maxPollInterval;

  private CampaignRun(Builder builder) {
    this.campaignId = builder.campaignId;
    this.contacts = List.copyOf(builder.contacts);
    this.concurrencyLimit = builder.concurrencyLimit;
    this.rateLimitPerMinute = builder.rateLimitPerMinute;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : DefaultRetryPolicy.defaults();
    this.scriptConfig = builder.scriptConfig;
    this.defaultCountry = builder.defaultCountry;
    this.attemptTimeout = builder.attemptTimeout;
    this.pollInterval = builder.pollInterval;
    this.maxPollInterval = builder.maxPollInterval;
  }

  public static Builder builder(String campaignId) {
    return new Builder(campaignId);
  }

  public String campaignId() {
    return campaignId;
  }

  public List<Contact> contacts() {
    return contacts;
  }

  public int concurrencyLimit() {
    return concurrencyLimit;
  }

  public int rateLimitPerMinute() {
    return rateLimitPerMinute;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public ScriptConfig scriptConfig() {
    return scriptConfig;
  }

  /** Calling code applied to numbers without an international prefix, or null. */
  public String defaultCountry() {
    return defaultCountry;
  }

  public Duration attemptTimeout() {
    return attemptTimeout;
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public Duration maxPollInterval() {
    return maxPollInterval;
  }

  /**
   * Validates the per-run settings shared by {@link Builder} and {@link CampaignRunner.Builder}.
   */
  static void checkSettings(int concurrencyLimit, int rateLimitPerMinute, String defaultCountry,
      Duration attemptTimeout, Duration pollInterval, Duration maxPollInterval) {
    Objects.requireNonNull(attemptTimeout, "attemptTimeout");
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(maxPollInterval, "maxPollInterval");
    if (concurrencyLimit < 1) {
      throw new IllegalArgumentException("concurrencyLimit must be >= 1");
    }
    if (rateLimitPerMinute < 1) {
      throw new IllegalArgumentException("rateLimitPerMinute must be >= 1");
    }
    if (attemptTimeout.isNegative() || attemptTimeout.isZero()
        || pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("attemptTimeout and pollInterval must be > 0");
    }
    if (maxPollInterval.compareTo(pollInterval) < 0) {
      throw new IllegalArgumentException("maxPollInterval must be >= pollInterval");
    }
    if (defaultCountry != null && !defaultCountry.isBlank()) {
      PhoneNumberNormalizer.parseCallingCode(defaultCountry);
    }
  }

  /** Builder for {@link CampaignRun}. */
  public static final class Builder {
    private final String campaignId;
    private final List<Contact> contacts = new ArrayList<>();
    private int concurrencyLimit = 4;
    private int rateLimitPerMinute = 60;
    private RetryPolicy retryPolicy;
    private ScriptConfig scriptConfig;
    private String defaultCountry;
    private Duration attemptTimeout = Duration.ofMinutes(5);
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration maxPollInterval = Duration.ofSeconds(15);

    private Builder(String campaignId) {
      this.campaignId = campaignId;
    }

    public Builder contact(Contact contact) {
      this.contacts.add(Objects.requireNonNull(contact, "contact"));
      return this;
    }

    public Builder contacts(List<Contact> contacts) {
      contacts.forEach(this::contact);
      return this;
    }

    /** Optional. Defaults to {@code 4}. Must be &ge; 1. */
    public Builder concurrencyLimit(int concurrencyLimit) {
      this.concurrencyLimit = concurrencyLimit;
      return this;
    }

    /** Optional. Defaults to {@code 60}. Must be &ge; 1. */
    public Builder rateLimitPerMinute(int rateLimitPerMinute) {
      this.rateLimitPerMinute = rateLimitPerMinute;
      return this;
    }

    /** Optional. Defaults to {@link DefaultRetryPolicy#defaults()}. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** <b>Required.</b> */
    public Builder scriptConfig(ScriptConfig scriptConfig) {
      this.scriptConfig = scriptConfig;
      return this;
    }

    /** Optional calling code such as {@code "+1"} for numbers written in national format. */
    public Builder defaultCountry(String defaultCountry) {
      this.defaultCountry = defaultCountry;
      return this;
    }

    /** Optional. Defaults to 5 minutes. */
    public Builder attemptTimeout(Duration attemptTimeout) {
      this.attemptTimeout = attemptTimeout;
      return this;
    }

    /** Optional. First status poll delay; grows by 1.5x up to {@link #maxPollInterval}. Defaults to 2 s. */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /** Optional. Defaults to 15 s. */
    public Builder maxPollInterval(Duration maxPollInterval) {
      this.maxPollInterval = maxPollInterval;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code campaignId}, {@code scriptConfig} or a duration is null
     * @throws IllegalArgumentException if a contact id repeats, a limit is &lt; 1, a duration is
     *     not positive or {@code defaultCountry} is not an assigned calling code
     */
    public CampaignRun build() {
      Objects.requireNonNull(campaignId, "campaignId");
      Objects.requireNonNull(scriptConfig, "scriptConfig");
      checkSettings(concurrencyLimit, rateLimitPerMinute, defaultCountry,
          attemptTimeout, pollInterval, maxPollInterval);
      Set<String> ids = new HashSet<>();
      for (Contact contact : contacts) {
        if (!ids.add(contact.id())) {
          throw new IllegalArgumentException("Duplicate contact id: " + contact.id());
        }
      }
      return new CampaignRun(this);
    }
  }
}
