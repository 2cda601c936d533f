package callcampaign;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validated request shape handed to {@link callcampaign.client.CallClient#initiate}.
 *
 * <p>The {@code task} is the script the voice agent follows. It may contain {@code {{key}}}
 * placeholders which {@link #renderFor(Contact)} replaces with {@code display_name},
 * {@code clinic_reference}, {@code contact_id} or any of the contact's attributes. Placeholders
 * without a value render as {@code [KEY]}. The same substitution applies to
 * {@code firstSentence} and {@code voicemailMessage}.
 *
 * <p>{@link #voicemailDrop(String)} presets a short call that leaves the message on an answering
 * machine.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ScriptConfig {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_]+)\\s*}}");
  private static final int VOICEMAIL_MAX_DURATION_SECONDS = 120;
  private static final Pattern LANGUAGE_TAG = Pattern.compile("[a-zA-Z]{2,3}(-[a-zA-Z0-9]{2,8})*");

  private final String task;
  private final String voice;
  private final String language;
  private final int maxDurationSeconds;
  private final boolean record;
  private final boolean waitForGreeting;
  private final boolean answeredByEnabled;
  private final String firstSentence;
  private final String voicemailMessage;

  private ScriptConfig(Builder builder) {
    this.task = builder.task;
    this.voice = builder.voice;
    this.language = builder.language;
    this.maxDurationSeconds = builder.maxDurationSeconds;
    this.record = builder.record;
    this.waitForGreeting = builder.waitForGreeting;
    this.answeredByEnabled = builder.answeredByEnabled;
    this.firstSentence = builder.firstSentence;
    this.voicemailMessage = builder.voicemailMessage;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder for a voicemail drop: {@code message} is both the task and the message left
   * on an answering machine, and calls are capped at 120 seconds.
   *
   * @param message the message, may contain placeholders
   * @return a builder that may be adjusted further
   */
  public static Builder voicemailDrop(String message) {
    return new Builder()
        .task(message)
        .voicemailMessage(message)
        .maxDurationSeconds(VOICEMAIL_MAX_DURATION_SECONDS);
  }

  public String task() {
    return task;
  }

  public String voice() {
    return voice;
  }

  public String language() {
    return language;
  }

  public int maxDurationSeconds() {
    return maxDurationSeconds;
  }

  public boolean record() {
    return record;
  }

  public boolean waitForGreeting() {
    return waitForGreeting;
  }

  public boolean answeredByEnabled() {
    return answeredByEnabled;
  }

  /** Opening line spoken before the task, or null. */
  public String firstSentence() {
    return firstSentence;
  }

  /** Message left when an answering machine picks up, or null to hang up instead. */
  public String voicemailMessage() {
    return voicemailMessage;
  }

  /**
   * Returns a copy of this config with placeholders in {@code task}, {@code firstSentence} and
   * {@code voicemailMessage} substituted from the contact.
   *
   * @param contact the contact being called
   * @return the rendered config
   */
  public ScriptConfig renderFor(Contact contact) {
    Objects.requireNonNull(contact, "contact");
    Map<String, String> values = new HashMap<>(contact.attributes());
    putIfPresent(values, "display_name", contact.displayName());
    putIfPresent(values, "clinic_reference", contact.clinicReference());
    values.put("contact_id", contact.id());
    return toBuilder()
        .task(render(task, values))
        .firstSentence(firstSentence == null ? null : render(firstSentence, values))
        .voicemailMessage(voicemailMessage == null ? null : render(voicemailMessage, values))
        .build();
  }

  public Builder toBuilder() {
    return new Builder()
        .task(task)
        .voice(voice)
        .language(language)
        .maxDurationSeconds(maxDurationSeconds)
        .record(record)
        .waitForGreeting(waitForGreeting)
        .answeredByEnabled(answeredByEnabled)
        .firstSentence(firstSentence)
        .voicemailMessage(voicemailMessage);
  }

  static String render(String template, Map<String, String> values) {
    Matcher m = PLACEHOLDER.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String key = m.group(1);
      String value = values.get(key);
      if (value == null || value.isBlank()) {
        value = "[" + key.toUpperCase(Locale.ROOT) + "]";
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(value));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private static void putIfPresent(Map<String, String> values, String key, String value) {
    if (value != null) {
      values.put(key, value);
    }
  }

  /** Builder for {@link ScriptConfig}. */
  public static final class Builder {
    private String task;
    private String voice = "maya";
    private String language = "en-US";
    private int maxDurationSeconds = 300;
    private boolean record = true;
    private boolean waitForGreeting = true;
    private boolean answeredByEnabled = true;
    private String firstSentence;
    private String voicemailMessage;

    private Builder() {}

    /**
     * Sets the script text. <b>Required.</b>
     */
    public Builder task(String task) {
      this.task = task;
      return this;
    }

    /** Optional. Defaults to {@code "maya"}. */
    public Builder voice(String voice) {
      this.voice = voice;
      return this;
    }

    /** Optional. Defaults to {@code "en-US"}. */
    public Builder language(String language) {
      this.language = language;
      return this;
    }

    /** Optional. Defaults to {@code 300}. Must be &gt; 0. */
    public Builder maxDurationSeconds(int maxDurationSeconds) {
      this.maxDurationSeconds = maxDurationSeconds;
      return this;
    }

    public Builder record(boolean record) {
      this.record = record;
      return this;
    }

    public Builder waitForGreeting(boolean waitForGreeting) {
      this.waitForGreeting = waitForGreeting;
      return this;
    }

    /** Enables answering-machine detection. Defaults to {@code true}. */
    public Builder answeredByEnabled(boolean answeredByEnabled) {
      this.answeredByEnabled = answeredByEnabled;
      return this;
    }

    public Builder firstSentence(String firstSentence) {
      this.firstSentence = firstSentence;
      return this;
    }

    /** Optional. Only used when answering-machine detection is enabled. */
    public Builder voicemailMessage(String voicemailMessage) {
      this.voicemailMessage = voicemailMessage;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code task}, {@code voice} or {@code language} is null
     * @throws IllegalArgumentException if {@code task} is blank, {@code language} is not a
     *     language tag, or {@code maxDurationSeconds <= 0}
     */
    public ScriptConfig build() {
      Objects.requireNonNull(task, "task");
      Objects.requireNonNull(voice, "voice");
      Objects.requireNonNull(language, "language");
      if (task.isBlank()) {
        throw new IllegalArgumentException("task must not be blank");
      }
      if (!LANGUAGE_TAG.matcher(language).matches()) {
        throw new IllegalArgumentException("Invalid language tag: " + language);
      }
      if (maxDurationSeconds <= 0) {
        throw new IllegalArgumentException("maxDurationSeconds must be > 0");
      }
      return new ScriptConfig(this);
    }
  }
}
