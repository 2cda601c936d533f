package callcampaign.transcript;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-based classification of appointment reminder calls.
 *
 * <p>Checks confirmation, then cancellation, then rescheduling phrases, case-insensitively; the
 * first group with a match wins. A transcript that matches none of them is {@code CONTACTED}
 * rather than being folded into the voicemail outcome;
 * {@link callcampaign.aggregate.CampaignAnalytics} puts both in its busy/voicemail bucket.
 */
public final class KeywordTranscriptSummarizer implements TranscriptSummarizer {
  private static final List<String> CONFIRM = List.of("yes", "confirm", "will be there", "see you", "attend");
  private static final List<String> CANCEL = List.of("cancel", "cannot make", "can't make", "won't be there");
  private static final List<String> RESCHEDULE =
      List.of("reschedule", "different time", "another day", "change appointment");

  @Override
  public CallOutcome summarize(String transcript) {
    if (transcript == null || transcript.isBlank()) {
      return CallOutcome.NO_ANSWER_OR_VOICEMAIL;
    }
    String text = transcript.toLowerCase(Locale.ROOT);
    if (containsAny(text, CONFIRM)) {
      return CallOutcome.CONFIRMED;
    }
    if (containsAny(text, CANCEL)) {
      return CallOutcome.CANCELLED;
    }
    if (containsAny(text, RESCHEDULE)) {
      return CallOutcome.RESCHEDULED;
    }
    return CallOutcome.CONTACTED;
  }

  private static boolean containsAny(String text, List<String> phrases) {
    for (String phrase : phrases) {
      if (text.contains(phrase)) {
        return true;
      }
    }
    return false;
  }
}
