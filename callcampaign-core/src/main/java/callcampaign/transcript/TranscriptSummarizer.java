package callcampaign.transcript;

/**
 * Turns a call transcript into a {@link CallOutcome}.
 *
 * @see KeywordTranscriptSummarizer
 */
@FunctionalInterface
public interface TranscriptSummarizer {

    /**
     * @param transcript the transcript text; may be null or empty
     * @return the outcome, never null
     */
    CallOutcome summarize(String transcript);
}
