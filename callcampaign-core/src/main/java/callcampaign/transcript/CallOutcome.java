package callcampaign.transcript;

/**
 * What the called person said, as classified from the transcript.
 */
public enum CallOutcome {
  CONFIRMED,
  CANCELLED,
  RESCHEDULED,
  /** Empty transcript: nobody talked, or the call hit a voicemail box. */
  NO_ANSWER_OR_VOICEMAIL,
  /** Someone talked but no clear intent was found. */
  CONTACTED
}
