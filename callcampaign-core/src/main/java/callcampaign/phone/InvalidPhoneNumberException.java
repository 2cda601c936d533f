package callcampaign.phone;

/**
 * Thrown when a raw phone number cannot be turned into a valid E.164 number.
 *
 * <p>This failure is terminal for the contact: retrying cannot fix malformed input.
 */
public class InvalidPhoneNumberException extends RuntimeException {

  private final String rawInput;

  public InvalidPhoneNumberException(String rawInput, String reason) {
    super("Invalid phone number '" + rawInput + "': " + reason);
    this.rawInput = rawInput;
  }

  /**
   * Returns the input that failed to parse, exactly as supplied.
   */
  public String rawInput() {
    return rawInput;
  }
}
