package callcampaign;

import java.util.Objects;

/**
 * A phone number in E.164 form, produced by {@link callcampaign.phone.PhoneNumberNormalizer}.
 *
 * @param e164        {@code +} followed by country calling code and national number
 * @param countryCode ITU country calling code (e.g. {@code 1}, {@code 44}, {@code 353})
 */
public record NormalizedPhone(String e164, int countryCode) {

  public NormalizedPhone {
    Objects.requireNonNull(e164, "e164");
    if (!e164.startsWith("+" + countryCode)) {
      throw new IllegalArgumentException("e164 " + e164 + " does not start with +" + countryCode);
    }
  }

  /**
   * Returns the national significant number (digits after the country code).
   */
  public String nationalNumber() {
    return e164.substring(1 + Integer.toString(countryCode).length());
  }

  @Override
  public String toString() {
    return e164;
  }
}
