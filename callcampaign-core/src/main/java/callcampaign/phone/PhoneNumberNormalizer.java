package callcampaign.phone;

import callcampaign.NormalizedPhone;

/**
 * Validates raw phone numbers and converts them to E.164.
 *
 * <p>Accepted input: digits with optional spaces, dashes, dots, parentheses and slashes.
 * A leading {@code +} or {@code 00} marks an international number; anything else is read as a
 * national number of {@code defaultCountry}, with its trunk prefix removed ({@code 1} for NANP
 * numbers of 11 digits, a single {@code 0} elsewhere).
 *
 * <p>Validation is structural: an assigned country calling code, a national number of plausible
 * length (exactly 10 digits with valid area code and exchange for NANP, 4 or more elsewhere) and
 * at most 15 digits in total. The result is idempotent:
 * {@code normalize(normalize(x).e164())} equals {@code normalize(x)}.
 *
 * <p>Instances are stateless and thread-safe.
 */
public final class PhoneNumberNormalizer {
  private static final int MAX_E164_DIGITS = 15;
  private static final int MIN_NATIONAL_DIGITS = 4;
  private static final int NANP_NATIONAL_DIGITS = 10;

  public NormalizedPhone normalize(String raw) {
    return normalize(raw, null);
  }

  /**
   * Normalizes {@code raw}, reading national-format numbers as belonging to {@code defaultCountry}.
   *
   * @param raw            the number as supplied
   * @param defaultCountry calling code such as {@code "+1"} or {@code "44"}, or null
   * @return the normalized number
   * @throws InvalidPhoneNumberException if the number is not valid for any plausible country
   */
  public NormalizedPhone normalize(String raw, String defaultCountry) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidPhoneNumberException(raw, "empty");
    }
    String compact = strip(raw);
    boolean international = false;
    if (compact.startsWith("+")) {
      international = true;
      compact = compact.substring(1);
    } else if (compact.startsWith("00")) {
      international = true;
      compact = compact.substring(2);
    }
    if (compact.isEmpty() || !isDigits(compact)) {
      throw new InvalidPhoneNumberException(raw, "contains characters other than digits");
    }

    if (international) {
      return fromInternational(raw, compact);
    }
    int country = parseCountry(raw, defaultCountry);
    String national = stripTrunkPrefix(country, compact);
    return build(raw, country, national);
  }

  private static NormalizedPhone fromInternational(String raw, String digits) {
    int country = CountryCallingCodes.match(digits);
    if (country < 0) {
      throw new InvalidPhoneNumberException(raw, "unknown country calling code");
    }
    String national = digits.substring(Integer.toString(country).length());
    return build(raw, country, national);
  }

  private static NormalizedPhone build(String raw, int country, String national) {
    String code = Integer.toString(country);
    if (code.length() + national.length() > MAX_E164_DIGITS) {
      throw new InvalidPhoneNumberException(raw, "longer than " + MAX_E164_DIGITS + " digits");
    }
    if (country == CountryCallingCodes.NANP) {
      if (national.length() != NANP_NATIONAL_DIGITS) {
        throw new InvalidPhoneNumberException(raw, "NANP numbers need 10 digits");
      }
      if (national.charAt(0) < '2' || national.charAt(3) < '2') {
        throw new InvalidPhoneNumberException(raw, "invalid NANP area code or exchange");
      }
    } else if (national.length() < MIN_NATIONAL_DIGITS) {
      throw new InvalidPhoneNumberException(raw, "national number too short");
    }
    return new NormalizedPhone("+" + code + national, country);
  }

  private static int parseCountry(String raw, String defaultCountry) {
    if (defaultCountry == null || defaultCountry.isBlank()) {
      throw new InvalidPhoneNumberException(raw, "no international prefix and no default country");
    }
    return parseCallingCode(defaultCountry);
  }

  /**
   * Parses a country calling code such as {@code "+1"}, {@code "44"} or {@code " +353 "}.
   *
   * @param callingCode the code, with or without a leading {@code +}
   * @return the numeric code
   * @throws IllegalArgumentException if {@code callingCode} is not an assigned ITU calling code
   */
  public static int parseCallingCode(String callingCode) {
    if (callingCode == null) {
      throw new IllegalArgumentException("Invalid default country calling code: null");
    }
    String code = callingCode.trim();
    if (code.startsWith("+")) {
      code = code.substring(1);
    }
    if (code.isEmpty() || code.length() > 3 || !isDigits(code)
        || !CountryCallingCodes.isAssigned(Integer.parseInt(code))) {
      throw new IllegalArgumentException("Invalid default country calling code: " + callingCode);
    }
    return Integer.parseInt(code);
  }

  private static String stripTrunkPrefix(int country, String digits) {
    if (country == CountryCallingCodes.NANP) {
      if (digits.length() == NANP_NATIONAL_DIGITS + 1 && digits.charAt(0) == '1') {
        return digits.substring(1);
      }
      return digits;
    }
    if (digits.length() > 1 && digits.charAt(0) == '0') {
      return digits.substring(1);
    }
    return digits;
  }

  private static String strip(String raw) {
    StringBuilder sb = new StringBuilder(raw.length());
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c == ' ' || c == '-' || c == '.' || c == '(' || c == ')' || c == '/' || c == '\t') {
        continue;
      }
      sb.append(c);
    }
    return sb.toString();
  }

  private static boolean isDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
