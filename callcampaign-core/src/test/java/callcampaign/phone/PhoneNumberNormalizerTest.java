package callcampaign.phone;

import callcampaign.NormalizedPhone;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PhoneNumberNormalizerTest {

  private final PhoneNumberNormalizer normalizer = new PhoneNumberNormalizer();

  @Test
  void nationalNanpNumberWithDefaultCountry() {
    NormalizedPhone phone = normalizer.normalize("(415) 555-2671", "+1");

    assertEquals("+14155552671", phone.e164());
    assertEquals(1, phone.countryCode());
    assertEquals("4155552671", phone.nationalNumber());
  }

  @Test
  void nanpTrunkPrefixIsDropped() {
    assertEquals("+14155552671", normalizer.normalize("1-415-555-2671", "1").e164());
  }

  @Test
  void internationalPlusPrefixIgnoresDefaultCountry() {
    NormalizedPhone phone = normalizer.normalize("+44 20 7946 0958", "+1");

    assertEquals("+442079460958", phone.e164());
    assertEquals(44, phone.countryCode());
  }

  @Test
  void doubleZeroPrefixIsInternational() {
    assertEquals("+353861234567", normalizer.normalize("00353 86 123 4567").e164());
  }

  @Test
  void nationalTrunkZeroIsDroppedOutsideNanp() {
    assertEquals("+442079460958", normalizer.normalize("020 7946 0958", "+44").e164());
  }

  @Test
  void threeDigitCountryCodeIsMatched() {
    NormalizedPhone phone = normalizer.normalize("+353 1 234 5678");

    assertEquals(353, phone.countryCode());
    assertEquals("12345678", phone.nationalNumber());
  }

  @ParameterizedTest
  @ValueSource(strings = {"(415) 555-2671", "+1 415.555.2671", "0044 20 7946 0958", "+61 2 9876 5432"})
  void normalizingIsIdempotent(String raw) {
    NormalizedPhone once = normalizer.normalize(raw, "+1");
    NormalizedPhone twice = normalizer.normalize(once.e164());

    assertEquals(once, twice);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "abc", "415-555-CALL", "+", "++14155552671", "12#34"})
  void rejectsMalformedInput(String raw) {
    assertThrows(InvalidPhoneNumberException.class, () -> normalizer.normalize(raw, "+1"));
  }

  @Test
  void rejectsNull() {
    assertThrows(InvalidPhoneNumberException.class, () -> normalizer.normalize(null, "+1"));
  }

  @Test
  void rejectsNationalNumberWithoutDefaultCountry() {
    InvalidPhoneNumberException e = assertThrows(InvalidPhoneNumberException.class,
        () -> normalizer.normalize("4155552671"));

    assertEquals("4155552671", e.rawInput());
  }

  @Test
  void rejectsShortNanpNumber() {
    assertThrows(InvalidPhoneNumberException.class, () -> normalizer.normalize("555-2671", "+1"));
  }

  @Test
  void rejectsNanpAreaCodeStartingWithZeroOrOne() {
    assertThrows(InvalidPhoneNumberException.class, () -> normalizer.normalize("+1 015 555 2671"));
    assertThrows(InvalidPhoneNumberException.class, () -> normalizer.normalize("+1 415 155 2671"));
  }

  @Test
  void rejectsUnassignedCountryCode() {
    assertThrows(InvalidPhoneNumberException.class, () -> normalizer.normalize("+999 1234 5678"));
  }

  @Test
  void rejectsMoreThanFifteenDigits() {
    assertThrows(InvalidPhoneNumberException.class, () -> normalizer.normalize("+44 1234 5678 9012 34"));
  }

  @Test
  void rejectsInvalidDefaultCountry() {
    assertThrows(IllegalArgumentException.class, () -> normalizer.normalize("020 7946 0958", "+999"));
    assertThrows(IllegalArgumentException.class, () -> normalizer.normalize("020 7946 0958", "UK"));
  }

  @Test
  void parsesCallingCodes() {
    assertEquals(1, PhoneNumberNormalizer.parseCallingCode("+1"));
    assertEquals(44, PhoneNumberNormalizer.parseCallingCode("44"));
    assertEquals(353, PhoneNumberNormalizer.parseCallingCode(" +353 "));
    assertThrows(IllegalArgumentException.class, () -> PhoneNumberNormalizer.parseCallingCode("+999"));
    assertThrows(IllegalArgumentException.class, () -> PhoneNumberNormalizer.parseCallingCode("+1234"));
    assertThrows(IllegalArgumentException.class, () -> PhoneNumberNormalizer.parseCallingCode(null));
  }
}
