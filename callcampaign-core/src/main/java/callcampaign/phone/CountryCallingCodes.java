package callcampaign.phone;

import java.util.HashSet;
import java.util.Set;

/**
 * ITU-T E.164 assigned country calling codes.
 *
 * <p>Calling codes form a prefix-free set, so at most one of the 1, 2 or 3 digit prefixes of a
 * number is a valid code.
 */
final class CountryCallingCodes {
  static final int NANP = 1;

  private static final Set<Integer> CODES = new HashSet<>();

  static {
    add(1, 7);
    add(20, 27, 30, 31, 32, 33, 34, 36, 39, 40, 41, 43, 44, 45, 46, 47, 48, 49);
    add(51, 52, 53, 54, 55, 56, 57, 58, 60, 61, 62, 63, 64, 65, 66);
    add(81, 82, 84, 86, 90, 91, 92, 93, 94, 95, 98);
    add(211, 212, 213, 216, 218);
    range(220, 258);
    range(260, 269);
    add(290, 291, 297, 298, 299);
    range(350, 359);
    range(370, 383);
    add(385, 386, 387, 389, 420, 421, 423);
    range(500, 509);
    range(590, 599);
    add(670);
    range(672, 683);
    range(685, 692);
    add(800, 808, 850, 852, 853, 855, 856, 870, 878, 880, 881, 882, 883, 886, 888);
    range(960, 968);
    range(970, 977);
    add(979);
    range(992, 996);
    add(998);
  }

  private CountryCallingCodes() {}

  /**
   * Returns the calling code that prefixes {@code digits}, or {@code -1} if none does.
   */
  static int match(String digits) {
    for (int len = 1; len <= 3 && len <= digits.length(); len++) {
      int candidate = Integer.parseInt(digits.substring(0, len));
      if (CODES.contains(candidate)) {
        return candidate;
      }
    }
    return -1;
  }

  static boolean isAssigned(int code) {
    return CODES.contains(code);
  }

  private static void add(int... codes) {
    for (int code : codes) {
      CODES.add(code);
    }
  }

  private static void range(int fromInclusive, int toInclusive) {
    for (int code = fromInclusive; code <= toInclusive; code++) {
      CODES.add(code);
    }
  }
}
