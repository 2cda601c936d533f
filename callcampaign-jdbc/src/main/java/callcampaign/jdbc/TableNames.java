package callcampaign.jdbc;

import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Names of the three tables behind the JDBC campaign stores.
 *
 * <p>Each name is an unquoted SQL identifier of at most {@value #MAX_LENGTH} characters, and the
 * three names must differ ignoring case, since most databases fold unquoted identifiers.
 *
 * @param contactTable table holding campaign contact lists
 * @param resultTable  table holding one final result per contact
 * @param attemptTable table holding every call attempt of a result
 */
public record TableNames(String contactTable, String resultTable, String attemptTable) {
  public static final String CONTACT_TABLE = "campaign_contact";
  public static final String RESULT_TABLE = "campaign_result";
  public static final String ATTEMPT_TABLE = "campaign_call_attempt";
  public static final TableNames DEFAULTS = new TableNames(CONTACT_TABLE, RESULT_TABLE, ATTEMPT_TABLE);

  /** PostgreSQL's identifier limit, the shortest among the supported databases. */
  public static final int MAX_LENGTH = 63;

  private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  public TableNames {
    validate(contactTable);
    validate(resultTable);
    validate(attemptTable);
    Set<String> distinct = new HashSet<>();
    for (String name : new String[] {contactTable, resultTable, attemptTable}) {
      if (!distinct.add(name.toLowerCase(Locale.ROOT))) {
        throw new IllegalArgumentException("Campaign table used twice: " + name);
      }
    }
  }

  /**
   * Checks that {@code identifier} can be concatenated into SQL as a table or schema name.
   *
   * @param identifier the name
   * @return {@code identifier}
   * @throws IllegalArgumentException if it is not a plain identifier or is too long
   */
  public static String validate(String identifier) {
    Objects.requireNonNull(identifier, "identifier");
    if (!IDENTIFIER.matcher(identifier).matches()) {
      throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
    }
    if (identifier.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("SQL identifier longer than " + MAX_LENGTH + " characters: "
          + identifier);
    }
    return identifier;
  }
}
