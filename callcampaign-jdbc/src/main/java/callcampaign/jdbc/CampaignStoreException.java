package callcampaign.jdbc;

/**
 * Unchecked failure of a JDBC campaign store operation. The cause is the {@link java.sql.SQLException}
 * or the nested store failure that aborted it.
 */
public final class CampaignStoreException extends RuntimeException {
  private final String action;

  /**
   * @param action what the store was doing, such as {@code "save contacts of spring"}
   * @param cause  the underlying failure
   */
  public CampaignStoreException(String action, Throwable cause) {
    super("Failed to " + action, cause);
    this.action = action;
  }

  /** The store operation that failed. */
  public String action() {
    return action;
  }
}
