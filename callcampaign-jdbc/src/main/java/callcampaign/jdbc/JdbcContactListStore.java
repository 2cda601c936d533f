package callcampaign.jdbc;

import callcampaign.Contact;
import callcampaign.spi.ContactListStore;
import callcampaign.util.JsonCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link ContactListStore} over a {@code campaign_contact} table.
 *
 * <p>Contacts keep their list order through a {@code seq_no} column. Attributes are stored
 * as a flat JSON object. {@link #save} replaces the campaign's list in one transaction.
 */
public final class JdbcContactListStore implements ContactListStore {
  private static final Logger logger = Logger.getLogger(JdbcContactListStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final JsonCodec jsonCodec;

  public JdbcContactListStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULTS, JsonCodec.getDefault());
  }

  public JdbcContactListStore(ConnectionProvider connectionProvider, TableNames tables, JsonCodec jsonCodec) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = Objects.requireNonNull(tables, "tables").contactTable();
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public List<Contact> load(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    String sql = "SELECT contact_id, raw_phone, display_name, clinic_reference, attributes FROM "
        + tableName + " WHERE campaign_id=? ORDER BY seq_no";
    return JdbcTemplate.withConnection(connectionProvider, "load contacts of " + campaignId,
        conn -> JdbcTemplate.query(conn, sql, rs -> new Contact(
            rs.getString("contact_id"),
            rs.getString("raw_phone"),
            rs.getString("display_name"),
            rs.getString("clinic_reference"),
            jsonCodec.parseObject(rs.getString("attributes"))), campaignId));
  }

  @Override
  public void save(String campaignId, List<Contact> contacts) {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(contacts, "contacts");
    String insert = "INSERT INTO " + tableName + " (campaign_id, seq_no, contact_id, raw_phone, "
        + "display_name, clinic_reference, attributes) VALUES (?,?,?,?,?,?,?)";
    List<Object[]> rows = new ArrayList<>(contacts.size());
    for (int i = 0; i < contacts.size(); i++) {
      Contact c = contacts.get(i);
      rows.add(new Object[] {campaignId, i, c.id(), c.rawPhone(), c.displayName(),
          c.clinicReference(), attributesJson(c.attributes())});
    }
    JdbcTemplate.inTransaction(connectionProvider, "save contacts of " + campaignId, conn -> {
      int removed = JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE campaign_id=?", campaignId);
      JdbcTemplate.batchUpdate(conn, insert, rows);
      logger.fine(() -> "Saved " + rows.size() + " contacts for campaign " + campaignId
          + " (replaced " + removed + ")");
      return null;
    });
  }

  private String attributesJson(Map<String, String> attributes) {
    return attributes.isEmpty() ? null : jsonCodec.toJson(attributes);
  }
}
