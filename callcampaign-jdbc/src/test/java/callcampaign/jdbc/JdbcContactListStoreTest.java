package callcampaign.jdbc;

import callcampaign.Contact;
import callcampaign.util.JsonCodec;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcContactListStoreTest {

  private JdbcContactListStore store;

  @BeforeEach
  void setUp() throws Exception {
    store = new JdbcContactListStore(new DataSourceConnectionProvider(H2Schema.newDatabase()));
  }

  @Test
  void saveThenLoadKeepsOrderAndFields() {
    store.save("spring", List.of(
        new Contact("z", "+1 415 555 0101", "Zoe", "CL-9", Map.of("appointment_date", "May 3")),
        new Contact("a", "(415) 555-0102", null, null),
        Contact.of("m", "4155550103")));

    List<Contact> loaded = store.load("spring");

    assertEquals(List.of("z", "a", "m"), loaded.stream().map(Contact::id).toList());
    Contact first = loaded.get(0);
    assertEquals("+1 415 555 0101", first.rawPhone());
    assertEquals("Zoe", first.displayName());
    assertEquals("CL-9", first.clinicReference());
    assertEquals(Map.of("appointment_date", "May 3"), first.attributes());
    assertNull(loaded.get(1).displayName());
    assertTrue(loaded.get(2).attributes().isEmpty());
  }

  @Test
  void saveReplacesPreviousList() {
    store.save("spring", List.of(Contact.of("a", "1"), Contact.of("b", "2")));
    store.save("spring", List.of(Contact.of("c", "3")));

    assertEquals(List.of("c"), store.load("spring").stream().map(Contact::id).toList());
  }

  @Test
  void campaignsAreIsolated() {
    store.save("spring", List.of(Contact.of("a", "1")));
    store.save("fall", List.of(Contact.of("a", "2")));

    assertEquals("1", store.load("spring").get(0).rawPhone());
    assertEquals("2", store.load("fall").get(0).rawPhone());
  }

  @Test
  void unknownCampaignLoadsEmpty() {
    assertTrue(store.load("missing").isEmpty());
  }

  @Test
  void failedSaveKeepsPreviousList() {
    store.save("spring", List.of(Contact.of("a", "1")));

    CampaignStoreException e = assertThrows(CampaignStoreException.class,
        () -> store.save("spring", List.of(Contact.of("dup", "1"), Contact.of("dup", "2"))));
    assertEquals("save contacts of spring", e.action());
    assertEquals("Failed to save contacts of spring", e.getMessage());

    assertEquals(List.of("a"), store.load("spring").stream().map(Contact::id).toList());
  }

  @Test
  void missingTableIsStoreException() throws Exception {
    JdbcContactListStore other = new JdbcContactListStore(
        new DataSourceConnectionProvider(H2Schema.newDatabase()),
        new TableNames("no_such_table", TableNames.RESULT_TABLE, TableNames.ATTEMPT_TABLE),
        JsonCodec.getDefault());

    CampaignStoreException e = assertThrows(CampaignStoreException.class, () -> other.load("spring"));
    assertEquals("load contacts of spring", e.action());
  }

  @Test
  void tablesInConfiguredSchemaAreUsed() throws Exception {
    JdbcDataSource database = H2Schema.newDatabase("CLINIC");
    JdbcContactListStore inSchema = new JdbcContactListStore(
        new DataSourceConnectionProvider(database, "CLINIC"));

    inSchema.save("spring", List.of(Contact.of("a", "+14155550101")));

    assertEquals(List.of("a"), inSchema.load("spring").stream().map(Contact::id).toList());
    JdbcContactListStore defaultSchema = new JdbcContactListStore(new DataSourceConnectionProvider(database));
    assertThrows(CampaignStoreException.class, () -> defaultSchema.load("spring"));
  }

  @Test
  void connectionProviderValidation() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
    assertThrows(IllegalArgumentException.class,
        () -> new DataSourceConnectionProvider(new JdbcDataSource(), "clinic; DROP"));
    assertTrue(new DataSourceConnectionProvider(new JdbcDataSource(), " ").schema().isEmpty());
    assertEquals("CLINIC", new DataSourceConnectionProvider(new JdbcDataSource(), "CLINIC").schema().orElseThrow());
  }
}
