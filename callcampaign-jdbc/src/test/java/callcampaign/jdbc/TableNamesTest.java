package callcampaign.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableNamesTest {

    @Test
    void defaultsMatchShippedSchema() {
        assertEquals(new TableNames("campaign_contact", "campaign_result", "campaign_call_attempt"),
                TableNames.DEFAULTS);
    }

    @Test
    void customNamesAreKept() {
        TableNames names = new TableNames("clinic_contacts", "clinic_results", "clinic_attempts");

        assertEquals("clinic_contacts", names.contactTable());
        assertEquals("clinic_results", names.resultTable());
        assertEquals("clinic_attempts", names.attemptTable());
    }

    @Test
    void sameTableTwiceIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new TableNames("contacts", "results", "RESULTS"));
        assertTrue(e.getMessage().contains("RESULTS"));
    }

    @Test
    void identifiersMustBePlainAndShort() {
        assertEquals("_results2024", TableNames.validate("_results2024"));
        assertEquals("t".repeat(63), TableNames.validate("t".repeat(63)));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("t".repeat(64)));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("results; DROP TABLE x"));
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
        assertThrows(IllegalArgumentException.class,
                () -> new TableNames("contacts", "bad-name", "attempts"));
    }
}
