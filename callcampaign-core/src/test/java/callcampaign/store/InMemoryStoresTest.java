package callcampaign.store;

import callcampaign.CampaignResult;
import callcampaign.Contact;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStoresTest {

  @Test
  void contactListRoundTripKeepsOrder() {
    InMemoryContactListStore store = new InMemoryContactListStore();
    List<Contact> contacts = List.of(Contact.of("b", "+14155552671"), Contact.of("a", "+14155552672"));

    store.save("spring", contacts);

    assertEquals(contacts, store.load("spring"));
    assertTrue(store.load("unknown").isEmpty());
  }

  @Test
  void savedContactListIsACopy() {
    InMemoryContactListStore store = new InMemoryContactListStore();
    List<Contact> contacts = new ArrayList<>(List.of(Contact.of("a", "+14155552671")));

    store.save("spring", contacts);
    contacts.add(Contact.of("b", "+14155552672"));

    assertEquals(1, store.load("spring").size());
    assertThrows(UnsupportedOperationException.class, () -> store.load("spring").clear());
  }

  @Test
  void resultsAreKeptPerCampaignInSaveOrder() {
    InMemoryResultStore store = new InMemoryResultStore();

    store.save("one", CampaignResult.cancelled("b", List.of(), Instant.now()));
    store.save("one", CampaignResult.cancelled("a", List.of(), Instant.now()));
    store.save("two", CampaignResult.cancelled("c", List.of(), Instant.now()));

    assertEquals(List.of("b", "a"), store.findByCampaign("one").stream().map(CampaignResult::contactId).toList());
    assertEquals(1, store.findByCampaign("two").size());
    assertTrue(store.findByCampaign("three").isEmpty());
  }
}
