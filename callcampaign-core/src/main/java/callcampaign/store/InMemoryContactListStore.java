package callcampaign.store;

import callcampaign.Contact;
import callcampaign.spi.ContactListStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed contact list store. Thread-safe.
 */
public final class InMemoryContactListStore implements ContactListStore {
    private final Map<String, List<Contact>> contacts = new ConcurrentHashMap<>();

    @Override
    public List<Contact> load(String campaignId) {
        Objects.requireNonNull(campaignId, "campaignId");
        return contacts.getOrDefault(campaignId, List.of());
    }

    @Override
    public void save(String campaignId, List<Contact> contactList) {
        Objects.requireNonNull(campaignId, "campaignId");
        contacts.put(campaignId, List.copyOf(contactList));
    }
}
