package callcampaign.spi;

import callcampaign.Contact;

import java.util.List;

/**
 * Storage of campaign contact lists.
 *
 * <p>Parsing uploads (CSV, spreadsheets) is the caller's concern; this interface deals in
 * already-parsed contacts.
 *
 * @see callcampaign.store.InMemoryContactListStore
 */
public interface ContactListStore {

    /**
     * Loads the contacts of a campaign in their stored order.
     *
     * @param campaignId the campaign
     * @return the contacts; empty if the campaign has none
     */
    List<Contact> load(String campaignId);

    /**
     * Replaces the contact list of a campaign.
     *
     * @param campaignId the campaign
     * @param contacts   the new contact list
     */
    void save(String campaignId, List<Contact> contacts);
}
