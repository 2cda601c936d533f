package callcampaign;

import java.util.Map;
import java.util.Objects;

/**
 * One entry of a campaign's contact list.
 *
 * <p>{@code attributes} holds per-contact script variables (appointment date, provider,
 * office location and so on) that {@link ScriptConfig#renderFor(Contact)} substitutes into the
 * call script. Ids must be unique within a {@link CampaignRun}.
 *
 * @param id              contact identifier, unique within a campaign
 * @param rawPhone        phone number as supplied, before normalization
 * @param displayName     name spoken in the script; may be null
 * @param clinicReference external reference of the clinic or account; may be null
 * @param attributes      script variables; never null, defensively copied
 */
public record Contact(String id, String rawPhone, String displayName, String clinicReference,
    Map<String, String> attributes) {

  public Contact {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(rawPhone, "rawPhone");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id must not be empty");
    }
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public Contact(String id, String rawPhone, String displayName, String clinicReference) {
    this(id, rawPhone, displayName, clinicReference, Map.of());
  }

  /**
   * Creates a contact with only an id and a phone number.
   */
  public static Contact of(String id, String rawPhone) {
    return new Contact(id, rawPhone, null, null, Map.of());
  }
}
