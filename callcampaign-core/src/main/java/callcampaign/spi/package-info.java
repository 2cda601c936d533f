/**
 * Service provider interfaces for storage and metrics.
 *
 * <p>The core never touches a filesystem or database directly; implementations of
 * {@link callcampaign.spi.ContactListStore} and {@link callcampaign.spi.ResultStore} are
 * injected.
 */
package callcampaign.spi;
