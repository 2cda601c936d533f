/**
 * Boundary to the external calling service.
 *
 * <p>{@link callcampaign.client.CallClient} is the seam across which the calling API is treated
 * as an opaque dependency; {@code callcampaign-http} provides a REST implementation.
 */
package callcampaign.client;
