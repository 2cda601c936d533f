/**
 * REST implementation of {@link callcampaign.client.CallClient} on Apache HttpClient 5.
 *
 * <p>{@link callcampaign.http.HttpCallClient} places and polls calls; request and response
 * bodies go through a {@link callcampaign.util.JsonCodec}.
 */
package callcampaign.http;
