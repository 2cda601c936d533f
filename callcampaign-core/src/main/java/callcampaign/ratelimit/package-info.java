/**
 * Throughput limiting for outbound call initiations.
 */
package callcampaign.ratelimit;
