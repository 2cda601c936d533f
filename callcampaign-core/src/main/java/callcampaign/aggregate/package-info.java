/**
 * Campaign-level accounting of per-contact results.
 */
package callcampaign.aggregate;
