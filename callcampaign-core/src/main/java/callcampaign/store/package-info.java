/**
 * In-memory storage implementations, suitable for tests and single-process use.
 */
package callcampaign.store;
