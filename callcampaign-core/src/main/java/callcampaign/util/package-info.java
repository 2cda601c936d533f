/**
 * Small utilities shared by the dispatcher, runner and store modules: a daemon thread factory
 * and a flat JSON codec.
 */
package callcampaign.util;
