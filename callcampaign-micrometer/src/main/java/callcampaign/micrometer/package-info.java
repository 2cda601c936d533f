/**
 * Micrometer bridge for campaign metrics.
 *
 * @see callcampaign.micrometer.MicrometerMetricsExporter
 */
package callcampaign.micrometer;
