/**
 * Spring Boot auto-configuration for call campaigns.
 *
 * <p>{@link callcampaign.spring.boot.CallCampaignAutoConfiguration} creates the
 * {@link callcampaign.CampaignRunner}; the HTTP, JDBC and Micrometer auto-configurations
 * contribute its client, stores and metrics when their modules are on the classpath.
 * Properties live under {@code callcampaign.*}.
 */
package callcampaign.spring.boot;
