/**
 * Root API for running outbound call campaigns with bounded concurrency.
 *
 * <h2>Core Design</h2>
 * <p>A {@link callcampaign.CampaignRun} names the contacts to call, the
 * {@link callcampaign.ScriptConfig script} the voice agent follows and the limits of the run:
 * how many contacts are worked on at once and how many calls may be placed per rolling minute.
 * The {@linkplain callcampaign.dispatch.CampaignDispatcher dispatcher} normalizes each phone number
 * to E.164, places the call through a {@link callcampaign.client.CallClient}, polls it to an
 * outcome and retries transient failures according to a
 * {@linkplain callcampaign.retry.RetryPolicy retry policy}. Every contact ends with exactly one
 * {@link callcampaign.CampaignResult}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>callcampaign-core</b>: model, dispatcher, rate limiter, stores (zero external deps)</li>
 *   <li><b>callcampaign-http</b>: REST calling service client</li>
 *   <li><b>callcampaign-jdbc</b>: contact and result stores over JDBC</li>
 *   <li><b>callcampaign-micrometer</b>: metrics bridge</li>
 *   <li><b>callcampaign-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (CampaignRunner runner = CampaignRunner.builder()
 *     .contactListStore(store)
 *     .callClient(HttpCallClient.fromEnvironment())
 *     .scriptConfig(ScriptConfig.builder().task("Remind {{display_name}} ...").build())
 *     .defaultCountry("+1")
 *     .build()) {
 *   try (CampaignExecution run = runner.start("reminders")) {
 *     for (CampaignResult result : run) {
 *       // results arrive as contacts finish
 *     }
 *   }
 * }
 * }</pre>
 */
package callcampaign;
