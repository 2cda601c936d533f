/**
 * JDBC implementations of the campaign storage SPI.
 *
 * <p>{@link callcampaign.jdbc.JdbcContactListStore} keeps contact lists and
 * {@link callcampaign.jdbc.JdbcResultStore} keeps results with their call attempts. Both take a
 * {@link callcampaign.jdbc.ConnectionProvider}; {@code schema/callcampaign.sql} on the classpath
 * creates the default tables on H2 and PostgreSQL.
 *
 * @see callcampaign.spi.ContactListStore
 * @see callcampaign.spi.ResultStore
 */
package callcampaign.jdbc;
