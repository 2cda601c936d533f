package callcampaign.spring.boot;

import callcampaign.jdbc.ConnectionProvider;
import callcampaign.jdbc.DataSourceConnectionProvider;
import callcampaign.jdbc.JdbcContactListStore;
import callcampaign.jdbc.JdbcResultStore;
import callcampaign.jdbc.TableNames;
import callcampaign.spi.ContactListStore;
import callcampaign.spi.ResultStore;
import callcampaign.util.JsonCodec;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * JDBC contact list and result stores over the application {@link DataSource}.
 *
 * <p>Active when {@code callcampaign-jdbc} is on the classpath, a {@link DataSource} bean
 * exists and {@code callcampaign.jdbc.enabled} is true (default). The tables are expected to
 * exist, in {@code callcampaign.jdbc.schema} when it is set; {@code classpath:schema/callcampaign.sql}
 * creates them.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class, before = CallCampaignAutoConfiguration.class)
@ConditionalOnClass(JdbcResultStore.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "callcampaign.jdbc", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(CallCampaignProperties.class)
public class CallCampaignJdbcAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider campaignConnectionProvider(DataSource dataSource,
                                                                   CallCampaignProperties props) {
        return new DataSourceConnectionProvider(dataSource, props.getJdbc().getSchema());
    }

    @Bean
    @ConditionalOnMissingBean
    public TableNames campaignTableNames(CallCampaignProperties props) {
        CallCampaignProperties.Jdbc jdbc = props.getJdbc();
        return new TableNames(jdbc.getContactTable(), jdbc.getResultTable(), jdbc.getAttemptTable());
    }

    @Bean
    @ConditionalOnMissingBean(ContactListStore.class)
    public JdbcContactListStore contactListStore(ConnectionProvider connectionProvider, TableNames tables) {
        return new JdbcContactListStore(connectionProvider, tables, JsonCodec.getDefault());
    }

    @Bean
    @ConditionalOnMissingBean(ResultStore.class)
    public JdbcResultStore resultStore(ConnectionProvider connectionProvider, TableNames tables) {
        return new JdbcResultStore(connectionProvider, tables);
    }
}
