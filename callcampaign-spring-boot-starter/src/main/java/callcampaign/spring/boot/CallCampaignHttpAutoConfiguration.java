package callcampaign.spring.boot;

import callcampaign.client.CallClient;
import callcampaign.http.HttpCallClient;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates an {@link HttpCallClient} when {@code callcampaign-http} is on the classpath and
 * {@code callcampaign.http.api-key} is set.
 *
 * <p>Runs before {@link CallCampaignAutoConfiguration} so the {@link CallClient}
 * bean is available for the campaign runner.
 */
@AutoConfiguration(before = CallCampaignAutoConfiguration.class)
@ConditionalOnClass(HttpCallClient.class)
@ConditionalOnProperty(prefix = "callcampaign.http", name = "api-key")
@EnableConfigurationProperties(CallCampaignProperties.class)
public class CallCampaignHttpAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(CallClient.class)
  public HttpCallClient httpCallClient(CallCampaignProperties props) {
    CallCampaignProperties.Http http = props.getHttp();
    return HttpCallClient.builder()
        .baseUri(http.getBaseUrl())
        .apiKey(http.getApiKey())
        .connectTimeout(http.getConnectTimeout())
        .responseTimeout(http.getResponseTimeout())
        .build();
  }
}
