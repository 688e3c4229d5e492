package com.github.dimitryivaniuta.gateway.reconciliation.config;

import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.NetValveHttpClients;
import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound HTTP clients.
 *
 * <p>Each collaborator gets its own {@link RestTemplate} because timeouts are bound to the request
 * factory, and NetValve calls need four different budgets.</p>
 */
@Configuration
public class HttpClientConfig {

    /**
     * NetValve clients, one per timeout class.
     *
     * @param builder rest template builder
     * @param props application properties
     * @return client set
     */
    @Bean
    public NetValveHttpClients netValveHttpClients(RestTemplateBuilder builder, AppProperties props) {
        AppProperties.Timeouts t = props.getNetvalve().getTimeouts();
        return new NetValveHttpClients(
                withTimeout(builder, t.getLookup()),
                withTimeout(builder, t.getSession()),
                withTimeout(builder, t.getOrder()),
                withTimeout(builder, t.getSale())
        );
    }

    /**
     * Client for the fulfillment backend admin and store APIs.
     *
     * @param builder rest template builder
     * @param props application properties
     * @return rest template
     */
    @Bean
    public RestTemplate fulfillmentRestTemplate(RestTemplateBuilder builder, AppProperties props) {
        return withTimeout(builder, props.getFulfillment().getTimeout());
    }

    /**
     * Client for the Slack incoming webhook.
     *
     * @param builder rest template builder
     * @param props application properties
     * @return rest template
     */
    @Bean
    public RestTemplate alertsRestTemplate(RestTemplateBuilder builder, AppProperties props) {
        return withTimeout(builder, props.getAlerts().getTimeout());
    }

    private static RestTemplate withTimeout(RestTemplateBuilder builder, Duration timeout) {
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
