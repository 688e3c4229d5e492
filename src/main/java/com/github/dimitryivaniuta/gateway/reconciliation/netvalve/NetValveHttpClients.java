package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import org.springframework.web.client.RestTemplate;

/**
 * NetValve HTTP clients grouped by timeout class.
 *
 * @param lookup public IP lookups
 * @param session session initialization and backoffice calls
 * @param order hosted-page orders, capture, refund and cancel
 * @param sale POST /sale
 */
public record NetValveHttpClients(RestTemplate lookup, RestTemplate session, RestTemplate order, RestTemplate sale) {

    /**
     * One template for every call; used by tests binding a single mock server.
     *
     * @param rest rest template
     * @return client set
     */
    public static NetValveHttpClients sharing(RestTemplate rest) {
        return new NetValveHttpClients(rest, rest, rest, rest);
    }
}
