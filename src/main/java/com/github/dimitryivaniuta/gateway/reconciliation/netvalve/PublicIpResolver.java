package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.github.dimitryivaniuta.gateway.reconciliation.http.RawResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Resolves this server's public IPv4 address for the sale {@code customerIp} field.
 *
 * <p>The value is cached for {@code app.netvalve.timeouts.public-ip-ttl}. Concurrent refreshes may both
 * run; either result is valid.</p>
 */
@Component
public class PublicIpResolver {

    private static final Logger log = LoggerFactory.getLogger(PublicIpResolver.class);

    static final List<String> LOOKUP_URLS = List.of(
            "https://api.ipify.org?format=text",
            "https://ifconfig.me/ip",
            "https://icanhazip.com"
    );

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private final RestTemplate rest;
    private final Clock clock;
    private final Duration ttl;

    private volatile CachedIp cached;

    private record CachedIp(String ip, Instant resolvedAt) {}

    /**
     * Creates the resolver.
     *
     * @param clients NetValve HTTP clients
     * @param endpoints configuration
     * @param clock clock
     */
    public PublicIpResolver(NetValveHttpClients clients, NetValveEndpoints endpoints, Clock clock) {
        this.rest = clients.lookup();
        this.clock = clock;
        this.ttl = endpoints.timeouts().getPublicIpTtl();
    }

    /**
     * @return public IPv4, empty string when every lookup failed
     */
    public String resolve() {
        CachedIp current = cached;
        Instant now = clock.instant();
        if (current != null && now.isBefore(current.resolvedAt().plus(ttl))) {
            return current.ip();
        }

        for (String url : LOOKUP_URLS) {
            try {
                RawResponse resp = RawResponse.exchange(rest, url, HttpMethod.GET, HttpEntity.EMPTY);
                String ip = resp.body().trim();
                if (resp.status() == 200 && IPV4.matcher(ip).matches()) {
                    cached = new CachedIp(ip, now);
                    log.info("Resolved public IP {}", ip);
                    return ip;
                }
            } catch (RestClientException ex) {
                log.debug("Public IP lookup {} failed: {}", url, ex.getMessage());
            }
        }
        log.warn("Could not resolve public IP, all lookup endpoints failed");
        return "";
    }
}
