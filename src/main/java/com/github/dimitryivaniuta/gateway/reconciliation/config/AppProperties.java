package com.github.dimitryivaniuta.gateway.reconciliation.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>Every outbound collaborator (NetValve, the fulfillment backend, Slack) and the outbox publisher
 * is configured here. Blank strings mean "not configured"; callers check with {@code hasText}.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    /**
     * Deployment environment name, shown in operator alerts.
     */
    private String environment = "development";

    private final NetValve netvalve = new NetValve();
    private final Fulfillment fulfillment = new Fulfillment();
    private final Alerts alerts = new Alerts();
    private final Outbox outbox = new Outbox();

    @Getter
    @Setter
    public static class NetValve {
        /**
         * Gateway environment: {@code sandbox} or {@code production}.
         */
        private String environment = "production";

        private String apiKey = "";
        private String clientId = "";
        private String siteId = "";
        private String midIdEur = "";
        private String midIdUsd = "";
        private String midIdPhp = "";

        /**
         * Explicit payment API URL; wins over {@link #baseUrl} and the environment default.
         */
        private String paymentApiUrl = "";

        /**
         * Legacy alias of {@link #paymentApiUrl}.
         */
        private String baseUrl = "";

        /**
         * Explicit backoffice API URL; otherwise derived from the environment.
         */
        private String backofficeApiUrl = "";

        private final Hpf hpf = new Hpf();
        private final Hpp hpp = new Hpp();
        private final Backoffice backoffice = new Backoffice();
        private final Timeouts timeouts = new Timeouts();
    }

    @Getter
    @Setter
    public static class Hpf {
        /**
         * Static hosted-fields script; when set the session waterfall stops at step two.
         */
        private String scriptSrc = "";

        private String scriptIntegrity = "";

        /**
         * Last-resort script. In sandbox a known UAT script is used when blank.
         */
        private String scriptFallbackSrc = "";
    }

    @Getter
    @Setter
    public static class Hpp {
        private String baseUrl = "";
        private String sandboxBaseUrl = "";
        private String productionBaseUrl = "";

        /**
         * Pre-built hosted-page redirect; when set the session waterfall stops at step one.
         */
        private String directUrl = "";

        private boolean fallbackEnabled = true;
        private String orderHost = "";
        private String orderPath = "";
        private String mode = "SALE";
        private String successUrl = "";
        private String cancelUrl = "";
        private String failedUrl = "";
        private String pendingUrl = "";

        /**
         * Storefront base used to build default return URLs.
         */
        private String returnBaseUrl = "http://localhost:8000";
    }

    @Getter
    @Setter
    public static class Backoffice {
        private String username = "";
        private String password = "";

        /**
         * Token is refreshed this long before the server-side expiry.
         */
        private Duration refreshBuffer = Duration.ofMinutes(5);

        /**
         * Lifetime assumed when the sign-in response carries no {@code expiresIn}.
         */
        private Duration defaultTokenLifetime = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Timeouts {
        /**
         * Public IP lookups.
         */
        private Duration lookup = Duration.ofSeconds(3);

        /**
         * Session initialization and backoffice calls.
         */
        private Duration session = Duration.ofSeconds(10);

        /**
         * Hosted-page order creation, capture, refund and cancel.
         */
        private Duration order = Duration.ofSeconds(15);

        /**
         * POST /sale.
         */
        private Duration sale = Duration.ofSeconds(30);

        /**
         * Cached public IP lifetime.
         */
        private Duration publicIpTtl = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class Fulfillment {
        private String baseUrl = "http://localhost:9000";
        private String adminEmail = "";
        private String adminPassword = "";
        private String publishableKey = "";

        /**
         * Admin token lifetime in the cache.
         */
        private Duration tokenTtl = Duration.ofSeconds(82800);

        /**
         * Token cache backend: {@code memory} or {@code redis}.
         */
        private String tokenCache = "memory";

        private Duration timeout = Duration.ofSeconds(30);

        private int authAttempts = 3;

        /**
         * Base delay of the exponential authentication backoff.
         */
        private Duration authBackoff = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Alerts {
        /**
         * Slack incoming-webhook URL; alerts are dropped when blank.
         */
        private String slackUrl = "";

        private Duration timeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Kafka topic name for reconciliation events.
         */
        private String webhookEventsTopic = "payment-webhook-events";

        /**
         * Max number of events per batch.
         */
        private int batchSize = 100;

        /**
         * Fixed delay between publisher runs in milliseconds.
         */
        private long publishIntervalMs = 1000L;

        /**
         * Kafka send acknowledgment timeout.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Max number of send attempts before moving to DEAD.
         */
        private int maxAttempts = 10;

        /**
         * Base backoff used for retries (exponential).
         */
        private Duration baseBackoff = Duration.ofSeconds(1);

        /**
         * Maximum backoff cap.
         */
        private Duration maxBackoff = Duration.ofMinutes(2);
    }
}
