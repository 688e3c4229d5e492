package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.github.dimitryivaniuta.gateway.reconciliation.config.AppProperties;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves NetValve URLs, credentials and merchant ids from configuration.
 *
 * <p>Explicit URLs win; otherwise the sandbox or production default for the configured environment is
 * used.</p>
 */
@Component
public class NetValveEndpoints {

    static final String SANDBOX_BACKOFFICE_URL = "https://backoffice-api.uat.sandbox-netvalve.com";
    static final String PRODUCTION_BACKOFFICE_URL = "https://backoffice-api.netvalve.com";
    static final String SANDBOX_PAYMENT_API_URL = "https://payment-api.uat.sandbox-netvalve.com";
    static final String PRODUCTION_PAYMENT_API_URL = "https://api.netvalve.com";
    static final String SANDBOX_HPP_BASE_URL = "https://hpp-api.uat.sandbox-netvalve.com";
    static final String PRODUCTION_HPP_BASE_URL = "https://hpp-api.netvalve.com";
    static final String SANDBOX_DEFAULT_HPF_SCRIPT_SRC = "https://tokenfield.uat.sandbox-netvalve.com/sdk/index.DUbZDKWj.js";

    private final AppProperties.NetValve props;

    /**
     * Creates the resolver.
     *
     * @param properties application properties
     */
    public NetValveEndpoints(AppProperties properties) {
        this.props = properties.getNetvalve();
    }

    public boolean isSandbox() {
        return "sandbox".equalsIgnoreCase(props.getEnvironment().trim());
    }

    public String environmentName() {
        return StringUtils.hasText(props.getEnvironment()) ? props.getEnvironment().trim() : "production";
    }

    public String apiKey() {
        return trim(props.getApiKey());
    }

    public String clientId() {
        return trim(props.getClientId());
    }

    public String siteId() {
        return trim(props.getSiteId());
    }

    public String paymentApiUrl() {
        return firstText(props.getPaymentApiUrl(), props.getBaseUrl(),
                isSandbox() ? SANDBOX_PAYMENT_API_URL : PRODUCTION_PAYMENT_API_URL);
    }

    public String backofficeUrl() {
        return firstText(props.getBackofficeApiUrl(),
                isSandbox() ? SANDBOX_BACKOFFICE_URL : PRODUCTION_BACKOFFICE_URL);
    }

    public String hppBaseUrl() {
        AppProperties.Hpp hpp = props.getHpp();
        return isSandbox()
                ? firstText(hpp.getBaseUrl(), hpp.getSandboxBaseUrl(), SANDBOX_HPP_BASE_URL)
                : firstText(hpp.getBaseUrl(), hpp.getProductionBaseUrl(), PRODUCTION_HPP_BASE_URL);
    }

    /**
     * @return configured fallback script, the sandbox default in sandbox, otherwise blank
     */
    public String fallbackScriptSrc() {
        return firstText(props.getHpf().getScriptFallbackSrc(), isSandbox() ? SANDBOX_DEFAULT_HPF_SCRIPT_SRC : "");
    }

    /**
     * Picks the merchant account for a currency. Unknown or missing currencies fall back to USD, then
     * EUR, then PHP.
     *
     * @param currencyCode ISO currency, may be null
     * @return MID id, blank when none is configured
     */
    public String midIdFor(String currencyCode) {
        String currency = currencyCode == null ? "" : currencyCode.trim().toUpperCase(Locale.ROOT);
        return switch (currency) {
            case "EUR" -> trim(props.getMidIdEur());
            case "USD" -> trim(props.getMidIdUsd());
            case "PHP" -> trim(props.getMidIdPhp());
            default -> firstText(props.getMidIdUsd(), props.getMidIdEur(), props.getMidIdPhp());
        };
    }

    public AppProperties.Hpf hpf() {
        return props.getHpf();
    }

    public AppProperties.Hpp hpp() {
        return props.getHpp();
    }

    public AppProperties.Backoffice backoffice() {
        return props.getBackoffice();
    }

    public AppProperties.Timeouts timeouts() {
        return props.getTimeouts();
    }

    static String firstText(String... values) {
        for (String v : values) {
            if (StringUtils.hasText(v)) {
                return v.trim();
            }
        }
        return "";
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
