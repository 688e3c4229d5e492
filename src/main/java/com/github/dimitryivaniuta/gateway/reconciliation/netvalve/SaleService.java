package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.http.RawResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds and executes {@code POST /sale} and classifies the answer.
 *
 * <p>Never throws for gateway problems: a missing token, a transport error or a non-JSON body all
 * come back as an unsuccessful {@link SaleResult}.</p>
 */
@Service
public class SaleService {

    private static final Logger log = LoggerFactory.getLogger(SaleService.class);

    static final String NO_TOKEN_MESSAGE = "No payment token available";

    private static final Pattern LOOPBACK_IP = Pattern.compile("^(::1|::ffff:127\\.0\\.0\\.1|127\\.0\\.0\\.1|0\\.0\\.0\\.0)$");
    private static final Pattern DESCRIPTION_DISALLOWED = Pattern.compile("[^\\w\\s,.\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int DESCRIPTION_MAX = 100;

    private static final String[] TOKEN_KEYS = {"netvalve_token", "paymentToken", "payment_token", "hpf_payment_token"};

    /**
     * Session field to sale payload field.
     */
    static final Map<String, String> CUSTOMER_FIELDS = orderedMap(
            "customer_email", "customerEmail",
            "customer_first_name", "customerFirstName",
            "customer_last_name", "customerLastName",
            "card_holder_name", "cardHolderName",
            "customer_phone", "customerPhone",
            "customer_address", "customerAddress",
            "customer_city", "customerCity",
            "customer_state", "customerState",
            "customer_zip_code", "customerZipCode",
            "customer_country_code", "customerCountryCode"
    );

    private static final List<String> EXPIRY_KEYS = List.of(
            "cardExpiry", "expiryDate", "cardExpiryDate", "cc_exp_date", "card_expiry", "exp_date",
            "expirationDate", "expiration_date", "card_exp", "cc_exp", "expiry");
    private static final List<String> EXPIRY_MONTH_KEYS = List.of("cardExpiryMonth", "expMonth", "exp_month", "expiryMonth", "expiry_month");
    private static final List<String> EXPIRY_YEAR_KEYS = List.of("cardExpiryYear", "expYear", "exp_year", "expiryYear", "expiry_year");

    private final NetValveGatewayClient gatewayClient;
    private final NetValveEndpoints endpoints;
    private final PublicIpResolver publicIpResolver;
    private final SaleClassifier classifier;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Counter approvedCounter;
    private final Counter declinedCounter;

    /**
     * Creates the service.
     *
     * @param gatewayClient payment API client
     * @param endpoints credential resolver
     * @param publicIpResolver public IP lookup
     * @param classifier approval rules
     * @param objectMapper JSON mapper
     * @param clock clock for generated order ids
     * @param meterRegistry metrics
     */
    public SaleService(
            NetValveGatewayClient gatewayClient,
            NetValveEndpoints endpoints,
            PublicIpResolver publicIpResolver,
            SaleClassifier classifier,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.gatewayClient = gatewayClient;
        this.endpoints = endpoints;
        this.publicIpResolver = publicIpResolver;
        this.classifier = classifier;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.approvedCounter = Counter.builder("netvalve.sale.approved").register(meterRegistry);
        this.declinedCounter = Counter.builder("netvalve.sale.declined").register(meterRegistry);
    }

    /**
     * Runs one sale.
     *
     * @param data checkout session
     * @param paymentType CARD or TOKEN
     * @return result
     */
    public SaleResult process(CheckoutSessionData data, PaymentType paymentType) {
        String paymentToken = data.pickString(TOKEN_KEYS);
        if (paymentToken.isEmpty()) {
            log.warn("NetValve sale: no payment token found");
            return SaleResult.failure(NO_TOKEN_MESSAGE);
        }
        log.info("NetValve sale using token={}... (source={})", abbreviate(paymentToken), tokenSource(data));

        BigDecimal amount = data.amount().setScale(2, RoundingMode.HALF_UP);
        String currency = data.currencyCode();
        String siteId = endpoints.siteId();
        String midId = endpoints.midIdFor(currency);

        String clientOrderId = data.pickString("cartId", "cart_id", "client_order_id", "id");
        if (clientOrderId.isEmpty()) {
            clientOrderId = "medusa_" + clock.instant().getEpochSecond();
        }
        String defaultDescription = "Order " + clientOrderId;
        String rawDescription = data.pickString("order_description", "orderDescription");
        String orderDesc = sanitizeDescription(rawDescription.isEmpty() ? defaultDescription : rawDescription, defaultDescription);

        String email = data.pickString("customer_email", "email_address", "emailAddress");
        String clientIp = data.pickString("client_ip_address", "ip_address", "ipAddress");
        if (clientIp.isEmpty() || LOOPBACK_IP.matcher(clientIp).matches()) {
            clientIp = publicIpResolver.resolve();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("amount", amount);
        payload.put("currency", currency);
        payload.put("paymentType", paymentType.name());
        payload.put("paymentToken", paymentToken);
        payload.put("siteId", siteId);
        payload.put("netvalveMidId", midId);
        payload.put("clientOrderId", clientOrderId);
        payload.put("orderDesc", orderDesc);
        if (!email.isEmpty()) {
            payload.put("customerEmail", email);
        }
        if (!clientIp.isEmpty()) {
            payload.put("customerIp", clientIp);
        }
        CUSTOMER_FIELDS.forEach((from, to) -> {
            if (data.hasString(from)) {
                payload.put(to, data.rawString(from));
            }
        });

        log.info("NetValve POST /sale amount={} {} clientOrderId={} paymentType={}", amount, currency, clientOrderId, paymentType);

        SaleResult.SaleResultBuilder echo = SaleResult.builder()
                .clientOrderId(clientOrderId)
                .paymentToken(paymentToken)
                .siteId(siteId)
                .midId(midId)
                .amount(amount)
                .currency(currency);

        RawResponse resp;
        try {
            resp = gatewayClient.postSale(payload);
        } catch (RuntimeException ex) {
            // transport failures and a malformed configured URL alike end as a failed sale
            log.error("NetValve POST /sale error: {}", ex.getMessage());
            declinedCounter.increment();
            return echo.success(false).responseMessage("Network error: " + ex.getMessage()).build();
        }

        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(resp.body());
        } catch (JsonProcessingException ex) {
            parsed = null;
        }
        if (parsed == null || !parsed.isObject()) {
            log.error("NetValve POST /sale non-JSON response: {}", resp.bodyPrefix(500));
            declinedCounter.increment();
            return echo.success(false)
                    .responseCode(String.valueOf(resp.status()))
                    .responseMessage("Non-JSON response: " + resp.bodyPrefix(200))
                    .build();
        }

        String responseCode = textOrEmpty(parsed, "responseCode");
        String responseMessage = textOrEmpty(parsed, "responseMessage");
        String bankResponseCode = textOrNull(parsed, "bankResponseCode");
        SaleVerdict verdict = classifier.classify(
                resp.status(), responseCode, textOrEmpty(parsed, "responseCodeType"), responseMessage, bankResponseCode);

        String transactionId = textOrNull(parsed, "transactionID");
        log.info("NetValve POST /sale result HTTP {} responseCode={} transactionID={} success={}",
                resp.status(), responseCode, transactionId, verdict.approved());
        (verdict.approved() ? approvedCounter : declinedCounter).increment();

        String cardExpiry = extractExpiry(parsed);
        if (cardExpiry == null) {
            cardExpiry = emptyToNull(data.pickString("card_expiry", "cardExpiry"));
        }

        return echo.success(verdict.approved())
                .transactionId(transactionId)
                .orderId(textOrNull(parsed, "orderId"))
                .responseCode(responseCode)
                .responseMessage(responseMessage)
                .bankResponseCode(bankResponseCode)
                .declineReason(verdict.declineReason())
                .raw(parsed)
                .gatewayErrors(parsed.path("errors").isObject() ? parsed.get("errors") : null)
                .cardNumber(stringOrNull(parsed, "cardNumber"))
                .cardType(stringOrNull(parsed, "cardType"))
                .cardExpiry(cardExpiry)
                .cardHolderName(emptyToNull(data.pickString("card_holder_name", "cardHolderName")))
                .build();
    }

    /**
     * Keeps word characters, whitespace and {@code , . -}; collapses runs of whitespace; max 100 chars.
     *
     * @param raw description
     * @param fallback used when nothing survives
     * @return sanitized description
     */
    static String sanitizeDescription(String raw, String fallback) {
        String cleaned = DESCRIPTION_DISALLOWED.matcher(raw).replaceAll("");
        cleaned = cleaned.replaceAll("\\s{2,}", " ").trim();
        if (cleaned.length() > DESCRIPTION_MAX) {
            cleaned = cleaned.substring(0, DESCRIPTION_MAX);
        }
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    /**
     * Reads the card expiry from the first known key, else assembles {@code MM/YYYY} from split fields.
     *
     * @param response sale response
     * @return expiry, null when absent
     */
    static String extractExpiry(JsonNode response) {
        for (String key : EXPIRY_KEYS) {
            String v = stringOrNull(response, key);
            if (v != null) {
                return v;
            }
        }
        String month = firstTruthy(response, EXPIRY_MONTH_KEYS);
        String year = firstTruthy(response, EXPIRY_YEAR_KEYS);
        if (month == null || year == null) {
            return null;
        }
        String mm = month.length() < 2 ? "0" + month : month;
        String yyyy = year.length() == 2 ? "20" + year : year.length() == 1 ? "200" + year : year;
        return mm + "/" + yyyy;
    }

    private static String firstTruthy(JsonNode node, List<String> keys) {
        for (String key : keys) {
            JsonNode v = node.path(key);
            if (v.isTextual() && !v.asText().isEmpty()) {
                return v.asText();
            }
            if (v.isNumber() && v.asDouble() != 0) {
                return v.asText();
            }
        }
        return null;
    }

    private static String tokenSource(CheckoutSessionData data) {
        for (String key : TOKEN_KEYS) {
            if (data.hasString(key)) {
                return key;
            }
        }
        return "hpf_payment_token";
    }

    private static String abbreviate(String token) {
        return token.length() > 12 ? token.substring(0, 12) : token;
    }

    private static String textOrEmpty(JsonNode node, String field) {
        String v = textOrNull(node, field);
        return v == null ? "" : v;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isValueNode() && !v.isNull() ? v.asText() : null;
    }

    private static String stringOrNull(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isTextual() && !v.asText().isEmpty() ? v.asText() : null;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private static Map<String, String> orderedMap(String... pairs) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            m.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(m);
    }
}
