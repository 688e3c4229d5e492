package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Checkout payment session data sent by the storefront.
 *
 * <p>The session is an open JSON object; fields this service does not know are echoed back unchanged.
 * Typed accessors read the fields the authorization flow depends on.</p>
 */
public final class CheckoutSessionData {

    static final List<String> AUTH_FLAG_KEYS = List.of("authorized", "is_authorized", "hpf_completed", "card_form_submitted");

    static final List<String> AUTH_STRING_KEYS = List.of(
            "netvalve_token", "transaction_id", "transactionId", "netvalve_transaction_id",
            "order_id", "orderId", "checkout_id", "checkoutId");

    static final List<String> EXTERNAL_PROOF_KEYS = List.of(
            "transaction_id", "transactionId", "netvalve_transaction_id", "order_id", "orderId");

    private final ObjectNode fields;

    private CheckoutSessionData(ObjectNode fields) {
        this.fields = fields;
    }

    /**
     * @param json session object
     * @return session data backed by a copy of {@code json}
     * @throws IllegalArgumentException when {@code json} is not an object
     */
    public static CheckoutSessionData from(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Payment session data must be a JSON object");
        }
        return new CheckoutSessionData(((ObjectNode) json).deepCopy());
    }

    /**
     * @return true when any auth flag is true or any proof field is a non-empty string
     */
    public boolean hasPaymentConfirmation() {
        return AUTH_FLAG_KEYS.stream().anyMatch(this::isTrue) || AUTH_STRING_KEYS.stream().anyMatch(this::hasString);
    }

    /**
     * @return true when a previous sale succeeded and its transaction id is known
     */
    public boolean saleAlreadySucceeded() {
        return isTrue("netvalve_sale_success") && hasString("netvalve_transaction_id");
    }

    public boolean hpfCompleted() {
        return isTrue("hpf_completed");
    }

    /**
     * @return true when a stored card token is present and is not the current hosted-fields token
     */
    public boolean hasStoredTokenDistinctFromSession() {
        String stored = rawString("netvalve_token");
        String session = rawString("hpf_payment_token");
        return stored != null && !stored.isEmpty() && !stored.equals(session == null ? "" : session);
    }

    /**
     * @return true when a transaction or order id proves an earlier authorization
     */
    public boolean hasExternalProof() {
        return EXTERNAL_PROOF_KEYS.stream().anyMatch(this::hasString);
    }

    /**
     * @param key field
     * @return true only for a boolean {@code true}
     */
    public boolean isTrue(String key) {
        JsonNode v = fields.get(key);
        return v != null && v.isBoolean() && v.booleanValue();
    }

    /**
     * @param key field
     * @return true for a non-empty string value
     */
    public boolean hasString(String key) {
        String v = rawString(key);
        return v != null && !v.isEmpty();
    }

    /**
     * @param keys fields in priority order
     * @return first non-blank string, trimmed, or an empty string
     */
    public String pickString(String... keys) {
        for (String key : keys) {
            String v = rawString(key);
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return "";
    }

    /**
     * @return amount as a number or numeric string, zero when absent or unparsable
     */
    public BigDecimal amount() {
        JsonNode v = fields.get("amount");
        if (v == null || v.isNull()) {
            return BigDecimal.ZERO;
        }
        if (v.isNumber()) {
            return v.decimalValue();
        }
        try {
            return v.isTextual() && !v.asText().isBlank() ? new BigDecimal(v.asText().trim()) : BigDecimal.ZERO;
        } catch (NumberFormatException ex) {
            return BigDecimal.ZERO;
        }
    }

    /**
     * @return upper-cased {@code currency_code}, USD when absent
     */
    public String currencyCode() {
        String c = pickString("currency_code");
        return c.isEmpty() ? "USD" : c.toUpperCase(Locale.ROOT);
    }

    /**
     * @param fallback id to use when the session has none
     * @return session id
     */
    public String idOr(String fallback) {
        String id = pickString("id");
        return id.isEmpty() ? fallback : id;
    }

    /**
     * @return mutable copy of every field
     */
    public ObjectNode copy() {
        return fields.deepCopy();
    }

    /**
     * @param key field
     * @return string value as sent, null for absent or non-string fields
     */
    public String rawString(String key) {
        JsonNode v = fields.get(key);
        return v != null && v.isTextual() ? v.textValue() : null;
    }
}
