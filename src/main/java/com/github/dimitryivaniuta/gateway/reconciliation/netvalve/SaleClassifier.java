package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Decides whether a sale was approved.
 *
 * <p>The gateway response code alone is not trusted. A sale is approved only if the HTTP status is
 * below 400, the response code is {@value #APPROVED_RESPONSE_CODE}, and none of these decline signals
 * fire:
 * <ul>
 *   <li>response code type contains DECLINE, FAILED or REJECT</li>
 *   <li>response message matches a decline keyword</li>
 *   <li>a {@code BNK_} response code or bank response code other than {@value #APPROVED_BANK_CODE}</li>
 *   <li>a bank response code from {@link #BANK_DECLINE_REASONS}</li>
 * </ul>
 */
@Component
public class SaleClassifier {

    public static final String APPROVED_RESPONSE_CODE = "GTW_1000";
    public static final String APPROVED_BANK_CODE = "BNK_2000";

    static final Map<String, String> BANK_DECLINE_REASONS = Map.of(
            "05", "Card declined by issuing bank",
            "51", "Insufficient funds",
            "14", "Invalid card number",
            "54", "Card expired",
            "41", "Card reported lost",
            "43", "Card reported stolen",
            "61", "Exceeds withdrawal limit",
            "62", "Restricted card",
            "65", "Exceeds withdrawal frequency"
    );

    private static final Pattern DECLINE_MESSAGE = Pattern.compile(
            "declin|insufficient|invalid|not supported|failed|do not honor|expired|lost|stolen|restricted",
            Pattern.CASE_INSENSITIVE);

    private static final List<String> DECLINE_TYPES = List.of("DECLINE", "FAILED", "REJECT");

    /**
     * @param httpStatus HTTP status of the sale call
     * @param responseCode gateway {@code responseCode}
     * @param responseCodeType gateway {@code responseCodeType}
     * @param responseMessage gateway {@code responseMessage}
     * @param bankResponseCode gateway {@code bankResponseCode}, may be null
     * @return verdict
     */
    public SaleVerdict classify(int httpStatus, String responseCode, String responseCodeType,
                                String responseMessage, String bankResponseCode) {
        String code = responseCode == null ? "" : responseCode;
        String type = responseCodeType == null ? "" : responseCodeType.toUpperCase(Locale.ROOT);
        String message = responseMessage == null ? "" : responseMessage;

        boolean declineType = DECLINE_TYPES.stream().anyMatch(type::contains);
        boolean declineMessage = DECLINE_MESSAGE.matcher(message).find();
        boolean bankDecline = isBankDecline(code) || isBankDecline(bankResponseCode);
        boolean knownDeclineCode = bankResponseCode != null && BANK_DECLINE_REASONS.containsKey(bankResponseCode);

        boolean approved = httpStatus < 400
                && APPROVED_RESPONSE_CODE.equals(code)
                && !declineType
                && !declineMessage
                && !bankDecline
                && !knownDeclineCode;
        return new SaleVerdict(approved, declineReasonFor(bankResponseCode));
    }

    private static boolean isBankDecline(String code) {
        return code != null && code.startsWith("BNK_") && !APPROVED_BANK_CODE.equals(code);
    }

    /**
     * @param bankResponseCode bank code
     * @return human reason, null for unknown codes
     */
    public static String declineReasonFor(String bankResponseCode) {
        return bankResponseCode == null ? null : BANK_DECLINE_REASONS.get(bankResponseCode);
    }
}
