package com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

/**
 * Successful session initialization. {@code flow} tells the storefront whether to render hosted fields
 * ({@code hpf}) or redirect to the hosted page ({@code hpp}).
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HpfSessionResponse(
        String provider,
        String environment,
        String currencyCode,
        String siteId,
        String clientId,
        String netvalveMidId,
        String flow,
        HpfInfo hpf,
        HppInfo hpp,
        HppEndpoint netvalveEndpoint,
        PaymentSessionPatch paymentSessionPatch,
        String diagnostic
) {

    public static final String FLOW_HPF = "hpf";
    public static final String FLOW_HPP = "hpp";

    /**
     * Hosted-fields script details.
     */
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HpfInfo(
            String scriptSrc,
            String integrity,
            String version,
            Long scriptId,
            String paymentToken,
            String jwtToken,
            String traceId,
            String source
    ) {}

    /**
     * Hosted-page redirect details.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HppInfo(String redirectUrl, String orderId, String transactionId) {}

    /**
     * Fields the storefront merges into its payment session.
     */
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PaymentSessionPatch(
            Boolean hpfInitialized,
            String hpfPaymentToken,
            Boolean hpfFallbackScript,
            Boolean requiresRedirect,
            String redirectUrl,
            String hppOrderId,
            String hppTransactionId
    ) {}
}
