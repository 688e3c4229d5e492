package com.github.dimitryivaniuta.gateway.reconciliation.service.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Successful capture of a cart's payment on the fulfillment backend.
 *
 * @param cartId cart id
 * @param paymentSessionId payment session found on the cart
 * @param paymentCollectionId payment collection of the session
 * @param paymentId captured payment id
 * @param amount session amount, may be null
 * @param currencyCode session currency, may be null
 * @param payment captured payment as returned by the backend
 */
public record SettlementReceipt(
        String cartId,
        String paymentSessionId,
        String paymentCollectionId,
        String paymentId,
        JsonNode amount,
        String currencyCode,
        JsonNode payment
) {}
