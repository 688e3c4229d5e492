package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

/**
 * Classification of a sale response.
 *
 * @param approved true only when every approval check passed
 * @param declineReason human reason for a known bank decline code, may be null
 */
public record SaleVerdict(boolean approved, String declineReason) {}
