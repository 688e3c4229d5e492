package com.github.dimitryivaniuta.gateway.reconciliation.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

/**
 * Capture request.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaptureRequest(
        @NotBlank String transactionId,
        @NotNull BigDecimal amount,
        boolean alreadyCaptured
) {}
