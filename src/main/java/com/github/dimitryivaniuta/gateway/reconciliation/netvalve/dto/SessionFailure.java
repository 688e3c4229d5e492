package com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Body returned when no session could be initialized.
 *
 * @param message summary
 * @param diagnostic operator hints
 * @param debug step flags and hosted-page attempts
 * @param error unexpected error text
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionFailure(String message, String diagnostic, Debug debug, String error) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Debug(boolean backofficeTokenObtained, boolean hpfScriptFound, HppFallback hppFallback) {}

    public record HppFallback(boolean success, String reason, List<HppAttempt> attempts) {}
}
