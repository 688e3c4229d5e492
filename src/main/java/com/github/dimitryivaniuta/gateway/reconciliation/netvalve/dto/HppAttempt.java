package com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto;

/**
 * One hosted-page order attempt, kept for operator diagnostics.
 *
 * @param method HTTP method
 * @param url URL tried
 * @param status HTTP status, 0 on transport failure
 * @param body truncated response body, or the error text
 */
public record HppAttempt(String method, String url, int status, String body) {}
