package com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto;

/**
 * Hosted-page order endpoint.
 *
 * @param method HTTP method
 * @param url absolute URL
 */
public record HppEndpoint(String method, String url) {}
