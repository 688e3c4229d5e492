package com.github.dimitryivaniuta.gateway.reconciliation.cache;

import java.time.Duration;

/**
 * Token freshly returned by an authentication call.
 *
 * @param value bearer token
 * @param lifetime server-declared lifetime
 */
public record IssuedToken(String value, Duration lifetime) {}
