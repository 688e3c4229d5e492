package com.github.dimitryivaniuta.gateway.reconciliation.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Logs method, path, status and latency of API calls. Actuator probes are not logged.
 */
@Slf4j
@Component
public class RequestTimingFilter extends OncePerRequestFilter {

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        long t0 = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long ms = (System.nanoTime() - t0) / 1_000_000;
            if (res.getStatus() >= 500) {
                log.warn("HTTP {} {} -> {} in {}ms", req.getMethod(), req.getRequestURI(), res.getStatus(), ms);
            } else {
                log.info("HTTP {} {} -> {} in {}ms", req.getMethod(), req.getRequestURI(), res.getStatus(), ms);
            }
        }
    }
}
