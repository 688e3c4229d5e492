package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HpfScript;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HpfSessionResponse;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HpfSessionResponse.HpfInfo;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HpfSessionResponse.HppInfo;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HpfSessionResponse.PaymentSessionPatch;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.SessionFailure;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.SessionOutcome;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.SessionRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Initializes a card-entry session with NetValve.
 *
 * <p>Steps, first success wins:
 * <ol>
 *   <li>configured hosted-page redirect</li>
 *   <li>configured hosted-fields script</li>
 *   <li>payment API {@code initializeSession}</li>
 *   <li>backoffice sign-in and script list</li>
 *   <li>hosted-page order</li>
 *   <li>fallback script, with a diagnostic</li>
 * </ol>
 * When nothing works the result is a 502 with the diagnostic and every hosted-page attempt.</p>
 */
@Service
public class HpfSessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(HpfSessionOrchestrator.class);

    static final String FAILURE_MESSAGE = "NetValve payment session could not be initialized";
    static final String UNEXPECTED_MESSAGE = "Unexpected error initializing NetValve payment session";

    private final NetValveEndpoints endpoints;
    private final NetValveGatewayClient gatewayClient;
    private final BackofficeAuthenticator backoffice;
    private final HppOrderClient hppOrderClient;
    private final MeterRegistry meterRegistry;

    /**
     * Creates the orchestrator.
     *
     * @param endpoints URL and credential resolver
     * @param gatewayClient payment API client
     * @param backoffice backoffice client
     * @param hppOrderClient hosted-page order client
     * @param meterRegistry metrics
     */
    public HpfSessionOrchestrator(
            NetValveEndpoints endpoints,
            NetValveGatewayClient gatewayClient,
            BackofficeAuthenticator backoffice,
            HppOrderClient hppOrderClient,
            MeterRegistry meterRegistry
    ) {
        this.endpoints = endpoints;
        this.gatewayClient = gatewayClient;
        this.backoffice = backoffice;
        this.hppOrderClient = hppOrderClient;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs the waterfall.
     *
     * @param request storefront request
     * @return outcome, never throws
     */
    public SessionOutcome initialize(SessionRequest request) {
        try {
            return runWaterfall(request);
        } catch (RuntimeException ex) {
            log.error("NetValve session initialization failed unexpectedly", ex);
            record(SessionStep.ERROR);
            return SessionOutcome.failed(500, new SessionFailure(UNEXPECTED_MESSAGE, null, null, String.valueOf(ex.getMessage())));
        }
    }

    private SessionOutcome runWaterfall(SessionRequest request) {
        String currency = request.normalizedCurrency();
        HpfSessionResponse common = HpfSessionResponse.builder()
                .provider("netvalve")
                .environment(endpoints.environmentName())
                .currencyCode(currency)
                .siteId(endpoints.siteId())
                .clientId(endpoints.clientId())
                .netvalveMidId(endpoints.midIdFor(currency))
                .build();

        String directUrl = endpoints.hpp().getDirectUrl();
        if (StringUtils.hasText(directUrl)) {
            return success(SessionStep.DIRECT_REDIRECT, common.toBuilder()
                    .flow(HpfSessionResponse.FLOW_HPP)
                    .hpp(new HppInfo(directUrl.trim(), null, null))
                    .paymentSessionPatch(PaymentSessionPatch.builder().requiresRedirect(true).redirectUrl(directUrl.trim()).build())
                    .build());
        }

        String staticScript = endpoints.hpf().getScriptSrc();
        if (StringUtils.hasText(staticScript)) {
            return success(SessionStep.STATIC_SCRIPT, common.toBuilder()
                    .flow(HpfSessionResponse.FLOW_HPF)
                    .hpf(HpfInfo.builder().scriptSrc(staticScript.trim()).integrity(configuredIntegrity()).build())
                    .paymentSessionPatch(PaymentSessionPatch.builder().hpfInitialized(true).build())
                    .build());
        }

        Optional<JsonNode> session = gatewayClient.initializeSession();
        if (session.isPresent() && textOrNull(session.get(), "netvalveScriptSrc") != null) {
            JsonNode s = session.get();
            String scriptSrc = textOrNull(s, "netvalveScriptSrc");
            String jwtToken = textOrNull(s, "jwtToken");
            if (jwtToken == null) {
                jwtToken = jwtFromScriptUrl(scriptSrc);
            }
            String paymentToken = textOrNull(s, "paymentToken");
            return success(SessionStep.INITIALIZE_SESSION, common.toBuilder()
                    .flow(HpfSessionResponse.FLOW_HPF)
                    .hpf(HpfInfo.builder()
                            .scriptSrc(scriptSrc)
                            .integrity(textOrNull(s, "integrity"))
                            .version(textOrNull(s, "version"))
                            .paymentToken(paymentToken)
                            .jwtToken(jwtToken)
                            .traceId(textOrNull(s, "traceID"))
                            .build())
                    .paymentSessionPatch(PaymentSessionPatch.builder().hpfInitialized(true).hpfPaymentToken(paymentToken).build())
                    .build());
        }

        Optional<String> bearerToken = backoffice.bearerToken();
        Optional<HpfScript> script = bearerToken.flatMap(backoffice::fetchActiveScript);
        if (script.isPresent()) {
            HpfScript sc = script.get();
            return success(SessionStep.BACKOFFICE_SCRIPT, common.toBuilder()
                    .flow(HpfSessionResponse.FLOW_HPF)
                    .hpf(HpfInfo.builder()
                            .scriptSrc(sc.netvalveScriptSrc())
                            .integrity(sc.integrity())
                            .version(sc.clientVersion())
                            .scriptId(sc.id())
                            .build())
                    .paymentSessionPatch(PaymentSessionPatch.builder().hpfInitialized(true).build())
                    .build());
        }

        HppOrderResult hpp = hppOrderClient.createOrder(bearerToken.orElse(null), request);
        if (hpp.success()) {
            String orderId = hpp.dataText("orderId");
            String transactionId = hpp.dataText("transactionID");
            return success(SessionStep.HPP_ORDER, common.toBuilder()
                    .flow(HpfSessionResponse.FLOW_HPP)
                    .hpp(new HppInfo(hpp.redirectUrl(), orderId, transactionId))
                    .netvalveEndpoint(hpp.endpoint())
                    .paymentSessionPatch(PaymentSessionPatch.builder()
                            .requiresRedirect(true)
                            .redirectUrl(hpp.redirectUrl())
                            .hppOrderId(orderId)
                            .hppTransactionId(transactionId)
                            .build())
                    .build());
        }

        String diagnostic = SessionDiagnostics.build(
                gatewayClient.hasApiCredentials(), bearerToken.isPresent(), false, hpp);

        String fallbackScript = endpoints.fallbackScriptSrc();
        if (!fallbackScript.isEmpty()) {
            log.warn("NetValve session falling back to static script {}", fallbackScript);
            return success(SessionStep.FALLBACK_SCRIPT, common.toBuilder()
                    .flow(HpfSessionResponse.FLOW_HPF)
                    .hpf(HpfInfo.builder().scriptSrc(fallbackScript).integrity(configuredIntegrity()).source("fallback").build())
                    .paymentSessionPatch(PaymentSessionPatch.builder().hpfInitialized(true).hpfFallbackScript(true).build())
                    .diagnostic(diagnostic)
                    .build());
        }

        log.error("NetValve session could not be initialized. tokenObtained={} hppReason={} attempts={}",
                bearerToken.isPresent(), hpp.reason(), hpp.attempts().size());
        record(SessionStep.FAILED);
        return SessionOutcome.failed(502, new SessionFailure(
                FAILURE_MESSAGE,
                diagnostic,
                new SessionFailure.Debug(
                        bearerToken.isPresent(),
                        false,
                        new SessionFailure.HppFallback(false, hpp.reason(), hpp.attempts())
                ),
                null
        ));
    }

    private SessionOutcome success(SessionStep step, HpfSessionResponse response) {
        log.info("NetValve session initialized via {} flow={}", step, response.flow());
        record(step);
        return SessionOutcome.ok(response);
    }

    private void record(SessionStep step) {
        Counter.builder("netvalve.session.flow").tag("step", step.name().toLowerCase(Locale.ROOT)).register(meterRegistry).increment();
    }

    private String configuredIntegrity() {
        String integrity = endpoints.hpf().getScriptIntegrity();
        return StringUtils.hasText(integrity) ? integrity.trim() : null;
    }

    /**
     * @param scriptSrc script URL
     * @return decoded {@code jwtToken} query parameter, null when absent or unparsable
     */
    static String jwtFromScriptUrl(String scriptSrc) {
        try {
            String raw = UriComponentsBuilder.fromUriString(scriptSrc).build().getQueryParams().getFirst("jwtToken");
            return raw == null || raw.isEmpty() ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (!v.isValueNode() || v.isNull()) {
            return null;
        }
        String text = v.asText();
        return text.isEmpty() ? null : text;
    }
}
