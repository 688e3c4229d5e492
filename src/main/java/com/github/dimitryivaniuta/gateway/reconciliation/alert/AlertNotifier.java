package com.github.dimitryivaniuta.gateway.reconciliation.alert;

/**
 * Operator alerting. Implementations are best-effort and never throw to the caller.
 */
public interface AlertNotifier {

    /**
     * Sends a critical alert.
     *
     * @param title short title
     * @param message markdown body
     * @param platform originating platform, e.g. {@code Solidgate}; may be null
     */
    void sendCriticalAlert(String title, String message, String platform);
}
