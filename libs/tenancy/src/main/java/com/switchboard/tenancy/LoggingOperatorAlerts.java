package com.switchboard.tenancy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Raises operator alerts as ERROR log lines carrying the {@code OPERATOR_ALERT} marker, so the
 * log pipeline can route them to paging.
 */
public final class LoggingOperatorAlerts implements OperatorAlerts {

    public static final Marker OPERATOR_ALERT = MarkerFactory.getMarker("OPERATOR_ALERT");

    private static final Logger log = LoggerFactory.getLogger(LoggingOperatorAlerts.class);

    @Override
    public void raise(String tenantId, String kind, String message, Throwable cause) {
        if (cause != null) {
            log.error(OPERATOR_ALERT, "[{}] tenant={} {}", kind, tenantId, message, cause);
        } else {
            log.error(OPERATOR_ALERT, "[{}] tenant={} {}", kind, tenantId, message);
        }
    }
}
