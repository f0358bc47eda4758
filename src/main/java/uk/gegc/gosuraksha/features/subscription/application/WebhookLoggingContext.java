package uk.gegc.gosuraksha.features.subscription.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging fields for subscription webhook processing.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String provider;
    private String eventId;
    private String eventType;
    private String accountRef;

    public void setMDC() {
        if (provider != null) MDC.put("billing_provider", provider);
        if (eventId != null) MDC.put("billing_event_id", eventId);
        if (eventType != null) MDC.put("billing_event_type", eventType);
        if (accountRef != null) MDC.put("account_id", accountRef);
    }

    public static void clearMDC() {
        MDC.remove("billing_provider");
        MDC.remove("billing_event_id");
        MDC.remove("billing_event_type");
        MDC.remove("account_id");
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
