package io.github.sysfina.ingestion.audit;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured log statements tagged with an {@code event.type} MDC key.
 */
public final class Log {

    public static final String EVENT_TYPE = "event.type";
    public static final String IMPORT_ID = "import.id";

    private Log() {
    }

    public static void event(Logger logger, String eventType, String message, Object... args) {
        if (logger.isInfoEnabled()) {
            tagged(eventType, () -> logger.info(message, args));
        }
    }

    public static void debug(Logger logger, String eventType, String message, Object... args) {
        if (logger.isDebugEnabled()) {
            tagged(eventType, () -> logger.debug(message, args));
        }
    }

    public static void warn(Logger logger, String eventType, String message, Object... args) {
        if (logger.isWarnEnabled()) {
            tagged(eventType, () -> logger.warn(message, args));
        }
    }

    public static void error(Logger logger, String eventType, String message, Throwable throwable) {
        if (logger.isErrorEnabled()) {
            tagged(eventType, () -> logger.error(message, throwable));
        }
    }

    private static void tagged(String eventType, Runnable statement) {
        MDC.put(EVENT_TYPE, eventType);
        try {
            statement.run();
        } finally {
            MDC.remove(EVENT_TYPE);
        }
    }
}
