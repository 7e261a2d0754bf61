package io.github.sysfina.ingestion.domain.exception;

/**
 * Base type for failures that abort an import run. The message is shown to the caller as is.
 */
public abstract class IngestionException extends RuntimeException {

    protected IngestionException(String message) {
        super(message);
    }

    protected IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
