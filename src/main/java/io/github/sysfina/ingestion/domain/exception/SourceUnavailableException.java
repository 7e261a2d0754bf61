package io.github.sysfina.ingestion.domain.exception;

import lombok.Getter;

@Getter
public class SourceUnavailableException extends IngestionException {

    private final int status;
    private final String body;

    public SourceUnavailableException(int status, String body, Throwable cause) {
        super(String.format("Falha na requisição ao Google Sheets: %d - %s", status, body), cause);
        this.status = status;
        this.body = body;
    }

    public SourceUnavailableException(String message) {
        super(message);
        this.status = -1;
        this.body = null;
    }
}
