package io.github.sysfina.ingestion.domain.exception;

public class StoreDeleteFailedException extends IngestionException {

    public StoreDeleteFailedException(String detail, Throwable cause) {
        super("Falha ao apagar lançamentos de entrada: " + detail, cause);
    }
}
