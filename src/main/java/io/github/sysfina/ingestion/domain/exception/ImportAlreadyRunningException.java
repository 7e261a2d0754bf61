package io.github.sysfina.ingestion.domain.exception;

import io.github.sysfina.ingestion.domain.model.EntryKind;

public class ImportAlreadyRunningException extends IngestionException {

    public ImportAlreadyRunningException(EntryKind kind) {
        super("Já existe uma importação em andamento para lançamentos do tipo " + kind.label() + ".");
    }
}
