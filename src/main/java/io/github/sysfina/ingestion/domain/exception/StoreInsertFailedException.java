package io.github.sysfina.ingestion.domain.exception;

import lombok.Getter;

/**
 * A batch insert was rejected. Batches written before it stay in the store.
 */
@Getter
public class StoreInsertFailedException extends IngestionException {

    private final int batchNumber;
    private final int batchCount;
    private final int recordsWritten;

    public StoreInsertFailedException(int batchNumber, int batchCount, int recordsWritten, String detail, Throwable cause) {
        super(String.format("Falha ao inserir lançamentos (lote %d de %d, %d já gravados): %s",
                batchNumber, batchCount, recordsWritten, detail), cause);
        this.batchNumber = batchNumber;
        this.batchCount = batchCount;
        this.recordsWritten = recordsWritten;
    }
}
