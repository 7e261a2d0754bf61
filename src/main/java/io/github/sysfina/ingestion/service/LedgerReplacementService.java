package io.github.sysfina.ingestion.service;

import feign.FeignException;
import io.github.sysfina.ingestion.audit.Log;
import io.github.sysfina.ingestion.client.LedgerStoreClient;
import io.github.sysfina.ingestion.client.dto.LedgerEntryRow;
import io.github.sysfina.ingestion.config.IngestionProperties;
import io.github.sysfina.ingestion.domain.exception.ImportAlreadyRunningException;
import io.github.sysfina.ingestion.domain.exception.StoreDeleteFailedException;
import io.github.sysfina.ingestion.domain.exception.StoreInsertFailedException;
import io.github.sysfina.ingestion.domain.model.EntryKind;
import io.github.sysfina.ingestion.domain.model.LedgerEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Replaces every stored entry of a kind: one filtered delete, then sequential bounded batch inserts.
 * <p>
 * The store API has no multi-statement transaction. A failed insert leaves the earlier batches in place
 * and the remaining ones unwritten; the next successful run restores the full set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerReplacementService {

    private final IngestionProperties properties;
    private final LedgerStoreClient ledgerStoreClient;

    private final Map<EntryKind, ReentrantLock> runLocks = new ConcurrentHashMap<>();

    /**
     * @return number of entries written
     * @throws ImportAlreadyRunningException if another replace of the same kind is in progress
     */
    public int replace(EntryKind kind, List<LedgerEntry> entries) {
        ReentrantLock lock = runLocks.computeIfAbsent(kind, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new ImportAlreadyRunningException(kind);
        }
        try {
            deleteExisting(kind);
            if (entries.isEmpty()) {
                return 0;
            }
            return insertInBatches(entries);
        } finally {
            lock.unlock();
        }
    }

    private void deleteExisting(EntryKind kind) {
        String table = properties.supabase().table();
        try {
            ledgerStoreClient.deleteByKind(table, kind.equalityFilter());
        } catch (FeignException e) {
            Log.error(log, "LEDGER_DELETE_FAIL", "Erro ao apagar lançamentos existentes.", e);
            throw new StoreDeleteFailedException(describe(e), e);
        }
        Log.event(log, "LEDGER_DELETED", "Lançamentos do tipo {} apagados da tabela {}.", kind.label(), table);
    }

    private int insertInBatches(List<LedgerEntry> entries) {
        String table = properties.supabase().table();
        List<List<LedgerEntry>> batches = partition(entries, properties.supabase().batchSize());

        int written = 0;
        for (int i = 0; i < batches.size(); i++) {
            List<LedgerEntryRow> rows = batches.get(i).stream()
                    .map(LedgerEntryRow::from)
                    .toList();
            try {
                ledgerStoreClient.insertBatch(table, LedgerEntryRow.COLUMNS, rows);
            } catch (FeignException e) {
                Log.warn(log, "LEDGER_INSERT_ABORTED",
                        "Lote {} de {} rejeitado; {} lançamentos já gravados permanecem na base.",
                        i + 1, batches.size(), written);
                throw new StoreInsertFailedException(i + 1, batches.size(), written, describe(e), e);
            }
            written += rows.size();
            Log.debug(log, "LEDGER_BATCH_INSERTED", "Lote {} de {} gravado ({} lançamentos).",
                    i + 1, batches.size(), rows.size());
        }
        return written;
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            chunks.add(items.subList(from, Math.min(from + size, items.size())));
        }
        return chunks;
    }

    private String describe(FeignException e) {
        String body = e.contentUTF8();
        return body == null || body.isBlank() ? e.getMessage() : body;
    }
}
