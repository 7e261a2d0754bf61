package io.github.sysfina.ingestion.service;

import io.github.sysfina.ingestion.audit.Log;
import io.github.sysfina.ingestion.domain.model.EntryKind;
import io.github.sysfina.ingestion.domain.model.ImportSummary;
import io.github.sysfina.ingestion.domain.model.ParseResult;
import io.github.sysfina.ingestion.service.parser.ReceivableRowParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * One import run: read the sheet, normalize the rows and replace the inflow entries. Nothing is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReceivablesImportService {

    private final SheetSourceService sheetSourceService;
    private final ReceivableRowParser receivableRowParser;
    private final LedgerReplacementService ledgerReplacementService;

    public ImportSummary importReceivables() {
        String importId = UUID.randomUUID().toString();
        MDC.put(Log.IMPORT_ID, importId);

        Log.event(log, "IMPORT_STARTED", "Iniciando importação da planilha de recebimentos: {}", importId);

        try {
            List<List<String>> values = sheetSourceService.fetchRows();
            Log.event(log, "SHEET_FETCHED", "Planilha lida. {} linhas recebidas, cabeçalho incluído.", values.size());

            ParseResult parsed = receivableRowParser.parse(values);
            Log.event(log, "ROWS_NORMALIZED", "{} lançamentos válidos em {} linhas; {} descartadas.",
                    parsed.entries().size(), parsed.rowsRead(), parsed.rowsDiscarded());

            int written = ledgerReplacementService.replace(EntryKind.INFLOW, parsed.entries());

            Log.event(log, "IMPORT_COMPLETED", "Importação finalizada com sucesso. Total: {}", written);
            return new ImportSummary(written, parsed.rowsRead(), parsed.rowsDiscarded());
        } catch (RuntimeException e) {
            Log.error(log, "IMPORT_FAILED", "Erro fatal na importação de recebimentos", e);
            throw e;
        } finally {
            MDC.remove(Log.IMPORT_ID);
        }
    }
}
