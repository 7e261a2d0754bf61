package io.github.sysfina.ingestion.domain.model;

import java.util.List;

/**
 * @param entries       entries in sheet order
 * @param rowsRead      data rows seen, header excluded
 * @param rowsDiscarded rows dropped as malformed, undated or zero-valued
 */
public record ParseResult(
        List<LedgerEntry> entries,
        int rowsRead,
        int rowsDiscarded
) {
    public ParseResult {
        entries = List.copyOf(entries);
    }

    public static ParseResult empty() {
        return new ParseResult(List.of(), 0, 0);
    }
}
