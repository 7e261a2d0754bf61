package io.github.sysfina.ingestion.domain.model;

import java.util.Collections;
import java.util.List;

/**
 * One raw sheet row. The Sheets API drops trailing empty cells, so an index past the end reads as absent.
 */
public final class SheetRow {

    private final List<String> cells;

    private SheetRow(List<String> cells) {
        this.cells = cells;
    }

    public static SheetRow of(List<String> cells) {
        return new SheetRow(cells == null ? Collections.emptyList() : cells);
    }

    public int width() {
        return cells.size();
    }

    public boolean isNarrowerThan(int minWidth) {
        return cells.size() < minWidth;
    }

    /**
     * @return the raw cell text, or {@code null} when the column is missing
     */
    public String raw(ReceivableColumn column) {
        int index = column.index();
        return index < cells.size() ? cells.get(index) : null;
    }

    /**
     * @return the trimmed cell text, or {@code null} when the column is missing or blank
     */
    public String text(ReceivableColumn column) {
        String trimmed = CellText.strip(raw(column));
        return trimmed == null || trimmed.isEmpty() ? null : trimmed;
    }
}
