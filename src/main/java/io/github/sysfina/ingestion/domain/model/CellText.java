package io.github.sysfina.ingestion.domain.model;

import java.util.regex.Pattern;

/**
 * Trimming for sheet cells. Pasted values often carry no-break spaces or a BOM that {@link String#trim()} keeps.
 */
public final class CellText {

    private static final Pattern EDGE_SPACES = Pattern.compile("^[\\s\\p{Z}\\uFEFF]+|[\\s\\p{Z}\\uFEFF]+$");

    private CellText() {
    }

    public static String strip(String value) {
        return value == null ? null : EDGE_SPACES.matcher(value).replaceAll("");
    }
}
