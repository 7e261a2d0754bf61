package io.github.sysfina.ingestion.domain.model;

/**
 * Positions of the receivables sheet columns. A layout change in the sheet is fixed here only.
 */
public enum ReceivableColumn {
    CLIENT(0),
    STUDENT(3),
    DUE_DATE(4),
    PAYMENT_DATE(5),
    CATEGORY(11),
    DESCRIPTION(12),
    INSTALLMENT(13),
    ORIGINAL_AMOUNT(14),
    PUNCTUAL_DISCOUNT(16),
    UNIT(21);

    /** Rows narrower than this are administrative noise. */
    public static final int MIN_ROW_WIDTH = 22;

    private final int index;

    ReceivableColumn(int index) {
        this.index = index;
    }

    public int index() {
        return index;
    }
}
