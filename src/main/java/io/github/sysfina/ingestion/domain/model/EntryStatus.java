package io.github.sysfina.ingestion.domain.model;

public enum EntryStatus {
    PAID("Pago"),
    DUE("A Vencer");

    private final String label;

    EntryStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
