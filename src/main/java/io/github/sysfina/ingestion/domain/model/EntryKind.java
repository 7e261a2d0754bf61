package io.github.sysfina.ingestion.domain.model;

public enum EntryKind {
    INFLOW("Entrada");

    private final String label;

    EntryKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return PostgREST equality filter selecting every entry of this kind
     */
    public String equalityFilter() {
        return "eq." + label;
    }
}
