package io.github.sysfina.ingestion.domain.model;

public record ImportSummary(
        int totalImported,
        int rowsRead,
        int rowsDiscarded
) { }
