package io.github.sysfina.ingestion.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.sysfina.ingestion.domain.model.ImportSummary;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportResponse(
        boolean success,
        String message,
        @JsonProperty("total_imported") Integer totalImported,
        @JsonProperty("rows_read") Integer rowsRead,
        @JsonProperty("rows_discarded") Integer rowsDiscarded
) {
    public static ImportResponse success(ImportSummary summary) {
        return new ImportResponse(
                true,
                String.format("Importação concluída com %d lançamentos de entrada.", summary.totalImported()),
                summary.totalImported(),
                summary.rowsRead(),
                summary.rowsDiscarded());
    }

    public static ImportResponse failure(String message) {
        return new ImportResponse(false, message, null, null, null);
    }
}
