package io.github.sysfina.ingestion.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.sysfina.ingestion.domain.model.LedgerEntry;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Wire shape of a {@code lancamentos} row.
 */
public record LedgerEntryRow(
        LocalDate data,
        String tipo,
        @JsonProperty("cliente_fornecedor") String clienteFornecedor,
        String descricao,
        BigDecimal valor,
        String status,
        String unidade,
        String obs,
        LocalDate datapag,
        String aluno,
        String parcel,
        @JsonProperty("desc_pontual") @JsonInclude(JsonInclude.Include.NON_NULL) BigDecimal descPontual
) {
    /**
     * Sent as {@code ?columns=} so rows without {@code desc_pontual} can share a bulk insert with rows that have it.
     */
    public static final String COLUMNS =
            "data,tipo,cliente_fornecedor,descricao,valor,status,unidade,obs,datapag,aluno,parcel,desc_pontual";

    public static LedgerEntryRow from(LedgerEntry entry) {
        return new LedgerEntryRow(
                entry.getDueDate(),
                entry.getKind().label(),
                entry.getCounterparty(),
                entry.getDescription(),
                entry.getAmount(),
                entry.getStatus().label(),
                entry.getUnit(),
                entry.getNote(),
                entry.getPaymentDate(),
                entry.getStudent(),
                entry.getInstallment(),
                entry.getPunctualDiscount()
        );
    }
}
