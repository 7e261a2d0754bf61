package io.github.sysfina.ingestion.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A normalized ledger entry. It carries no id; the store assigns one on insert.
 */
@Value
@Builder
public class LedgerEntry {
    LocalDate dueDate;
    EntryKind kind;
    String counterparty;
    String description;
    BigDecimal amount;
    EntryStatus status;
    String unit;
    String note;
    LocalDate paymentDate;
    String student;
    String installment;
    BigDecimal punctualDiscount;
}
