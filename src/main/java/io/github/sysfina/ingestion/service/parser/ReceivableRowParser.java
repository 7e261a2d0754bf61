package io.github.sysfina.ingestion.service.parser;

import io.github.sysfina.ingestion.audit.Log;
import io.github.sysfina.ingestion.domain.model.EntryKind;
import io.github.sysfina.ingestion.domain.model.EntryStatus;
import io.github.sysfina.ingestion.domain.model.LedgerEntry;
import io.github.sysfina.ingestion.domain.model.ParseResult;
import io.github.sysfina.ingestion.domain.model.SheetRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.CATEGORY;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.CLIENT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.DESCRIPTION;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.DUE_DATE;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.INSTALLMENT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.MIN_ROW_WIDTH;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.ORIGINAL_AMOUNT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.PAYMENT_DATE;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.PUNCTUAL_DISCOUNT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.STUDENT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.UNIT;

/**
 * Turns the receivables sheet into inflow ledger entries.
 * Rows that are too short, have no valid due date or carry a zero amount are dropped silently.
 */
@Slf4j
@Service
public class ReceivableRowParser {

    static final String UNIDENTIFIED_COUNTERPARTY = "Sem identificacao";
    static final String NOTE_SEPARATOR = " / ";

    /**
     * @param values every sheet row, header first
     */
    public ParseResult parse(List<List<String>> values) {
        if (values == null || values.size() <= 1) {
            return ParseResult.empty();
        }

        List<LedgerEntry> entries = new ArrayList<>();
        int discarded = 0;

        // row 0 is the header
        for (int i = 1; i < values.size(); i++) {
            LedgerEntry entry = toEntry(i + 1, SheetRow.of(values.get(i)));
            if (entry == null) {
                discarded++;
            } else {
                entries.add(entry);
            }
        }

        return new ParseResult(entries, values.size() - 1, discarded);
    }

    private LedgerEntry toEntry(int sheetLine, SheetRow row) {
        if (row.isNarrowerThan(MIN_ROW_WIDTH)) {
            Log.debug(log, "ROW_DISCARDED", "Linha {} ignorada: {} colunas.", sheetLine, row.width());
            return null;
        }

        BigDecimal amount = LocaleNumbers.parseCurrency(row.raw(ORIGINAL_AMOUNT));
        LocalDate dueDate = LocaleNumbers.parseDate(row.raw(DUE_DATE));

        if (dueDate == null || amount.signum() == 0) {
            Log.debug(log, "ROW_DISCARDED", "Linha {} ignorada: vencimento '{}', valor '{}'.",
                    sheetLine, row.raw(DUE_DATE), row.raw(ORIGINAL_AMOUNT));
            return null;
        }

        LocalDate paymentDate = LocaleNumbers.parseDate(row.raw(PAYMENT_DATE));
        BigDecimal punctualDiscount = LocaleNumbers.parseCurrency(row.raw(PUNCTUAL_DISCOUNT));
        String counterparty = row.text(CLIENT);
        String description = row.text(DESCRIPTION);

        return LedgerEntry.builder()
                .dueDate(dueDate)
                .kind(EntryKind.INFLOW)
                .counterparty(counterparty != null ? counterparty : UNIDENTIFIED_COUNTERPARTY)
                .description(description != null ? description : "")
                .amount(amount)
                .status(paymentDate != null ? EntryStatus.PAID : EntryStatus.DUE)
                .unit(row.text(UNIT))
                .note(buildNote(row.text(CATEGORY), row.text(INSTALLMENT)))
                .paymentDate(paymentDate)
                .student(row.text(STUDENT))
                .installment(row.text(INSTALLMENT))
                .punctualDiscount(punctualDiscount.signum() != 0 ? punctualDiscount : null)
                .build();
    }

    static String buildNote(String category, String installment) {
        if (category != null && installment != null) {
            return category + NOTE_SEPARATOR + installment;
        }
        return category != null ? category : installment;
    }
}
