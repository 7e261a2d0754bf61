package io.github.sysfina.ingestion.service.parser;

import io.github.sysfina.ingestion.domain.model.EntryKind;
import io.github.sysfina.ingestion.domain.model.EntryStatus;
import io.github.sysfina.ingestion.domain.model.LedgerEntry;
import io.github.sysfina.ingestion.domain.model.ParseResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.CATEGORY;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.CLIENT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.DESCRIPTION;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.DUE_DATE;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.INSTALLMENT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.ORIGINAL_AMOUNT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.PAYMENT_DATE;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.PUNCTUAL_DISCOUNT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.STUDENT;
import static io.github.sysfina.ingestion.domain.model.ReceivableColumn.UNIT;
import static io.github.sysfina.ingestion.service.parser.SheetRows.HEADER;
import static io.github.sysfina.ingestion.service.parser.SheetRows.row;
import static org.assertj.core.api.Assertions.assertThat;

class ReceivableRowParserTest {

    private final ReceivableRowParser parser = new ReceivableRowParser();

    @Test
    void emptyOrHeaderOnlySheetYieldsNothing() {
        assertThat(parser.parse(null).entries()).isEmpty();
        assertThat(parser.parse(List.of()).entries()).isEmpty();

        ParseResult headerOnly = parser.parse(List.of(HEADER));
        assertThat(headerOnly.entries()).isEmpty();
        assertThat(headerOnly.rowsRead()).isZero();
    }

    @Test
    void headerRowIsNeverImported() {
        List<String> header = row().with(DUE_DATE, "01/01/2024").with(ORIGINAL_AMOUNT, "10,00").build();

        ParseResult result = parser.parse(List.of(header));

        assertThat(result.entries()).isEmpty();
    }

    @Test
    void mapsEveryFieldOfACompleteRow() {
        List<String> data = row()
                .with(CLIENT, "  Joana Souza ")
                .with(STUDENT, " Pedro ")
                .with(DUE_DATE, "10/02/2024")
                .with(PAYMENT_DATE, "08/02/2024")
                .with(CATEGORY, "Mensalidade")
                .with(DESCRIPTION, " Mensalidade fevereiro ")
                .with(INSTALLMENT, "2/12")
                .with(ORIGINAL_AMOUNT, "R$ 1.250,90")
                .with(PUNCTUAL_DISCOUNT, "50,00")
                .with(UNIT, " Centro ")
                .build();

        List<LedgerEntry> entries = parser.parse(List.of(HEADER, data)).entries();

        assertThat(entries).hasSize(1);
        LedgerEntry entry = entries.get(0);
        assertThat(entry.getDueDate()).isEqualTo(LocalDate.of(2024, 2, 10));
        assertThat(entry.getKind()).isEqualTo(EntryKind.INFLOW);
        assertThat(entry.getCounterparty()).isEqualTo("Joana Souza");
        assertThat(entry.getDescription()).isEqualTo("Mensalidade fevereiro");
        assertThat(entry.getAmount()).isEqualByComparingTo("1250.90");
        assertThat(entry.getStatus()).isEqualTo(EntryStatus.PAID);
        assertThat(entry.getUnit()).isEqualTo("Centro");
        assertThat(entry.getNote()).isEqualTo("Mensalidade / 2/12");
        assertThat(entry.getPaymentDate()).isEqualTo(LocalDate.of(2024, 2, 8));
        assertThat(entry.getStudent()).isEqualTo("Pedro");
        assertThat(entry.getInstallment()).isEqualTo("2/12");
        assertThat(entry.getPunctualDiscount()).isEqualByComparingTo("50");
    }

    @Test
    void blankOptionalCellsFallBackToDefaults() {
        List<String> data = row()
                .with(DUE_DATE, "10/02/2024")
                .with(ORIGINAL_AMOUNT, "300,00")
                .build();

        LedgerEntry entry = parser.parse(List.of(HEADER, data)).entries().get(0);

        assertThat(entry.getCounterparty()).isEqualTo(ReceivableRowParser.UNIDENTIFIED_COUNTERPARTY);
        assertThat(entry.getDescription()).isEmpty();
        assertThat(entry.getUnit()).isNull();
        assertThat(entry.getNote()).isNull();
        assertThat(entry.getStudent()).isNull();
        assertThat(entry.getInstallment()).isNull();
        assertThat(entry.getPaymentDate()).isNull();
        assertThat(entry.getPunctualDiscount()).isNull();
        assertThat(entry.getStatus()).isEqualTo(EntryStatus.DUE);
    }

    @Test
    void rowsShorterThanTheLayoutAreDropped() {
        List<String> data = row()
                .with(DUE_DATE, "10/02/2024")
                .with(ORIGINAL_AMOUNT, "300,00")
                .truncated(21);

        ParseResult result = parser.parse(List.of(HEADER, data));

        assertThat(result.entries()).isEmpty();
        assertThat(result.rowsDiscarded()).isEqualTo(1);
    }

    @Test
    void rowsWithoutValidDueDateAreDropped() {
        List<String> isoDate = row().with(DUE_DATE, "2024-02-10").with(ORIGINAL_AMOUNT, "300,00").build();
        List<String> noDate = row().with(ORIGINAL_AMOUNT, "300,00").build();

        assertThat(parser.parse(List.of(HEADER, isoDate, noDate)).entries()).isEmpty();
    }

    @Test
    void zeroAmountRowsAreDropped() {
        List<String> zero = row().with(DUE_DATE, "10/02/2024").with(ORIGINAL_AMOUNT, "0,00")
                .with(CLIENT, "Cliente").with(PAYMENT_DATE, "10/02/2024").build();
        List<String> text = row().with(DUE_DATE, "10/02/2024").with(ORIGINAL_AMOUNT, "a combinar").build();

        assertThat(parser.parse(List.of(HEADER, zero, text)).entries()).isEmpty();
    }

    @Test
    void statusIsPaidOnlyWhenPaymentDateParses() {
        List<String> paid = row().with(DUE_DATE, "10/02/2024").with(ORIGINAL_AMOUNT, "1").with(PAYMENT_DATE, "11/02/2024").build();
        List<String> garbage = row().with(DUE_DATE, "10/02/2024").with(ORIGINAL_AMOUNT, "1").with(PAYMENT_DATE, "pago").build();

        List<LedgerEntry> entries = parser.parse(List.of(HEADER, paid, garbage)).entries();

        assertThat(entries).extracting(LedgerEntry::getStatus).containsExactly(EntryStatus.PAID, EntryStatus.DUE);
        assertThat(entries.get(1).getPaymentDate()).isNull();
    }

    @Test
    void noteFallsBackToWhicheverPartIsPresent() {
        assertThat(ReceivableRowParser.buildNote("Mensalidade", "2/12")).isEqualTo("Mensalidade / 2/12");
        assertThat(ReceivableRowParser.buildNote("Mensalidade", null)).isEqualTo("Mensalidade");
        assertThat(ReceivableRowParser.buildNote(null, "2/12")).isEqualTo("2/12");
        assertThat(ReceivableRowParser.buildNote(null, null)).isNull();
    }

    @Test
    void blankCategoryIsTreatedAsMissing() {
        List<String> data = row().with(DUE_DATE, "10/02/2024").with(ORIGINAL_AMOUNT, "1")
                .with(CATEGORY, "   ").with(INSTALLMENT, "3/12").build();

        assertThat(parser.parse(List.of(HEADER, data)).entries().get(0).getNote()).isEqualTo("3/12");
    }

    @Test
    void zeroDiscountIsOmitted() {
        List<String> data = row().with(DUE_DATE, "10/02/2024").with(ORIGINAL_AMOUNT, "1")
                .with(PUNCTUAL_DISCOUNT, "0,00").build();

        assertThat(parser.parse(List.of(HEADER, data)).entries().get(0).getPunctualDiscount()).isNull();
    }

    @Test
    void keepsOnlyTheValidRowOfAMixedSheet() {
        List<String> valid = row().with(DUE_DATE, "15/03/2024").with(ORIGINAL_AMOUNT, "150,00").build();
        List<String> zeroAmount = row().with(DUE_DATE, "15/03/2024").with(ORIGINAL_AMOUNT, "0").build();
        List<String> tenCells = row().with(DUE_DATE, "15/03/2024").with(ORIGINAL_AMOUNT, "99,00").truncated(10);

        ParseResult result = parser.parse(List.of(HEADER, valid, zeroAmount, tenCells));

        assertThat(result.entries()).hasSize(1);
        LedgerEntry entry = result.entries().get(0);
        assertThat(entry.getDueDate()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(entry.getAmount()).isEqualByComparingTo("150.00");
        assertThat(entry.getStatus()).isEqualTo(EntryStatus.DUE);
        assertThat(result.rowsRead()).isEqualTo(3);
        assertThat(result.rowsDiscarded()).isEqualTo(2);
    }

    @Test
    void preservesSheetOrder() {
        List<String> first = row().with(DUE_DATE, "01/01/2024").with(ORIGINAL_AMOUNT, "1").with(CLIENT, "A").build();
        List<String> second = row().with(DUE_DATE, "01/01/2024").with(ORIGINAL_AMOUNT, "2").with(CLIENT, "B").build();
        List<String> third = row().with(DUE_DATE, "01/01/2024").with(ORIGINAL_AMOUNT, "3").with(CLIENT, "C").build();

        List<LedgerEntry> entries = parser.parse(List.of(HEADER, first, second, third)).entries();

        assertThat(entries).extracting(LedgerEntry::getCounterparty).containsExactly("A", "B", "C");
    }

    @Test
    void noBreakSpaceCellsCountAsBlank() {
        List<String> data = row()
                .with(CLIENT, "\u00A0")
                .with(CATEGORY, "\u00A0")
                .with(DUE_DATE, "10/02/2024\u00A0")
                .with(ORIGINAL_AMOUNT, "100,00")
                .build();

        List<LedgerEntry> entries = parser.parse(List.of(HEADER, data)).entries();

        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getDueDate()).isEqualTo(LocalDate.of(2024, 2, 10));
        assertThat(entries.get(0).getCounterparty()).isEqualTo(ReceivableRowParser.UNIDENTIFIED_COUNTERPARTY);
        assertThat(entries.get(0).getNote()).isNull();
    }
}
