package io.github.sysfina.ingestion.service.parser;

import io.github.sysfina.ingestion.domain.model.CellText;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing rules for the pt-BR text found in the sheet: {@code 1.234,56} amounts and {@code dd/MM/yyyy} dates.
 */
public final class LocaleNumbers {

    private static final Pattern THOUSANDS_SEPARATOR = Pattern.compile("\\.");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.-]");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^-?(\\d+\\.?\\d*|\\.\\d+)");
    private static final Pattern BR_DATE = Pattern.compile("^(\\d{2})/(\\d{2})/(\\d{4})$");

    private LocaleNumbers() {
    }

    /**
     * Reads a currency cell such as {@code "R$ 1.234,56"}. Anything that does not yield a number reads as zero.
     * Only the leading numeric part of the cleaned text counts, so {@code "12-3"} reads as 12.
     */
    public static BigDecimal parseCurrency(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        String normalized = THOUSANDS_SEPARATOR.matcher(value).replaceAll("").replaceFirst(",", ".");
        normalized = NON_NUMERIC.matcher(normalized).replaceAll("");

        Matcher m = LEADING_NUMBER.matcher(normalized);
        if (!m.find()) {
            return BigDecimal.ZERO;
        }
        String number = m.group();
        if (number.endsWith(".")) {
            number = number.substring(0, number.length() - 1);
        }
        return new BigDecimal(number);
    }

    /**
     * @return the date, or {@code null} unless the text is exactly {@code dd/MM/yyyy} and names a real day
     */
    public static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = BR_DATE.matcher(CellText.strip(value));
        if (!m.matches()) {
            return null;
        }
        try {
            return LocalDate.of(
                    Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(1)));
        } catch (DateTimeException e) {
            return null;
        }
    }
}
