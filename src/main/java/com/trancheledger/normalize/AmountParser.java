package com.trancheledger.normalize;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the loosely formatted numeric, percentage and date cells of a transaction sheet.
 */
public final class AmountParser {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private static final Pattern CURRENCY_NOISE = Pattern.compile("[\\s$€£¥,]|USD|EUR|GBP");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu/M/d").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT));

    private AmountParser() {}

    /**
     * Parses a decimal after stripping currency symbols, codes, thousands separators and spaces.
     * Accounting negatives in parentheses are accepted. Returns null for blank input.
     *
     * @throws NumberFormatException when the remainder is not a number
     */
    public static BigDecimal parseDecimal(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String cleaned = CURRENCY_NOISE.matcher(raw.trim()).replaceAll("");
        boolean negative = false;
        if (cleaned.startsWith("(") && cleaned.endsWith(")") && cleaned.length() > 2) {
            negative = true;
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        if (cleaned.isEmpty()) {
            throw new NumberFormatException("Not a number: '" + raw + "'");
        }
        BigDecimal value = new BigDecimal(cleaned);
        return negative ? value.negate() : value;
    }

    /**
     * Parses a return-of-capital percentage into a fraction. "40%", "40" and "0.4" all yield 0.4:
     * values carrying a percent sign, or above 1, are read as whole percentages.
     */
    public static BigDecimal parsePercent(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        boolean hasPercentSign = trimmed.endsWith("%");
        BigDecimal value = parseDecimal(hasPercentSign ? trimmed.substring(0, trimmed.length() - 1) : trimmed);
        if (value == null) {
            throw new NumberFormatException("Not a percentage: '" + raw + "'");
        }
        if (hasPercentSign || value.compareTo(BigDecimal.ONE) > 0) {
            return value.divide(HUNDRED);
        }
        return value;
    }

    /**
     * Parses a calendar date. Timestamps in ISO form keep only their date part.
     */
    public static Optional<LocalDate> parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        int timeSeparator = trimmed.indexOf('T');
        if (timeSeparator == 10) {
            trimmed = trimmed.substring(0, timeSeparator);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(trimmed, format));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }
}
