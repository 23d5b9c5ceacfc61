package com.trancheledger.normalize;

import com.trancheledger.domain.enums.TransactionKind;
import com.trancheledger.domain.model.RawTransactionTable;
import com.trancheledger.domain.model.RawTransactionTable.RawRow;
import com.trancheledger.domain.model.TransactionEvent;
import com.trancheledger.exception.MalformedRowException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw transaction rows into typed {@link TransactionEvent}s.
 *
 * <p>Header problems are fatal and surface as {@code MissingColumnException} before any row is
 * read. Row problems are isolated: the row is logged, recorded as a {@link RowRejection}, and
 * skipped. Rows keep their source order; chronological ordering is applied downstream.
 */
@Component
public class TransactionNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TransactionNormalizer.class);

    public NormalizationResult normalize(RawTransactionTable table) {
        TransactionHeaderMap headerMap = TransactionHeaderMap.resolve(table.getHeaders());

        List<TransactionEvent> events = new ArrayList<>();
        List<RowRejection> rejections = new ArrayList<>();
        for (RawRow row : table.getRows()) {
            if (row.isBlank()) {
                continue;
            }
            try {
                events.add(toEvent(row, headerMap));
            } catch (MalformedRowException e) {
                log.warn("Skipping transaction row: {}", e.getMessage());
                rejections.add(RowRejection.from(e));
            }
        }

        log.info("Normalized {} transaction rows ({} skipped)", events.size(), rejections.size());
        return new NormalizationResult(
                Collections.unmodifiableList(events), Collections.unmodifiableList(rejections));
    }

    private TransactionEvent toEvent(RawRow row, TransactionHeaderMap headerMap) {
        int rowNumber = row.getRowNumber();

        String kindCell = cell(row, headerMap, TransactionField.KIND);
        TransactionKind kind = TransactionKind.fromLabel(kindCell)
                .orElseThrow(() -> new MalformedRowException(
                        rowNumber,
                        headerMap.headerName(TransactionField.KIND),
                        "unknown transaction kind '" + nullToEmpty(kindCell) + "'"));

        String dateCell = cell(row, headerMap, TransactionField.DATE);
        LocalDate date = AmountParser.parseDate(dateCell)
                .orElseThrow(() -> new MalformedRowException(
                        rowNumber,
                        headerMap.headerName(TransactionField.DATE),
                        "unparsable date '" + nullToEmpty(dateCell) + "'"));

        String symbol = nullToEmpty(cell(row, headerMap, TransactionField.SYMBOL))
                .trim()
                .toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            throw new MalformedRowException(rowNumber, headerMap.headerName(TransactionField.SYMBOL), "symbol is blank");
        }

        TransactionEvent.TransactionEventBuilder builder = TransactionEvent.builder()
                .rowNumber(rowNumber)
                .kind(kind)
                .date(date)
                .symbol(symbol);

        if (kind == TransactionKind.DIVIDEND) {
            return dividend(row, headerMap, builder);
        }
        return trade(row, headerMap, builder);
    }

    private TransactionEvent trade(
            RawRow row, TransactionHeaderMap headerMap, TransactionEvent.TransactionEventBuilder builder) {
        BigDecimal shares = decimal(row, headerMap, TransactionField.SHARES);
        if (shares == null || shares.signum() <= 0) {
            throw new MalformedRowException(
                    row.getRowNumber(), headerMap.headerName(TransactionField.SHARES), "shares must be greater than zero");
        }
        BigDecimal price = decimal(row, headerMap, TransactionField.PRICE);
        if (price == null || price.signum() < 0) {
            throw new MalformedRowException(
                    row.getRowNumber(), headerMap.headerName(TransactionField.PRICE), "price must be zero or more");
        }
        String override = cell(row, headerMap, TransactionField.LOT_ID_OVERRIDE);
        return builder.shares(shares)
                .price(price)
                .lotIdOverride(override == null || override.isBlank() ? null : override.trim())
                .build();
    }

    private TransactionEvent dividend(
            RawRow row, TransactionHeaderMap headerMap, TransactionEvent.TransactionEventBuilder builder) {
        int rowNumber = row.getRowNumber();

        BigDecimal total = nonNegative(row, headerMap, TransactionField.DIVIDEND_TOTAL);
        BigDecimal perShare = nonNegative(row, headerMap, TransactionField.DIVIDEND_PER_SHARE);
        if (total == null && perShare == null) {
            throw new MalformedRowException(
                    rowNumber,
                    headerMap.headerName(TransactionField.DIVIDEND_TOTAL),
                    "dividend needs a total or a per-share amount");
        }

        BigDecimal rocPercent = percent(row, headerMap);
        BigDecimal rocAmount = nonNegative(row, headerMap, TransactionField.ROC_AMOUNT);
        if (rocAmount != null && total != null && rocAmount.compareTo(total) > 0) {
            throw new MalformedRowException(
                    rowNumber,
                    headerMap.headerName(TransactionField.ROC_AMOUNT),
                    "return of capital exceeds the distribution total");
        }
        BigDecimal taxable = nonNegative(row, headerMap, TransactionField.TAXABLE_INCOME);

        return builder.dividendTotal(total)
                .dividendPerShare(perShare)
                .rocPercent(rocPercent)
                .rocAmount(rocAmount)
                .taxableIncome(taxable)
                .build();
    }

    private BigDecimal percent(RawRow row, TransactionHeaderMap headerMap) {
        String raw = cell(row, headerMap, TransactionField.ROC_PERCENT);
        String column = headerMap.headerName(TransactionField.ROC_PERCENT);
        BigDecimal value;
        try {
            value = AmountParser.parsePercent(raw);
        } catch (NumberFormatException e) {
            throw new MalformedRowException(row.getRowNumber(), column, "not a percentage: '" + raw + "'");
        }
        if (value != null && (value.signum() < 0 || value.compareTo(BigDecimal.ONE) > 0)) {
            throw new MalformedRowException(row.getRowNumber(), column, "percentage must be between 0 and 100");
        }
        return value;
    }

    private BigDecimal nonNegative(RawRow row, TransactionHeaderMap headerMap, TransactionField field) {
        BigDecimal value = decimal(row, headerMap, field);
        if (value != null && value.signum() < 0) {
            throw new MalformedRowException(row.getRowNumber(), headerMap.headerName(field), "amount is negative");
        }
        return value;
    }

    private BigDecimal decimal(RawRow row, TransactionHeaderMap headerMap, TransactionField field) {
        String raw = cell(row, headerMap, field);
        try {
            return AmountParser.parseDecimal(raw);
        } catch (NumberFormatException e) {
            throw new MalformedRowException(
                    row.getRowNumber(), headerMap.headerName(field), "not a number: '" + raw + "'");
        }
    }

    private String cell(RawRow row, TransactionHeaderMap headerMap, TransactionField field) {
        return row.cell(headerMap.indexOf(field));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
