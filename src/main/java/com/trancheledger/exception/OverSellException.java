package com.trancheledger.exception;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import lombok.Getter;

/**
 * A Sell would take a lot's sold shares above its bought shares.
 */
@Getter
public class OverSellException extends BaseException {

    private final String symbol;
    private final String lotId;

    public OverSellException(
            int rowNumber, LocalDate date, String symbol, String lotId, BigDecimal requested, BigDecimal available) {
        super(
                ErrorCode.OVER_SELL,
                String.format(
                        "Row %d (%s): sell of %s shares from lot %s exceeds the %s shares remaining",
                        rowNumber, date, requested.toPlainString(), lotId, available.toPlainString()),
                details(rowNumber, date, symbol, lotId, requested, available));
        this.symbol = symbol;
        this.lotId = lotId;
    }

    private static Map<String, Object> details(
            int rowNumber, LocalDate date, String symbol, String lotId, BigDecimal requested, BigDecimal available) {
        Map<String, Object> details = rowContext(rowNumber, date, symbol, lotId);
        details.put("requested", requested);
        details.put("available", available);
        return details;
    }
}
