package com.trancheledger.exception;

import java.time.LocalDate;
import java.util.Map;
import lombok.Getter;

/**
 * A Buy named a lot id that already belongs to a different symbol.
 */
@Getter
public class LotConflictException extends BaseException {

    private final String symbol;
    private final String lotId;

    public LotConflictException(int rowNumber, LocalDate date, String symbol, String lotId, String ownerSymbol) {
        super(
                ErrorCode.LOT_CONFLICT,
                String.format(
                        "Row %d (%s): buy of %s names lot %s which already belongs to %s",
                        rowNumber, date, symbol, lotId, ownerSymbol),
                details(rowNumber, date, symbol, lotId, ownerSymbol));
        this.symbol = symbol;
        this.lotId = lotId;
    }

    private static Map<String, Object> details(
            int rowNumber, LocalDate date, String symbol, String lotId, String ownerSymbol) {
        Map<String, Object> details = rowContext(rowNumber, date, symbol, lotId);
        details.put("ownerSymbol", ownerSymbol);
        return details;
    }
}
