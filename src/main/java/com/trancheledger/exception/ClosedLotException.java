package com.trancheledger.exception;

import java.time.LocalDate;
import lombok.Getter;

/**
 * A Buy named a lot that an earlier Sell already closed. Closed lots stay closed; a new purchase
 * needs a new lot id.
 */
@Getter
public class ClosedLotException extends BaseException {

    private final String symbol;
    private final String lotId;

    public ClosedLotException(int rowNumber, LocalDate date, String symbol, String lotId) {
        super(
                ErrorCode.CLOSED_LOT,
                String.format(
                        "Row %d (%s): buy of %s names lot %s which is already closed", rowNumber, date, symbol, lotId),
                rowContext(rowNumber, date, symbol, lotId));
        this.symbol = symbol;
        this.lotId = lotId;
    }
}
