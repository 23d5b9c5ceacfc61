package com.trancheledger.exception;

import java.time.LocalDate;
import lombok.Getter;

/**
 * A Sell could not be attributed to a lot established by an earlier Buy.
 *
 * <p>Fatal for the ledger of the sell's symbol; other symbols are unaffected.
 */
@Getter
public class UnknownLotException extends BaseException {

    private final String symbol;
    private final String lotId;

    public UnknownLotException(int rowNumber, LocalDate date, String symbol, String lotId) {
        super(
                ErrorCode.UNKNOWN_LOT,
                lotId == null
                        ? String.format(
                                "Row %d (%s): sell of %s has no lot id and no prior buy established one",
                                rowNumber, date, symbol)
                        : String.format(
                                "Row %d (%s): sell of %s references lot %s which no prior buy established",
                                rowNumber, date, symbol, lotId),
                rowContext(rowNumber, date, symbol, lotId));
        this.symbol = symbol;
        this.lotId = lotId;
    }
}
