package com.trancheledger.reporting;

import com.trancheledger.domain.enums.TrancheStatus;
import com.trancheledger.domain.enums.TransactionKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One transaction annotated with ledger context, in source order.
 *
 * <p>Buy and Sell rows carry the lot they were attributed to and that lot's size and status on
 * the row's date. Dividend rows carry the amounts resolved against the symbol's total holding on
 * the date. Rows of a symbol whose ledger failed carry no lot.
 */
@Value
@Builder
public class TransactionLogRow {

    int rowNumber;
    TransactionKind kind;
    LocalDate date;
    LocalDate weekStart;
    String symbol;

    BigDecimal shares;
    BigDecimal price;
    String lotId;

    /** Shares times price, Buy rows only. */
    BigDecimal buyCost;

    /** Symbol shares held after this row, counting rows in date order. */
    BigDecimal runningShares;

    BigDecimal lotSharesRemaining;
    TrancheStatus lotStatus;

    BigDecimal distribution;
    BigDecimal taxableIncome;
    BigDecimal roc;
    BigDecimal rocPercent;
    BigDecimal distributionPerShare;
    BigDecimal taxablePerShare;
    BigDecimal rocPerShare;
}
