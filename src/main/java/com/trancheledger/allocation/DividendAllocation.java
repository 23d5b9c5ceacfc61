package com.trancheledger.allocation;

import com.trancheledger.domain.enums.TrancheStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One lot's share of one dividend. Per-share figures are the dividend's amounts divided by the
 * shares eligible across all open lots of the symbol on the distribution date.
 */
@Value
@Builder
public class DividendAllocation {

    /** Source row of the dividend. */
    int rowNumber;

    LocalDate date;
    LocalDate weekStart;
    String symbol;
    String lotId;

    /** Lot shares held on the distribution date. */
    BigDecimal sharesEligible;

    BigDecimal lotSharesBought;
    BigDecimal lotCostBasis;
    TrancheStatus lotStatus;

    BigDecimal distributionPerShare;
    BigDecimal taxablePerShare;
    BigDecimal rocPerShare;

    BigDecimal distribution;
    BigDecimal taxableIncome;
    BigDecimal roc;
    BigDecimal rocPercent;
}
