package com.trancheledger.gain;

import com.trancheledger.domain.enums.ExitReadiness;
import com.trancheledger.domain.enums.TrancheStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of one lot at report time: its ledger state plus the basis and gain figures
 * derived from it and the current price.
 */
@Value
@Builder
public class TrancheSnapshot {

    String lotId;
    String symbol;
    LocalDate acquisitionDate;
    TrancheStatus status;

    BigDecimal sharesBought;
    BigDecimal sharesSold;
    BigDecimal sharesRemaining;
    BigDecimal costBasis;
    BigDecimal averageBuyPrice;
    BigDecimal lastSalePrice;

    BigDecimal cumulativeIncome;
    BigDecimal cumulativeRoc;

    /** Cost basis less return of capital received. */
    BigDecimal adjustedBasis;

    /** Share of the cost basis returned as ROC. */
    BigDecimal consumedBasisRatio;

    BigDecimal currentPrice;
    BigDecimal marketValue;
    BigDecimal unrealizedGain;

    /** Null when nothing has been sold. */
    BigDecimal realizedGain;

    /** Fraction of adjusted basis the market value still has to recover, in [0, 1]. */
    BigDecimal percentToExit;

    Long heldDays;
    ExitReadiness exitReadiness;
}
