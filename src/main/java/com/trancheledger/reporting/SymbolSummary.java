package com.trancheledger.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Year-end style rollup for one symbol across all of its lots and dividends.
 */
@Value
@Builder
public class SymbolSummary {

    String symbol;

    BigDecimal distribution;
    BigDecimal taxableIncome;
    BigDecimal roc;

    /** Dividends that reached no lot. */
    BigDecimal unallocatedDistribution;
    BigDecimal unallocatedTaxableIncome;
    BigDecimal unallocatedRoc;

    int unallocatedCount;

    int openLots;
    int partialLots;
    int closedLots;

    BigDecimal sharesRemaining;
    BigDecimal costBasis;
    BigDecimal adjustedBasis;
    BigDecimal marketValue;
    BigDecimal unrealizedGain;
    BigDecimal realizedGain;

    /** Return of capital allocated exceeds the distribution it came from. Worth a second look. */
    boolean rocExceedsDistribution;

    boolean ledgerFailed;
}
