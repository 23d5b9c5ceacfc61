package com.trancheledger.reporting;

import com.trancheledger.allocation.DividendAllocation;
import com.trancheledger.allocation.UnallocatedDividend;
import com.trancheledger.gain.TrancheSnapshot;
import com.trancheledger.util.Decimals;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Rolls lot snapshots and dividend allocations up to one {@link SymbolSummary} per symbol,
 * sorted by symbol.
 */
@Component
public class SymbolSummaryCalculator {

    public List<SymbolSummary> summarize(
            List<TrancheSnapshot> snapshots,
            List<DividendAllocation> allocations,
            List<UnallocatedDividend> unallocated,
            Collection<String> failedSymbols) {
        Map<String, Accumulator> bySymbol = new TreeMap<>();
        Function<String, Accumulator> create = Accumulator::new;

        for (TrancheSnapshot snapshot : snapshots) {
            bySymbol.computeIfAbsent(snapshot.getSymbol(), create).add(snapshot);
        }
        for (DividendAllocation allocation : allocations) {
            bySymbol.computeIfAbsent(allocation.getSymbol(), create).add(allocation);
        }
        for (UnallocatedDividend dividend : unallocated) {
            bySymbol.computeIfAbsent(dividend.getSymbol(), create).add(dividend);
        }
        for (String symbol : failedSymbols) {
            bySymbol.computeIfAbsent(symbol, create).ledgerFailed = true;
        }

        List<SymbolSummary> summaries = new ArrayList<>(bySymbol.size());
        for (Accumulator accumulator : bySymbol.values()) {
            summaries.add(accumulator.toSummary());
        }
        return summaries;
    }

    private static final class Accumulator {

        private final String symbol;
        private BigDecimal distribution = BigDecimal.ZERO;
        private BigDecimal taxableIncome = BigDecimal.ZERO;
        private BigDecimal roc = BigDecimal.ZERO;
        private BigDecimal unallocatedDistribution = BigDecimal.ZERO;
        private BigDecimal unallocatedTaxableIncome = BigDecimal.ZERO;
        private BigDecimal unallocatedRoc = BigDecimal.ZERO;
        private int unallocatedCount;
        private int openLots;
        private int partialLots;
        private int closedLots;
        private BigDecimal sharesRemaining = BigDecimal.ZERO;
        private BigDecimal costBasis = BigDecimal.ZERO;
        private BigDecimal adjustedBasis = BigDecimal.ZERO;
        private BigDecimal marketValue = BigDecimal.ZERO;
        private BigDecimal unrealizedGain = BigDecimal.ZERO;
        private BigDecimal realizedGain = BigDecimal.ZERO;
        private boolean ledgerFailed;

        Accumulator(String symbol) {
            this.symbol = symbol;
        }

        void add(TrancheSnapshot snapshot) {
            switch (snapshot.getStatus()) {
                case OPEN -> openLots++;
                case PARTIAL -> partialLots++;
                case CLOSED -> closedLots++;
            }
            sharesRemaining = sharesRemaining.add(snapshot.getSharesRemaining());
            costBasis = costBasis.add(snapshot.getCostBasis());
            adjustedBasis = adjustedBasis.add(snapshot.getAdjustedBasis());
            marketValue = marketValue.add(snapshot.getMarketValue());
            unrealizedGain = unrealizedGain.add(snapshot.getUnrealizedGain());
            realizedGain = realizedGain.add(Decimals.orZero(snapshot.getRealizedGain()));
        }

        void add(DividendAllocation allocation) {
            distribution = distribution.add(allocation.getDistribution());
            taxableIncome = taxableIncome.add(allocation.getTaxableIncome());
            roc = roc.add(allocation.getRoc());
        }

        void add(UnallocatedDividend dividend) {
            unallocatedDistribution = unallocatedDistribution.add(Decimals.orZero(dividend.getDistribution()));
            unallocatedTaxableIncome = unallocatedTaxableIncome.add(Decimals.orZero(dividend.getTaxableIncome()));
            unallocatedRoc = unallocatedRoc.add(Decimals.orZero(dividend.getRoc()));
            unallocatedCount++;
        }

        SymbolSummary toSummary() {
            return SymbolSummary.builder()
                    .symbol(symbol)
                    .distribution(distribution)
                    .taxableIncome(taxableIncome)
                    .roc(roc)
                    .unallocatedDistribution(unallocatedDistribution)
                    .unallocatedTaxableIncome(unallocatedTaxableIncome)
                    .unallocatedRoc(unallocatedRoc)
                    .unallocatedCount(unallocatedCount)
                    .openLots(openLots)
                    .partialLots(partialLots)
                    .closedLots(closedLots)
                    .sharesRemaining(sharesRemaining)
                    .costBasis(costBasis)
                    .adjustedBasis(adjustedBasis)
                    .marketValue(marketValue)
                    .unrealizedGain(unrealizedGain)
                    .realizedGain(realizedGain)
                    .rocExceedsDistribution(roc.compareTo(distribution) > 0)
                    .ledgerFailed(ledgerFailed)
                    .build();
        }
    }
}
