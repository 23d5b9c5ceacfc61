package com.trancheledger.aggregation;

import com.trancheledger.allocation.DividendAllocation;
import com.trancheledger.domain.vo.WeekSymbolKey;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Allocations of one symbol within one week, summed.
 *
 * <p>The event count is the number of distinct dividends contributing; the tranche count is the
 * number of distinct lots that received part of one.
 */
@Getter
public class WeeklyAggregate {

    private final WeekSymbolKey key;
    private IncomeAmounts amounts = IncomeAmounts.ZERO;
    private BigDecimal sharesEligible = BigDecimal.ZERO;

    @Getter(AccessLevel.NONE)
    private final Set<Integer> dividendRows = new HashSet<>();

    @Getter(AccessLevel.NONE)
    private final Set<String> lotIds = new HashSet<>();

    WeeklyAggregate(WeekSymbolKey key) {
        this.key = key;
    }

    void add(DividendAllocation allocation) {
        amounts = amounts.plus(new IncomeAmounts(
                allocation.getDistribution(), allocation.getTaxableIncome(), allocation.getRoc()));
        sharesEligible = sharesEligible.add(allocation.getSharesEligible());
        dividendRows.add(allocation.getRowNumber());
        lotIds.add(allocation.getLotId());
    }

    public int getEventCount() {
        return dividendRows.size();
    }

    public int getTrancheCount() {
        return lotIds.size();
    }
}
