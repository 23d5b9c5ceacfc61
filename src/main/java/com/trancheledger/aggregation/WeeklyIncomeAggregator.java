package com.trancheledger.aggregation;

import com.trancheledger.allocation.DividendAllocation;
import com.trancheledger.domain.vo.WeekSymbolKey;
import com.trancheledger.domain.vo.YearSymbolKey;
import com.trancheledger.util.Decimals;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rolls lot allocations up into weekly per-symbol income rows with year-to-date running totals.
 *
 * <p>Groups are emitted in ascending (week start, symbol) order. The year of a row is the year
 * of its week start, so a week that straddles New Year counts toward the year it starts in.
 */
@Component
public class WeeklyIncomeAggregator {

    private static final Logger log = LoggerFactory.getLogger(WeeklyIncomeAggregator.class);

    public List<WeeklyIncomeRow> aggregate(List<DividendAllocation> allocations) {
        Map<WeekSymbolKey, WeeklyAggregate> groups = new TreeMap<>();
        for (DividendAllocation allocation : allocations) {
            WeekSymbolKey key = new WeekSymbolKey(allocation.getWeekStart(), allocation.getSymbol());
            groups.computeIfAbsent(key, WeeklyAggregate::new).add(allocation);
        }

        IncomeTotals totals = new IncomeTotals();
        for (WeeklyAggregate group : groups.values()) {
            totals.addToWeek(group.getKey().getWeekStart(), group.getAmounts());
        }

        List<WeeklyIncomeRow> rows = new ArrayList<>(groups.size());
        for (WeeklyAggregate group : groups.values()) {
            WeekSymbolKey key = group.getKey();
            IncomeAmounts amounts = group.getAmounts();
            IncomeAmounts weekAll = totals.weekTotal(key.getWeekStart());
            IncomeAmounts ytdSymbol = totals.addToYear(new YearSymbolKey(key.getYear(), key.getSymbol()), amounts);
            IncomeAmounts ytdAll = totals.yearTotal(key.getYear());

            rows.add(WeeklyIncomeRow.builder()
                    .weekStart(key.getWeekStart())
                    .year(key.getYear())
                    .symbol(key.getSymbol())
                    .distribution(amounts.getDistribution())
                    .taxableIncome(amounts.getTaxableIncome())
                    .roc(amounts.getRoc())
                    .weekAllDistribution(weekAll.getDistribution())
                    .weekAllTaxableIncome(weekAll.getTaxableIncome())
                    .weekAllRoc(weekAll.getRoc())
                    .ytdSymbolDistribution(ytdSymbol.getDistribution())
                    .ytdSymbolTaxableIncome(ytdSymbol.getTaxableIncome())
                    .ytdSymbolRoc(ytdSymbol.getRoc())
                    .ytdAllDistribution(ytdAll.getDistribution())
                    .ytdAllTaxableIncome(ytdAll.getTaxableIncome())
                    .ytdAllRoc(ytdAll.getRoc())
                    .sharesEligible(group.getSharesEligible())
                    .incomePerShare(Decimals.safeDivide(amounts.getDistribution(), group.getSharesEligible()))
                    .eventCount(group.getEventCount())
                    .trancheCount(group.getTrancheCount())
                    .build());
        }

        log.info("Aggregated {} allocations into {} weekly rows", allocations.size(), rows.size());
        return rows;
    }
}
