package com.trancheledger.aggregation;

import com.trancheledger.domain.vo.YearSymbolKey;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Running totals for one aggregation pass: year-to-date per symbol, year-to-date across symbols,
 * and whole-week totals across symbols. A new instance starts every pass at zero.
 */
class IncomeTotals {

    private final Map<YearSymbolKey, IncomeAmounts> ytdBySymbol = new HashMap<>();
    private final Map<Integer, IncomeAmounts> ytdAll = new HashMap<>();
    private final Map<LocalDate, IncomeAmounts> weekAll = new HashMap<>();

    void addToWeek(LocalDate weekStart, IncomeAmounts amounts) {
        weekAll.merge(weekStart, amounts, IncomeAmounts::plus);
    }

    IncomeAmounts weekTotal(LocalDate weekStart) {
        return weekAll.getOrDefault(weekStart, IncomeAmounts.ZERO);
    }

    /** Adds to both year-to-date tables and returns the new per-symbol total. */
    IncomeAmounts addToYear(YearSymbolKey key, IncomeAmounts amounts) {
        ytdAll.merge(key.getYear(), amounts, IncomeAmounts::plus);
        return ytdBySymbol.merge(key, amounts, IncomeAmounts::plus);
    }

    IncomeAmounts yearTotal(int year) {
        return ytdAll.getOrDefault(year, IncomeAmounts.ZERO);
    }
}
