package com.trancheledger.aggregation;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One (week, symbol) line of the income tracker. Year-to-date figures include this row and
 * every earlier week of the same year; week-all figures cover every symbol in the week.
 */
@Value
@Builder
public class WeeklyIncomeRow {

    LocalDate weekStart;
    int year;
    String symbol;

    BigDecimal distribution;
    BigDecimal taxableIncome;
    BigDecimal roc;

    BigDecimal weekAllDistribution;
    BigDecimal weekAllTaxableIncome;
    BigDecimal weekAllRoc;

    BigDecimal ytdSymbolDistribution;
    BigDecimal ytdSymbolTaxableIncome;
    BigDecimal ytdSymbolRoc;

    BigDecimal ytdAllDistribution;
    BigDecimal ytdAllTaxableIncome;
    BigDecimal ytdAllRoc;

    BigDecimal sharesEligible;

    /** Distribution divided by shares eligible; zero when no shares were eligible. */
    BigDecimal incomePerShare;

    int eventCount;
    int trancheCount;
}
