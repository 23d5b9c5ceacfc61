package com.trancheledger.domain.vo;

import java.time.LocalDate;
import java.util.Comparator;
import lombok.Value;

/** Composite key for weekly aggregation: the anchored week start plus the symbol. */
@Value
public class WeekSymbolKey implements Comparable<WeekSymbolKey> {

    private static final Comparator<WeekSymbolKey> ORDER =
            Comparator.comparing(WeekSymbolKey::getWeekStart).thenComparing(WeekSymbolKey::getSymbol);

    LocalDate weekStart;
    String symbol;

    public int getYear() {
        return weekStart.getYear();
    }

    @Override
    public int compareTo(WeekSymbolKey other) {
        return ORDER.compare(this, other);
    }
}
