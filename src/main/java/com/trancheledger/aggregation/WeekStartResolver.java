package com.trancheledger.aggregation;

import com.trancheledger.config.LedgerProperties;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps a date to the start of its reporting week: the anchor weekday on or before the date.
 */
@Component
public class WeekStartResolver {

    private final DayOfWeek anchor;

    @Autowired
    public WeekStartResolver(LedgerProperties properties) {
        this(properties.getWeekAnchor());
    }

    public WeekStartResolver(DayOfWeek anchor) {
        this.anchor = anchor != null ? anchor : DayOfWeek.MONDAY;
    }

    public LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(anchor));
    }

    public DayOfWeek getAnchor() {
        return anchor;
    }
}
