package com.trancheledger.event;

import com.trancheledger.reporting.LedgerReport;
import java.time.Duration;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every completed ledger run, whether triggered at startup or by an API call.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>LedgerMetrics: counts runs, rejected rows, unallocated dividends and failed symbols</li>
 * </ul>
 */
public class LedgerRunCompletedEvent extends ApplicationEvent {

    private final LedgerReport report;
    private final Duration duration;

    public LedgerRunCompletedEvent(Object source, LedgerReport report, Duration duration) {
        super(source);
        this.report = report;
        this.duration = duration;
    }

    public LedgerReport getReport() {
        return report;
    }

    public Duration getDuration() {
        return duration;
    }
}
