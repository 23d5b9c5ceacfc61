package com.trancheledger.observability;

import com.trancheledger.event.LedgerRunCompletedEvent;
import com.trancheledger.reporting.LedgerDiagnostics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for ledger runs, exposed through the actuator.
 *
 * <ul>
 *   <li><b>ledger.runs</b> (counter): completed runs</li>
 *   <li><b>ledger.rows.rejected</b> (counter): transaction rows skipped as malformed</li>
 *   <li><b>ledger.dividends.unallocated</b> (counter): dividends that reached no lot</li>
 *   <li><b>ledger.symbols.failed</b> (counter): symbols whose ledger could not be replayed</li>
 *   <li><b>ledger.run.duration</b> (timer): wall time of one run</li>
 * </ul>
 */
@Service
public class LedgerMetrics {

    private final Counter runsCounter;
    private final Counter rejectedRowsCounter;
    private final Counter unallocatedDividendsCounter;
    private final Counter failedSymbolsCounter;
    private final Timer runTimer;

    public LedgerMetrics(MeterRegistry meterRegistry) {
        this.runsCounter = Counter.builder("ledger.runs")
                .description("Completed ledger runs")
                .register(meterRegistry);

        this.rejectedRowsCounter = Counter.builder("ledger.rows.rejected")
                .description("Transaction rows skipped as malformed")
                .register(meterRegistry);

        this.unallocatedDividendsCounter = Counter.builder("ledger.dividends.unallocated")
                .description("Dividends with no open lot on their date")
                .register(meterRegistry);

        this.failedSymbolsCounter = Counter.builder("ledger.symbols.failed")
                .description("Symbols whose lot ledger failed to replay")
                .register(meterRegistry);

        this.runTimer = Timer.builder("ledger.run.duration")
                .description("Wall time of one full ledger run")
                .register(meterRegistry);
    }

    @EventListener
    public void onLedgerRunCompleted(LedgerRunCompletedEvent event) {
        LedgerDiagnostics diagnostics = event.getReport().getDiagnostics();
        runsCounter.increment();
        rejectedRowsCounter.increment(diagnostics.getRejectedRowCount());
        unallocatedDividendsCounter.increment(diagnostics.getUnallocatedDividends().size());
        failedSymbolsCounter.increment(diagnostics.getSymbolFailures().size());
        runTimer.record(event.getDuration());
    }

    // Expose for testing
    Counter getRunsCounter() {
        return runsCounter;
    }

    Counter getRejectedRowsCounter() {
        return rejectedRowsCounter;
    }

    Counter getUnallocatedDividendsCounter() {
        return unallocatedDividendsCounter;
    }

    Counter getFailedSymbolsCounter() {
        return failedSymbolsCounter;
    }

    Timer getRunTimer() {
        return runTimer;
    }
}
