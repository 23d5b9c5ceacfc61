package com.trancheledger.reporting;

import com.trancheledger.aggregation.WeeklyIncomeRow;
import com.trancheledger.aggregation.WeeklyIncomeAggregator;
import com.trancheledger.allocation.AllocationResult;
import com.trancheledger.allocation.DistributionAllocator;
import com.trancheledger.domain.model.RawTransactionTable;
import com.trancheledger.domain.model.TransactionEvent;
import com.trancheledger.event.LedgerRunCompletedEvent;
import com.trancheledger.gain.BasisGainCalculator;
import com.trancheledger.gain.PriceLookup;
import com.trancheledger.gain.TrancheSnapshot;
import com.trancheledger.ledger.TrancheLedger;
import com.trancheledger.ledger.TrancheStateMachine;
import com.trancheledger.normalize.NormalizationResult;
import com.trancheledger.normalize.TransactionNormalizer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs the full ledger pipeline over one transaction table: normalize, replay lots, allocate
 * dividends, snapshot basis and gains, aggregate weekly income and summarize per symbol.
 *
 * <p>Every run starts from scratch; no lot or total survives between runs. The only inputs
 * besides the table and prices are the injected clock, which stamps the report and dates the
 * held-day counts, and the week anchor.
 *
 * <p>A missing required column aborts the run with {@link
 * com.trancheledger.exception.MissingColumnException}. Row, lot and dividend problems are
 * reported in {@link LedgerDiagnostics} instead.
 */
@Service
public class TrancheLedgerEngine {

    private static final Logger log = LoggerFactory.getLogger(TrancheLedgerEngine.class);

    private final TransactionNormalizer normalizer;
    private final TrancheStateMachine stateMachine;
    private final DistributionAllocator allocator;
    private final BasisGainCalculator gainCalculator;
    private final WeeklyIncomeAggregator aggregator;
    private final TransactionLogBuilder transactionLogBuilder;
    private final SymbolSummaryCalculator summaryCalculator;
    private final Clock clock;
    private final ApplicationEventPublisher applicationEventPublisher;

    public TrancheLedgerEngine(
            TransactionNormalizer normalizer,
            TrancheStateMachine stateMachine,
            DistributionAllocator allocator,
            BasisGainCalculator gainCalculator,
            WeeklyIncomeAggregator aggregator,
            TransactionLogBuilder transactionLogBuilder,
            SymbolSummaryCalculator summaryCalculator,
            Clock clock,
            ApplicationEventPublisher applicationEventPublisher) {
        this.normalizer = normalizer;
        this.stateMachine = stateMachine;
        this.allocator = allocator;
        this.gainCalculator = gainCalculator;
        this.aggregator = aggregator;
        this.transactionLogBuilder = transactionLogBuilder;
        this.summaryCalculator = summaryCalculator;
        this.clock = clock;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public LedgerReport run(RawTransactionTable table, PriceLookup prices) {
        long started = System.nanoTime();
        Instant generatedAt = clock.instant();
        LocalDate asOfDate = LocalDate.now(clock);

        NormalizationResult normalized = normalizer.normalize(table);
        List<TransactionEvent> events = normalized.getEvents();

        TrancheLedger ledger = stateMachine.replay(events);
        AllocationResult allocation = allocator.allocate(events, ledger);
        List<TrancheSnapshot> snapshots = gainCalculator.snapshots(ledger.getTranches(), prices, asOfDate);
        List<WeeklyIncomeRow> weekly = aggregator.aggregate(allocation.getAllocations());
        List<TransactionLogRow> transactions = transactionLogBuilder.build(events, ledger);
        List<SymbolSummary> symbols = summaryCalculator.summarize(
                snapshots, allocation.getAllocations(), allocation.getUnallocated(), ledger.getFailedSymbols());

        LedgerDiagnostics diagnostics = LedgerDiagnostics.builder()
                .rejectedRows(normalized.getRejections())
                .unallocatedDividends(allocation.getUnallocated())
                .symbolFailures(ledger.getFailures())
                .build();

        LedgerReport report = LedgerReport.builder()
                .generatedAt(generatedAt)
                .asOfDate(asOfDate)
                .transactionCount(events.size())
                .tranches(snapshots)
                .allocations(allocation.getAllocations())
                .weeklyIncome(weekly)
                .transactions(transactions)
                .symbols(symbols)
                .diagnostics(diagnostics)
                .build();

        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        log.info(
                "Ledger run as of {}: {} transactions, {} lots, {} allocations, {} weekly rows, "
                        + "{} rejected rows, {} unallocated dividends, {} failed symbols ({} ms)",
                asOfDate,
                events.size(),
                snapshots.size(),
                allocation.getAllocations().size(),
                weekly.size(),
                diagnostics.getRejectedRowCount(),
                diagnostics.getUnallocatedDividends().size(),
                diagnostics.getSymbolFailures().size(),
                duration.toMillis());

        applicationEventPublisher.publishEvent(new LedgerRunCompletedEvent(this, report, duration));
        return report;
    }
}
