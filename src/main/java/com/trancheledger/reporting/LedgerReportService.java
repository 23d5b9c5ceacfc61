package com.trancheledger.reporting;

import com.trancheledger.aggregation.WeeklyIncomeRow;
import com.trancheledger.allocation.DividendAllocation;
import com.trancheledger.domain.enums.TrancheStatus;
import com.trancheledger.exception.ResourceNotFoundException;
import com.trancheledger.gain.TrancheSnapshot;
import com.trancheledger.source.PriceSource;
import com.trancheledger.source.TransactionSource;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;

/**
 * Runs the ledger over the configured transaction and price sources and answers report queries.
 *
 * <p>Each query reads the sources again and recomputes everything; nothing is cached between
 * calls.
 */
@Service
public class LedgerReportService {

    private final TrancheLedgerEngine engine;
    private final TransactionSource transactionSource;
    private final PriceSource priceSource;

    public LedgerReportService(
            TrancheLedgerEngine engine, TransactionSource transactionSource, PriceSource priceSource) {
        this.engine = engine;
        this.transactionSource = transactionSource;
        this.priceSource = priceSource;
    }

    public LedgerReport generate() {
        return engine.run(transactionSource.load(), priceSource.load());
    }

    /**
     * Lot snapshots, optionally narrowed to one status and/or one symbol.
     */
    public List<TrancheSnapshot> getTranches(TrancheStatus status, String symbol) {
        String wanted = normalizeSymbol(symbol);
        return generate().getTranches().stream()
                .filter(t -> status == null || t.getStatus() == status)
                .filter(t -> wanted == null || wanted.equals(t.getSymbol()))
                .toList();
    }

    public TrancheSnapshot getTranche(String lotId) {
        return generate().getTranches().stream()
                .filter(t -> t.getLotId().equals(lotId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Tranche", lotId));
    }

    public List<DividendAllocation> getAllocations(String symbol) {
        String wanted = normalizeSymbol(symbol);
        return generate().getAllocations().stream()
                .filter(a -> wanted == null || wanted.equals(a.getSymbol()))
                .toList();
    }

    public List<WeeklyIncomeRow> getWeeklyIncome(Integer year) {
        return generate().getWeeklyIncome().stream()
                .filter(row -> year == null || row.getYear() == year)
                .toList();
    }

    public List<TransactionLogRow> getTransactions() {
        return generate().getTransactions();
    }

    public List<SymbolSummary> getSymbolSummaries() {
        return generate().getSymbols();
    }

    public LedgerDiagnostics getDiagnostics() {
        return generate().getDiagnostics();
    }

    private static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
