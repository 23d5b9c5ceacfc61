package com.trancheledger.api.controller;

import com.trancheledger.aggregation.WeeklyIncomeRow;
import com.trancheledger.allocation.DividendAllocation;
import com.trancheledger.domain.enums.TrancheStatus;
import com.trancheledger.gain.TrancheSnapshot;
import com.trancheledger.reporting.LedgerDiagnostics;
import com.trancheledger.reporting.LedgerReport;
import com.trancheledger.reporting.LedgerReportService;
import com.trancheledger.reporting.SymbolSummary;
import com.trancheledger.reporting.TransactionLogRow;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only REST API over the ledger. Every call recomputes the report from the configured
 * sources.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/reports/ledger} -- full report</li>
 *   <li>{@code GET /api/reports/tranches} -- lot snapshots, optional status and symbol filters</li>
 *   <li>{@code GET /api/reports/tranches/{lotId}} -- one lot snapshot</li>
 *   <li>{@code GET /api/reports/allocations} -- per-dividend, per-lot allocations</li>
 *   <li>{@code GET /api/reports/weekly-income} -- weekly and YTD income rows</li>
 *   <li>{@code GET /api/reports/transactions} -- annotated transaction log</li>
 *   <li>{@code GET /api/reports/symbols} -- per-symbol summary</li>
 *   <li>{@code GET /api/reports/diagnostics} -- rejected rows, unallocated dividends, failed symbols</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/reports")
public class ReportsController {

    private final LedgerReportService ledgerReportService;

    public ReportsController(LedgerReportService ledgerReportService) {
        this.ledgerReportService = ledgerReportService;
    }

    @GetMapping("/ledger")
    public LedgerReport getLedger() {
        return ledgerReportService.generate();
    }

    @GetMapping("/tranches")
    public List<TrancheSnapshot> getTranches(
            @RequestParam(required = false) TrancheStatus status, @RequestParam(required = false) String symbol) {
        return ledgerReportService.getTranches(status, symbol);
    }

    @GetMapping("/tranches/{lotId}")
    public TrancheSnapshot getTranche(@PathVariable String lotId) {
        return ledgerReportService.getTranche(lotId);
    }

    @GetMapping("/allocations")
    public List<DividendAllocation> getAllocations(@RequestParam(required = false) String symbol) {
        return ledgerReportService.getAllocations(symbol);
    }

    @GetMapping("/weekly-income")
    public List<WeeklyIncomeRow> getWeeklyIncome(@RequestParam(required = false) Integer year) {
        return ledgerReportService.getWeeklyIncome(year);
    }

    @GetMapping("/transactions")
    public List<TransactionLogRow> getTransactions() {
        return ledgerReportService.getTransactions();
    }

    @GetMapping("/symbols")
    public List<SymbolSummary> getSymbols() {
        return ledgerReportService.getSymbolSummaries();
    }

    @GetMapping("/diagnostics")
    public LedgerDiagnostics getDiagnostics() {
        return ledgerReportService.getDiagnostics();
    }
}
