package com.trancheledger.reporting;

import com.trancheledger.aggregation.WeeklyIncomeRow;
import com.trancheledger.allocation.DividendAllocation;
import com.trancheledger.gain.TrancheSnapshot;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Output of one full ledger run. Apart from {@code generatedAt}, two runs over the same input
 * with the same as-of date are equal.
 */
@Value
@Builder
public class LedgerReport {

    Instant generatedAt;
    LocalDate asOfDate;
    int transactionCount;

    List<TrancheSnapshot> tranches;
    List<DividendAllocation> allocations;
    List<WeeklyIncomeRow> weeklyIncome;
    List<TransactionLogRow> transactions;
    List<SymbolSummary> symbols;
    LedgerDiagnostics diagnostics;
}
