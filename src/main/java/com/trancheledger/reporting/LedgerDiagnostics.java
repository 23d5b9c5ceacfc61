package com.trancheledger.reporting;

import com.trancheledger.allocation.UnallocatedDividend;
import com.trancheledger.ledger.SymbolFailure;
import com.trancheledger.normalize.RowRejection;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a run set aside instead of failing: skipped rows, dividends with no lot to land on,
 * and symbols whose ledger could not be replayed.
 */
@Value
@Builder
public class LedgerDiagnostics {

    List<RowRejection> rejectedRows;
    List<UnallocatedDividend> unallocatedDividends;
    List<SymbolFailure> symbolFailures;

    public int getRejectedRowCount() {
        return rejectedRows.size();
    }

    public boolean isClean() {
        return rejectedRows.isEmpty() && unallocatedDividends.isEmpty() && symbolFailures.isEmpty();
    }
}
