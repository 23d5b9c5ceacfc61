package com.trancheledger.normalize;

import java.util.List;
import lombok.Getter;

/**
 * Canonical transaction columns and the header spellings accepted for each, in priority order.
 */
@Getter
public enum TransactionField {
    KIND("Type", List.of("Type", "Kind", "TxType", "Action")),
    DATE("Date", List.of("Date", "TradeDate", "DistDt", "DivDt")),
    SYMBOL("Sym", List.of("Sym", "Symbol", "Ticker")),
    SHARES("Shr", List.of("Shr", "Shares", "Qty", "Quantity")),
    PRICE("Price", List.of("Price", "Px")),
    DIVIDEND_TOTAL("Dist", List.of("Dist", "DivTotal", "DistTotal", "Dividend", "TotInc")),
    DIVIDEND_PER_SHARE("DistPS", List.of("DistPS", "DivPS", "DividendPerShare")),
    ROC_PERCENT("RocPct", List.of("RocPct", "RocPercent")),
    ROC_AMOUNT("ROCAmt", List.of("ROCAmt", "RocAmount")),
    LOT_ID_OVERRIDE("TIDOverride", List.of("TIDOverride", "TrID", "TrancheID", "LotId")),
    TAXABLE_INCOME("Inc", List.of("Inc", "TaxInc", "TaxableIncome"));

    private final String label;
    private final List<String> synonyms;

    TransactionField(String label, List<String> synonyms) {
        this.label = label;
        this.synonyms = synonyms;
    }
}
