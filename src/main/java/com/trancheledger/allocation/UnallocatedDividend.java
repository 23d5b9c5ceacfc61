package com.trancheledger.allocation;

import com.trancheledger.domain.enums.UnallocatedReason;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** A dividend that reached no lot. Reported, never silently dropped. */
@Value
@Builder
public class UnallocatedDividend {

    int rowNumber;
    LocalDate date;
    String symbol;

    /**
     * Income the dividend carried that reached no lot. A per-share row has no eligible shares to
     * multiply, so its total is zero and {@code dividendPerShare} keeps the rate it announced.
     */
    BigDecimal distribution;
    BigDecimal taxableIncome;
    BigDecimal roc;
    BigDecimal rocPercent;

    /** Null unless the row gave a per-share amount. */
    BigDecimal dividendPerShare;

    UnallocatedReason reason;
    String message;
}
