package com.trancheledger.domain.model;

import com.trancheledger.domain.enums.TransactionKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A normalized transaction row. Created once by the normalizer and never mutated.
 *
 * <p>Buy and Sell events carry shares, price, and an optional lot id override. Dividend events
 * carry either a total or a per-share amount, either an ROC percent or an ROC amount, and an
 * optional explicit taxable-income figure. Fields that do not apply to the kind are null.
 */
@Value
@Builder
public class TransactionEvent {

    /** 1-based row number in the source table, header excluded. Used as the tie-breaker. */
    int rowNumber;

    TransactionKind kind;
    LocalDate date;
    String symbol;

    BigDecimal shares;
    BigDecimal price;
    String lotIdOverride;

    BigDecimal dividendTotal;
    BigDecimal dividendPerShare;

    /** Fraction in [0, 1]. */
    BigDecimal rocPercent;

    BigDecimal rocAmount;
    BigDecimal taxableIncome;

    public boolean isBuy() {
        return kind == TransactionKind.BUY;
    }

    public boolean isSell() {
        return kind == TransactionKind.SELL;
    }

    public boolean isDividend() {
        return kind == TransactionKind.DIVIDEND;
    }

    public boolean hasLotIdOverride() {
        return lotIdOverride != null && !lotIdOverride.isBlank();
    }
}
