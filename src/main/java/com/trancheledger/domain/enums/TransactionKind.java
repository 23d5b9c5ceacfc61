package com.trancheledger.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Event kind of a transaction row: a purchase, a sale, or a dividend distribution. */
public enum TransactionKind {
    BUY,
    SELL,
    DIVIDEND;

    /**
     * Parses a source label case-insensitively. Dividends also accept "div" and "distribution".
     * Returns empty for blank or unrecognised labels.
     */
    public static Optional<TransactionKind> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "buy" -> Optional.of(BUY);
            case "sell" -> Optional.of(SELL);
            case "dividend", "div", "distribution" -> Optional.of(DIVIDEND);
            default -> Optional.empty();
        };
    }
}
