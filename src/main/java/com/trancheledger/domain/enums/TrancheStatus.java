package com.trancheledger.domain.enums;

import java.math.BigDecimal;

/**
 * Lifecycle of a lot: OPEN until the first sale, PARTIAL while some shares remain, CLOSED once
 * every bought share has been sold. CLOSED is terminal.
 */
public enum TrancheStatus {
    OPEN,
    PARTIAL,
    CLOSED;

    public static TrancheStatus of(BigDecimal sharesBought, BigDecimal sharesRemaining) {
        if (sharesRemaining.signum() == 0) {
            return CLOSED;
        }
        if (sharesRemaining.compareTo(sharesBought) < 0) {
            return PARTIAL;
        }
        return OPEN;
    }
}
