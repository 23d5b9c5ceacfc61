package com.trancheledger.domain.enums;

/**
 * Whether selling a lot now would return its adjusted basis.
 */
public enum ExitReadiness {
    /** Market value has reached the configured share of adjusted basis. */
    READY,

    /** Selling now would lose principal. */
    HOLD,

    /** The lot is closed; nothing left to sell. */
    EXITED
}
