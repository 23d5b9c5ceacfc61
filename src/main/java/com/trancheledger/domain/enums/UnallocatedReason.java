package com.trancheledger.domain.enums;

/** Why a dividend event contributed nothing to any lot. */
public enum UnallocatedReason {
    NO_OPEN_LOTS,
    SYMBOL_LEDGER_FAILED
}
