package com.trancheledger.source;

import com.trancheledger.domain.model.RawTransactionTable;

/** Supplies the transaction log for one ledger run. */
public interface TransactionSource {

    RawTransactionTable load();
}
