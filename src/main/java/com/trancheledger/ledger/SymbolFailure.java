package com.trancheledger.ledger;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** A symbol whose ledger could not be replayed. Its lots are left out of the run. */
@Value
@Builder
public class SymbolFailure {

    String symbol;
    String errorCode;
    String message;
    Map<String, Object> details;
}
