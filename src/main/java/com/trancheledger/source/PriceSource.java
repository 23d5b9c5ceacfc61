package com.trancheledger.source;

import com.trancheledger.gain.PriceLookup;

/** Supplies the current-price table for one ledger run. */
public interface PriceSource {

    PriceLookup load();
}
