package com.trancheledger.gain;

import java.math.BigDecimal;

/**
 * Current market price per symbol. Implementations return zero for symbols they do not know.
 */
@FunctionalInterface
public interface PriceLookup {

    BigDecimal priceOf(String symbol);
}
