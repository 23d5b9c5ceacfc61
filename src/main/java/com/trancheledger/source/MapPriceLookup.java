package com.trancheledger.source;

import com.trancheledger.gain.PriceLookup;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fixed symbol-to-price table. Symbols match case-insensitively; unknown symbols price at zero.
 */
public class MapPriceLookup implements PriceLookup {

    private static final MapPriceLookup EMPTY = new MapPriceLookup(Map.of());

    private final Map<String, BigDecimal> prices;

    public MapPriceLookup(Map<String, BigDecimal> prices) {
        Map<String, BigDecimal> copy = new TreeMap<>();
        prices.forEach((symbol, price) -> copy.put(symbol.trim().toUpperCase(Locale.ROOT), price));
        this.prices = Map.copyOf(copy);
    }

    public static MapPriceLookup empty() {
        return EMPTY;
    }

    @Override
    public BigDecimal priceOf(String symbol) {
        if (symbol == null) {
            return BigDecimal.ZERO;
        }
        return prices.getOrDefault(symbol.trim().toUpperCase(Locale.ROOT), BigDecimal.ZERO);
    }
}
