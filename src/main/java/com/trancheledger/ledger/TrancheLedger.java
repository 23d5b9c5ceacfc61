package com.trancheledger.ledger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lot table produced by one replay of the transaction log, keyed by lot id in creation order.
 *
 * <p>Symbols whose replay failed contribute no lots; they are listed in {@link #getFailures()}.
 */
public class TrancheLedger {

    private final Map<String, Tranche> lots = new LinkedHashMap<>();
    private final Map<String, List<Tranche>> lotsBySymbol = new LinkedHashMap<>();
    private final Map<Integer, String> lotIdsByRow = new HashMap<>();
    private final List<SymbolFailure> failures = new ArrayList<>();

    void commit(String symbol, Collection<Tranche> symbolLots, Map<Integer, String> rowLotIds) {
        for (Tranche tranche : symbolLots) {
            lots.put(tranche.getLotId(), tranche);
        }
        lotsBySymbol.put(symbol, List.copyOf(symbolLots));
        lotIdsByRow.putAll(rowLotIds);
    }

    void fail(SymbolFailure failure) {
        failures.add(failure);
    }

    public Collection<Tranche> getTranches() {
        return Collections.unmodifiableCollection(lots.values());
    }

    public Optional<Tranche> find(String lotId) {
        return Optional.ofNullable(lots.get(lotId));
    }

    /** Owning symbol of a committed lot id, if any. */
    Optional<String> ownerOf(String lotId) {
        return find(lotId).map(Tranche::getSymbol);
    }

    /** Lots of a symbol in creation order; empty for unknown or failed symbols. */
    public List<Tranche> lotsFor(String symbol) {
        return lotsBySymbol.getOrDefault(symbol, List.of());
    }

    /** Lot id a Buy or Sell row was attributed to. */
    public Optional<String> lotIdForRow(int rowNumber) {
        return Optional.ofNullable(lotIdsByRow.get(rowNumber));
    }

    public List<SymbolFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public Set<String> getFailedSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        for (SymbolFailure failure : failures) {
            symbols.add(failure.getSymbol());
        }
        return symbols;
    }

    public int size() {
        return lots.size();
    }
}
