package com.trancheledger.ledger;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Derives lot ids of the form {@code SYMBOL_yyMMdd_X} for buys without an override.
 *
 * <p>The suffix runs A..Z, AA, AB, ... per (symbol, date) so several same-day buys get distinct
 * lots. Ids already taken (for example by an explicit override) are skipped. One assigner
 * belongs to one ledger replay.
 */
class LotIdAssigner {

    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.ofPattern("yyMMdd");

    private final Map<SymbolDate, Integer> sequences = new HashMap<>();

    String next(String symbol, LocalDate date, Predicate<String> taken) {
        SymbolDate key = new SymbolDate(symbol, date);
        String prefix = symbol + "_" + date.format(COMPACT_DATE) + "_";
        int sequence = sequences.getOrDefault(key, 0);
        String lotId = prefix + suffix(sequence);
        while (taken.test(lotId)) {
            sequence++;
            lotId = prefix + suffix(sequence);
        }
        sequences.put(key, sequence + 1);
        return lotId;
    }

    /** 0 -> A, 25 -> Z, 26 -> AA, spreadsheet-column style. */
    static String suffix(int sequence) {
        StringBuilder letters = new StringBuilder();
        int n = sequence;
        do {
            letters.insert(0, (char) ('A' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return letters.toString();
    }

    private record SymbolDate(String symbol, LocalDate date) {}
}
