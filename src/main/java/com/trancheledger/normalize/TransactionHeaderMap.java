package com.trancheledger.normalize;

import com.trancheledger.exception.MissingColumnException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves canonical transaction fields to column indices of a source header row.
 *
 * <p>Matching ignores case, whitespace, underscores and hyphens, so "Tranche ID", "tranche_id"
 * and "TrancheID" are the same header. When several synonyms are present, the earliest synonym
 * in {@link TransactionField#getSynonyms()} wins.
 *
 * <p>Resolution is fail-fast: every missing requirement is collected and reported in one
 * {@link MissingColumnException}.
 */
public final class TransactionHeaderMap {

    private final Map<TransactionField, Integer> indices;
    private final List<String> headers;

    private TransactionHeaderMap(Map<TransactionField, Integer> indices, List<String> headers) {
        this.indices = indices;
        this.headers = headers;
    }

    public static TransactionHeaderMap resolve(List<String> headers) {
        Map<String, Integer> byKey = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String key = key(headers.get(i));
            if (!key.isEmpty()) {
                byKey.putIfAbsent(key, i);
            }
        }

        Map<TransactionField, Integer> indices = new EnumMap<>(TransactionField.class);
        for (TransactionField field : TransactionField.values()) {
            for (String synonym : field.getSynonyms()) {
                Integer index = byKey.get(key(synonym));
                if (index != null) {
                    indices.put(field, index);
                    break;
                }
            }
        }

        List<String> missing = new ArrayList<>();
        for (TransactionField field : List.of(
                TransactionField.KIND,
                TransactionField.DATE,
                TransactionField.SYMBOL,
                TransactionField.SHARES,
                TransactionField.PRICE)) {
            if (!indices.containsKey(field)) {
                missing.add(field.getLabel());
            }
        }
        if (!indices.containsKey(TransactionField.DIVIDEND_TOTAL)
                && !indices.containsKey(TransactionField.DIVIDEND_PER_SHARE)) {
            missing.add(TransactionField.DIVIDEND_TOTAL.getLabel() + " or "
                    + TransactionField.DIVIDEND_PER_SHARE.getLabel());
        }
        if (!indices.containsKey(TransactionField.ROC_PERCENT) && !indices.containsKey(TransactionField.ROC_AMOUNT)) {
            missing.add(TransactionField.ROC_PERCENT.getLabel() + " or " + TransactionField.ROC_AMOUNT.getLabel());
        }
        if (!missing.isEmpty()) {
            throw new MissingColumnException(missing, headers);
        }
        return new TransactionHeaderMap(indices, Collections.unmodifiableList(new ArrayList<>(headers)));
    }

    /** Column index of the field, or null when the optional column is absent. */
    public Integer indexOf(TransactionField field) {
        return indices.get(field);
    }

    public boolean has(TransactionField field) {
        return indices.containsKey(field);
    }

    /** Header text as it appears in the source, falling back to the canonical label. */
    public String headerName(TransactionField field) {
        Integer index = indices.get(field);
        if (index == null) {
            return field.getLabel();
        }
        String header = headers.get(index);
        return header != null ? header.trim() : field.getLabel();
    }

    private static String key(String header) {
        if (header == null) {
            return "";
        }
        return header.replaceAll("[\\s_\\-]", "").toLowerCase(Locale.ROOT);
    }
}
