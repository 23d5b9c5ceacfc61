package com.trancheledger.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * Untyped transaction rows as read from the source: one header row plus data rows of strings.
 */
@Value
public class RawTransactionTable {

    List<String> headers;
    List<RawRow> rows;

    public static RawTransactionTable of(List<String> headers, List<List<String>> cells) {
        List<RawRow> rows = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            rows.add(new RawRow(i + 1, Collections.unmodifiableList(new ArrayList<>(cells.get(i)))));
        }
        return new RawTransactionTable(
                Collections.unmodifiableList(new ArrayList<>(headers)), Collections.unmodifiableList(rows));
    }

    /**
     * One data row with its 1-based position in the source (header excluded).
     */
    @Value
    public static class RawRow {

        int rowNumber;
        List<String> cells;

        /** Returns the cell at the index, or null when the index is absent or beyond the row. */
        public String cell(Integer index) {
            if (index == null || index < 0 || index >= cells.size()) {
                return null;
            }
            return cells.get(index);
        }

        public boolean isBlank() {
            return cells.stream().allMatch(c -> c == null || c.isBlank());
        }
    }
}
