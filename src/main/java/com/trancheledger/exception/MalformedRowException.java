package com.trancheledger.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * A single transaction row failed a parsing or validation rule.
 *
 * <p>Recoverable: the normalizer skips the row, records it, and continues with the next one.
 */
@Getter
public class MalformedRowException extends BaseException {

    private final int rowNumber;
    private final String column;
    private final String rule;

    public MalformedRowException(int rowNumber, String column, String rule) {
        super(
                ErrorCode.MALFORMED_ROW,
                String.format("Row %d, column %s: %s", rowNumber, column, rule),
                details(rowNumber, column, rule));
        this.rowNumber = rowNumber;
        this.column = column;
        this.rule = rule;
    }

    private static Map<String, Object> details(int rowNumber, String column, String rule) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("row", rowNumber);
        details.put("column", column);
        details.put("rule", rule);
        return details;
    }
}
