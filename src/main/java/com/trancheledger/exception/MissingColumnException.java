package com.trancheledger.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Raised when the transaction table lacks one or more required columns.
 *
 * <p>Schema errors abort the whole run: no partial report is produced.
 */
@Getter
public class MissingColumnException extends BaseException {

    private final List<String> missingColumns;

    public MissingColumnException(List<String> missingColumns, List<String> foundHeaders) {
        super(
                ErrorCode.MISSING_COLUMN,
                String.format(
                        "Missing required transaction column(s) %s. Found: %s", missingColumns, foundHeaders),
                Map.of("missingColumns", List.copyOf(missingColumns), "foundHeaders", List.copyOf(foundHeaders)));
        this.missingColumns = List.copyOf(missingColumns);
    }
}
