package com.trancheledger.normalize;

import com.trancheledger.exception.MalformedRowException;
import lombok.Builder;
import lombok.Value;

/** A source row the normalizer skipped, with the column and rule it failed. */
@Value
@Builder
public class RowRejection {

    int rowNumber;
    String column;
    String rule;
    String message;

    public static RowRejection from(MalformedRowException exception) {
        return RowRejection.builder()
                .rowNumber(exception.getRowNumber())
                .column(exception.getColumn())
                .rule(exception.getRule())
                .message(exception.getMessage())
                .build();
    }
}
