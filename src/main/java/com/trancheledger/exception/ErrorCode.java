package com.trancheledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    MISSING_COLUMN("MISSING_COLUMN", 422),
    MALFORMED_ROW("MALFORMED_ROW", 422),
    UNKNOWN_LOT("UNKNOWN_LOT", 422),
    OVER_SELL("OVER_SELL", 422),
    LOT_CONFLICT("LOT_CONFLICT", 422),
    CLOSED_LOT("CLOSED_LOT", 422),
    SOURCE_UNAVAILABLE("SOURCE_UNAVAILABLE", 503),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
