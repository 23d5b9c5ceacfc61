package com.trancheledger.exception;

import java.util.Map;

/**
 * The transaction or price source could not be read.
 */
public class LedgerSourceException extends BaseException {

    public LedgerSourceException(String message, String location, Throwable cause) {
        super(ErrorCode.SOURCE_UNAVAILABLE, message, Map.of("location", location), cause);
    }
}
