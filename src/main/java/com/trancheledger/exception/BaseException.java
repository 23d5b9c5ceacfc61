package com.trancheledger.exception;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the ledger's exceptions. Each carries an {@link ErrorCode}, which fixes the HTTP status,
 * and a details map rendered into the error response.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    /**
     * Details shared by every replay error: source row, date, symbol and, when known, the lot id.
     * The returned map is mutable so subclasses can add their own entries.
     */
    protected static Map<String, Object> rowContext(int rowNumber, LocalDate date, String symbol, String lotId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("row", rowNumber);
        details.put("date", String.valueOf(date));
        details.put("symbol", symbol);
        if (lotId != null) {
            details.put("lotId", lotId);
        }
        return details;
    }
}
