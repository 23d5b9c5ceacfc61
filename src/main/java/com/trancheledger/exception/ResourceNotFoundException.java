package com.trancheledger.exception;

import java.util.Map;

/** A report query named an item (such as a lot id) that the current ledger does not contain. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s %s not found in the current ledger", resourceType, identifier),
                Map.of("resource", resourceType, "identifier", identifier));
    }
}
