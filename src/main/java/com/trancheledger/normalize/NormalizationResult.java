package com.trancheledger.normalize;

import com.trancheledger.domain.model.TransactionEvent;
import java.util.List;
import lombok.Value;

/** Normalized events in source order plus the rows that were skipped. */
@Value
public class NormalizationResult {

    List<TransactionEvent> events;
    List<RowRejection> rejections;

    public int getRejectedCount() {
        return rejections.size();
    }
}
