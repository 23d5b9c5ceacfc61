package com.trancheledger.ledger;

import com.trancheledger.domain.enums.TrancheStatus;
import com.trancheledger.domain.model.TransactionEvent;
import com.trancheledger.exception.BaseException;
import com.trancheledger.exception.ClosedLotException;
import com.trancheledger.exception.LotConflictException;
import com.trancheledger.exception.OverSellException;
import com.trancheledger.exception.UnknownLotException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rebuilds per-lot state from Buy and Sell events.
 *
 * <p>Each symbol is replayed on its own in ascending date order, ties broken by source row. A
 * symbol whose replay hits an unknown lot, an over-sell, a lot id clash or a buy into a closed lot
 * is dropped as a whole: none of its lots reach the ledger, and a {@link SymbolFailure} records
 * why. Other symbols are unaffected.
 */
@Component
public class TrancheStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TrancheStateMachine.class);

    static final Comparator<TransactionEvent> PROCESSING_ORDER =
            Comparator.comparing(TransactionEvent::getDate).thenComparingInt(TransactionEvent::getRowNumber);

    public TrancheLedger replay(List<TransactionEvent> events) {
        Map<String, List<TransactionEvent>> bySymbol = new TreeMap<>();
        for (TransactionEvent event : events) {
            if (event.isBuy() || event.isSell()) {
                bySymbol.computeIfAbsent(event.getSymbol(), s -> new ArrayList<>()).add(event);
            }
        }

        TrancheLedger ledger = new TrancheLedger();
        LotIdAssigner assigner = new LotIdAssigner();
        for (Map.Entry<String, List<TransactionEvent>> entry : bySymbol.entrySet()) {
            String symbol = entry.getKey();
            List<TransactionEvent> symbolEvents = new ArrayList<>(entry.getValue());
            symbolEvents.sort(PROCESSING_ORDER);
            try {
                replaySymbol(symbol, symbolEvents, ledger, assigner);
            } catch (UnknownLotException | OverSellException | LotConflictException | ClosedLotException e) {
                log.error("Ledger for {} discarded: {}", symbol, e.getMessage());
                ledger.fail(toFailure(symbol, e));
            }
        }

        log.info(
                "Replayed {} symbols into {} lots ({} symbols failed)",
                bySymbol.size(),
                ledger.size(),
                ledger.getFailures().size());
        return ledger;
    }

    private void replaySymbol(
            String symbol, List<TransactionEvent> events, TrancheLedger ledger, LotIdAssigner assigner) {
        Map<String, Tranche> lots = new LinkedHashMap<>();
        Map<Integer, String> rowLotIds = new HashMap<>();
        String lastBuyLotId = null;

        for (TransactionEvent event : events) {
            if (event.isBuy()) {
                String lotId = buyLotId(event, lots, ledger, assigner);
                Tranche existing = lots.get(lotId);
                if (existing != null && existing.getStatus() == TrancheStatus.CLOSED) {
                    throw new ClosedLotException(event.getRowNumber(), event.getDate(), symbol, lotId);
                }
                Tranche tranche = lots.computeIfAbsent(lotId, id -> new Tranche(id, symbol));
                tranche.recordBuy(event.getDate(), event.getShares(), event.getPrice());
                rowLotIds.put(event.getRowNumber(), lotId);
                lastBuyLotId = lotId;
                log.debug("Row {}: buy {} {} into {}", event.getRowNumber(), event.getShares(), symbol, lotId);
            } else {
                String lotId = event.hasLotIdOverride() ? event.getLotIdOverride() : lastBuyLotId;
                Tranche tranche = lotId != null ? lots.get(lotId) : null;
                if (tranche == null) {
                    throw new UnknownLotException(event.getRowNumber(), event.getDate(), symbol, lotId);
                }
                if (event.getShares().compareTo(tranche.getSharesRemaining()) > 0) {
                    throw new OverSellException(
                            event.getRowNumber(),
                            event.getDate(),
                            symbol,
                            lotId,
                            event.getShares(),
                            tranche.getSharesRemaining());
                }
                tranche.recordSell(event.getDate(), event.getShares(), event.getPrice());
                rowLotIds.put(event.getRowNumber(), lotId);
                log.debug("Row {}: sell {} {} from {}", event.getRowNumber(), event.getShares(), symbol, lotId);
            }
        }

        ledger.commit(symbol, lots.values(), rowLotIds);
    }

    private String buyLotId(
            TransactionEvent event, Map<String, Tranche> lots, TrancheLedger ledger, LotIdAssigner assigner) {
        if (event.hasLotIdOverride()) {
            String lotId = event.getLotIdOverride();
            Optional<String> owner = ledger.ownerOf(lotId);
            if (owner.isPresent()) {
                throw new LotConflictException(
                        event.getRowNumber(), event.getDate(), event.getSymbol(), lotId, owner.get());
            }
            return lotId;
        }
        return assigner.next(
                event.getSymbol(),
                event.getDate(),
                id -> lots.containsKey(id) || ledger.find(id).isPresent());
    }

    private SymbolFailure toFailure(String symbol, BaseException e) {
        return SymbolFailure.builder()
                .symbol(symbol)
                .errorCode(e.getErrorCode().getCode())
                .message(e.getMessage())
                .details(e.getDetails())
                .build();
    }
}
