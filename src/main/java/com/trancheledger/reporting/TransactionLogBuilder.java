package com.trancheledger.reporting;

import com.trancheledger.aggregation.WeekStartResolver;
import com.trancheledger.allocation.DividendAmounts;
import com.trancheledger.domain.model.TransactionEvent;
import com.trancheledger.ledger.Tranche;
import com.trancheledger.ledger.TrancheLedger;
import com.trancheledger.util.Decimals;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Annotates every normalized transaction with its week, lot and running holding.
 *
 * <p>Running shares are accumulated per symbol in date order (ties by row) and the rows are then
 * returned in source order.
 */
@Component
@RequiredArgsConstructor
public class TransactionLogBuilder {

    private static final Comparator<TransactionEvent> PROCESSING_ORDER =
            Comparator.comparing(TransactionEvent::getDate).thenComparingInt(TransactionEvent::getRowNumber);

    private final WeekStartResolver weekStartResolver;

    public List<TransactionLogRow> build(List<TransactionEvent> events, TrancheLedger ledger) {
        List<TransactionEvent> ordered = new ArrayList<>(events);
        ordered.sort(PROCESSING_ORDER);

        Map<String, BigDecimal> holdings = new HashMap<>();
        Map<Integer, TransactionLogRow> rowsByNumber = new HashMap<>();
        for (TransactionEvent event : ordered) {
            BigDecimal held = holdings.getOrDefault(event.getSymbol(), BigDecimal.ZERO);
            if (event.isBuy()) {
                held = held.add(event.getShares());
            } else if (event.isSell()) {
                held = held.subtract(event.getShares());
            }
            holdings.put(event.getSymbol(), held);
            rowsByNumber.put(event.getRowNumber(), annotate(event, held, ledger));
        }

        List<TransactionLogRow> rows = new ArrayList<>(events.size());
        for (TransactionEvent event : events) {
            rows.add(rowsByNumber.get(event.getRowNumber()));
        }
        return rows;
    }

    private TransactionLogRow annotate(TransactionEvent event, BigDecimal runningShares, TrancheLedger ledger) {
        TransactionLogRow.TransactionLogRowBuilder row = TransactionLogRow.builder()
                .rowNumber(event.getRowNumber())
                .kind(event.getKind())
                .date(event.getDate())
                .weekStart(weekStartResolver.weekStart(event.getDate()))
                .symbol(event.getSymbol())
                .runningShares(runningShares);

        if (event.isDividend()) {
            DividendAmounts amounts = DividendAmounts.resolve(event, runningShares);
            return row.distribution(amounts.getTotal())
                    .taxableIncome(amounts.getTaxable())
                    .roc(amounts.getRoc())
                    .rocPercent(amounts.getRocPercent())
                    .distributionPerShare(Decimals.safeDivide(amounts.getTotal(), runningShares))
                    .taxablePerShare(Decimals.safeDivide(amounts.getTaxable(), runningShares))
                    .rocPerShare(Decimals.safeDivide(amounts.getRoc(), runningShares))
                    .build();
        }

        row.shares(event.getShares()).price(event.getPrice());
        if (event.isBuy()) {
            row.buyCost(event.getShares().multiply(event.getPrice()));
        }
        Optional<Tranche> lot = ledger.lotIdForRow(event.getRowNumber()).flatMap(ledger::find);
        lot.ifPresent(tranche -> row.lotId(tranche.getLotId())
                .lotSharesRemaining(tranche.remainingAsOf(event.getDate()))
                .lotStatus(tranche.statusAsOf(event.getDate())));
        return row.build();
    }
}
