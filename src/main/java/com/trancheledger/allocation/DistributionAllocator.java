package com.trancheledger.allocation;

import com.trancheledger.aggregation.WeekStartResolver;
import com.trancheledger.domain.enums.UnallocatedReason;
import com.trancheledger.domain.model.TransactionEvent;
import com.trancheledger.ledger.Tranche;
import com.trancheledger.ledger.TrancheLedger;
import com.trancheledger.util.Decimals;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits each dividend across the lots of its symbol that were open on the distribution date.
 *
 * <p>A lot's weight is its shares held on the date divided by the shares held across all open
 * lots. Only buys and sells dated on or before the distribution date count, so a lot bought
 * after the date or closed before it receives nothing. The last lot in the open set takes the
 * rounding remainder, so the per-lot amounts add up to the dividend exactly.
 *
 * <p>Lots are never created or resized here; only their cumulative income and ROC change.
 */
@Component
@RequiredArgsConstructor
public class DistributionAllocator {

    private static final Logger log = LoggerFactory.getLogger(DistributionAllocator.class);

    private static final Comparator<TransactionEvent> DIVIDEND_ORDER =
            Comparator.comparing(TransactionEvent::getDate).thenComparingInt(TransactionEvent::getRowNumber);

    private final WeekStartResolver weekStartResolver;

    public AllocationResult allocate(List<TransactionEvent> events, TrancheLedger ledger) {
        Set<String> failedSymbols = ledger.getFailedSymbols();
        List<TransactionEvent> dividends = events.stream()
                .filter(TransactionEvent::isDividend)
                .sorted(DIVIDEND_ORDER)
                .toList();

        List<DividendAllocation> allocations = new ArrayList<>();
        List<UnallocatedDividend> unallocated = new ArrayList<>();

        for (TransactionEvent dividend : dividends) {
            if (failedSymbols.contains(dividend.getSymbol())) {
                unallocated.add(unallocated(
                        dividend,
                        UnallocatedReason.SYMBOL_LEDGER_FAILED,
                        "ledger for " + dividend.getSymbol() + " failed to replay"));
                continue;
            }

            List<Tranche> open = openLots(ledger.lotsFor(dividend.getSymbol()), dividend.getDate());
            if (open.isEmpty()) {
                unallocated.add(unallocated(
                        dividend,
                        UnallocatedReason.NO_OPEN_LOTS,
                        "no lots of " + dividend.getSymbol() + " held on " + dividend.getDate()));
                continue;
            }

            allocations.addAll(allocateOne(dividend, open));
        }

        log.info(
                "Allocated {} dividends into {} lot allocations ({} unallocated)",
                dividends.size() - unallocated.size(),
                allocations.size(),
                unallocated.size());
        return new AllocationResult(allocations, unallocated);
    }

    private List<Tranche> openLots(List<Tranche> lots, LocalDate date) {
        List<Tranche> open = new ArrayList<>();
        for (Tranche tranche : lots) {
            if (tranche.remainingAsOf(date).signum() > 0) {
                open.add(tranche);
            }
        }
        return open;
    }

    private List<DividendAllocation> allocateOne(TransactionEvent dividend, List<Tranche> open) {
        LocalDate date = dividend.getDate();
        BigDecimal eligible = BigDecimal.ZERO;
        for (Tranche tranche : open) {
            eligible = eligible.add(tranche.remainingAsOf(date));
        }

        DividendAmounts amounts = DividendAmounts.resolve(dividend, eligible);
        BigDecimal distributionPerShare = amounts.perShare(amounts.getTotal(), eligible);
        BigDecimal taxablePerShare = amounts.perShare(amounts.getTaxable(), eligible);
        BigDecimal rocPerShare = amounts.perShare(amounts.getRoc(), eligible);
        LocalDate weekStart = weekStartResolver.weekStart(date);

        BigDecimal distributionLeft = amounts.getTotal();
        BigDecimal taxableLeft = amounts.getTaxable();
        BigDecimal rocLeft = amounts.getRoc();

        List<DividendAllocation> rows = new ArrayList<>(open.size());
        for (int i = 0; i < open.size(); i++) {
            Tranche tranche = open.get(i);
            BigDecimal held = tranche.remainingAsOf(date);

            BigDecimal distribution;
            BigDecimal taxable;
            BigDecimal roc;
            if (i == open.size() - 1) {
                distribution = distributionLeft;
                taxable = taxableLeft;
                roc = rocLeft;
            } else {
                distribution = share(amounts.getTotal(), held, eligible);
                taxable = share(amounts.getTaxable(), held, eligible);
                roc = share(amounts.getRoc(), held, eligible);
                distributionLeft = distributionLeft.subtract(distribution);
                taxableLeft = taxableLeft.subtract(taxable);
                rocLeft = rocLeft.subtract(roc);
            }

            tranche.addDistribution(taxable, roc);
            log.debug(
                    "Row {}: {} gets {} of {} ({} ROC)",
                    dividend.getRowNumber(),
                    tranche.getLotId(),
                    distribution,
                    amounts.getTotal(),
                    roc);

            rows.add(DividendAllocation.builder()
                    .rowNumber(dividend.getRowNumber())
                    .date(date)
                    .weekStart(weekStart)
                    .symbol(dividend.getSymbol())
                    .lotId(tranche.getLotId())
                    .sharesEligible(held)
                    .lotSharesBought(tranche.boughtAsOf(date))
                    .lotCostBasis(tranche.getCostBasis())
                    .lotStatus(tranche.statusAsOf(date))
                    .distributionPerShare(distributionPerShare)
                    .taxablePerShare(taxablePerShare)
                    .rocPerShare(rocPerShare)
                    .distribution(distribution)
                    .taxableIncome(taxable)
                    .roc(roc)
                    .rocPercent(amounts.getRocPercent())
                    .build());
        }
        return rows;
    }

    /** amount x held / eligible, the lot's pro-rata share. */
    private static BigDecimal share(BigDecimal amount, BigDecimal held, BigDecimal eligible) {
        return Decimals.safeDivide(amount.multiply(held), eligible);
    }

    private UnallocatedDividend unallocated(TransactionEvent dividend, UnallocatedReason reason, String message) {
        DividendAmounts amounts = DividendAmounts.resolve(dividend, BigDecimal.ZERO);
        log.warn("Row {} ({}): dividend of {} not allocated ({} income, {} ROC), {}",
                dividend.getRowNumber(),
                dividend.getDate(),
                dividend.getSymbol(),
                amounts.getTaxable(),
                amounts.getRoc(),
                message);
        return UnallocatedDividend.builder()
                .rowNumber(dividend.getRowNumber())
                .date(dividend.getDate())
                .symbol(dividend.getSymbol())
                .distribution(amounts.getTotal())
                .taxableIncome(amounts.getTaxable())
                .roc(amounts.getRoc())
                .rocPercent(amounts.getRocPercent())
                .dividendPerShare(dividend.getDividendPerShare())
                .reason(reason)
                .message(message)
                .build();
    }
}
