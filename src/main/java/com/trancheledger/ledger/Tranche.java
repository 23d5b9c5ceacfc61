package com.trancheledger.ledger;

import com.trancheledger.domain.enums.TrancheStatus;
import com.trancheledger.util.Decimals;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * A tax lot: one acquisition batch of a symbol tracked separately for basis and allocation.
 *
 * <p>Share counts and cost basis change only through {@link TrancheStateMachine} (package-private
 * mutators). Distribution totals change only through {@link #addDistribution}, which the
 * allocator calls on lots it is handed. Lots are never deleted; a fully sold lot stays CLOSED.
 *
 * <p>Every buy and sell is also kept as a dated share movement so the lot's size on any past
 * date can be reconstructed without replaying the ledger.
 */
@Getter
public class Tranche {

    private final String lotId;
    private final String symbol;

    /** Earliest buy date contributing to the lot. */
    private LocalDate acquisitionDate;

    private BigDecimal sharesBought = BigDecimal.ZERO;

    /** Sum of shares x price over contributing buys. */
    private BigDecimal costBasis = BigDecimal.ZERO;

    private BigDecimal sharesSold = BigDecimal.ZERO;
    private BigDecimal lastSalePrice;

    /** Taxable (non-ROC) distributions allocated to this lot. */
    private BigDecimal cumulativeIncome = BigDecimal.ZERO;

    /** Return of capital allocated to this lot. */
    private BigDecimal cumulativeRoc = BigDecimal.ZERO;

    @Getter(AccessLevel.NONE)
    private final List<ShareMovement> movements = new ArrayList<>();

    Tranche(String lotId, String symbol) {
        this.lotId = lotId;
        this.symbol = symbol;
    }

    void recordBuy(LocalDate date, BigDecimal shares, BigDecimal price) {
        sharesBought = sharesBought.add(shares);
        costBasis = costBasis.add(shares.multiply(price));
        if (acquisitionDate == null || date.isBefore(acquisitionDate)) {
            acquisitionDate = date;
        }
        movements.add(new ShareMovement(date, shares));
    }

    void recordSell(LocalDate date, BigDecimal shares, BigDecimal price) {
        sharesSold = sharesSold.add(shares);
        lastSalePrice = price;
        movements.add(new ShareMovement(date, shares.negate()));
    }

    /**
     * Adds one dividend's share of taxable income and return of capital.
     */
    public void addDistribution(BigDecimal income, BigDecimal roc) {
        cumulativeIncome = cumulativeIncome.add(income);
        cumulativeRoc = cumulativeRoc.add(roc);
    }

    public BigDecimal getSharesRemaining() {
        return sharesBought.subtract(sharesSold);
    }

    public TrancheStatus getStatus() {
        return TrancheStatus.of(sharesBought, getSharesRemaining());
    }

    /** Cost basis divided by shares bought; zero for an empty lot. */
    public BigDecimal getAverageBuyPrice() {
        return Decimals.safeDivide(costBasis, sharesBought);
    }

    /**
     * Shares held on the given date, counting only buys and sells dated on or before it.
     */
    public BigDecimal remainingAsOf(LocalDate date) {
        BigDecimal remaining = BigDecimal.ZERO;
        for (ShareMovement movement : movements) {
            if (!movement.date().isAfter(date)) {
                remaining = remaining.add(movement.delta());
            }
        }
        return remaining;
    }

    /** Shares bought on or before the given date. */
    public BigDecimal boughtAsOf(LocalDate date) {
        BigDecimal bought = BigDecimal.ZERO;
        for (ShareMovement movement : movements) {
            if (movement.delta().signum() > 0 && !movement.date().isAfter(date)) {
                bought = bought.add(movement.delta());
            }
        }
        return bought;
    }

    /** Lot status as it stood on the given date. */
    public TrancheStatus statusAsOf(LocalDate date) {
        return TrancheStatus.of(boughtAsOf(date), remainingAsOf(date));
    }

    private record ShareMovement(LocalDate date, BigDecimal delta) {}
}
