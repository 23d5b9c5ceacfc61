package com.trancheledger.gain;

import com.trancheledger.config.LedgerProperties;
import com.trancheledger.domain.enums.ExitReadiness;
import com.trancheledger.domain.enums.TrancheStatus;
import com.trancheledger.ledger.Tranche;
import com.trancheledger.util.Decimals;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Derives basis and gain figures for lots from their ledger state and a current price.
 *
 * <p>Percent-to-exit compares market value with adjusted basis only; income already received is
 * not credited against it. Realized gain uses the last sale price for all sold shares.
 */
@Component
public class BasisGainCalculator {

    private final BigDecimal exitReadyRatio;

    @Autowired
    public BasisGainCalculator(LedgerProperties properties) {
        this(properties.getExitReadyRatio());
    }

    public BasisGainCalculator(BigDecimal exitReadyRatio) {
        this.exitReadyRatio = exitReadyRatio != null ? exitReadyRatio : BigDecimal.ONE;
    }

    public List<TrancheSnapshot> snapshots(Collection<Tranche> tranches, PriceLookup prices, LocalDate today) {
        return tranches.stream().map(t -> snapshot(t, prices, today)).toList();
    }

    public TrancheSnapshot snapshot(Tranche tranche, PriceLookup prices, LocalDate today) {
        BigDecimal costBasis = tranche.getCostBasis();
        BigDecimal cumulativeRoc = tranche.getCumulativeRoc();
        BigDecimal remaining = tranche.getSharesRemaining();
        BigDecimal currentPrice = Decimals.orZero(prices.priceOf(tranche.getSymbol()));

        BigDecimal adjustedBasis = costBasis.subtract(cumulativeRoc);
        BigDecimal marketValue = remaining.multiply(currentPrice);
        BigDecimal averageBuyPrice = tranche.getAverageBuyPrice();

        BigDecimal realizedGain = null;
        if (tranche.getSharesSold().signum() > 0) {
            realizedGain = Decimals.orZero(tranche.getLastSalePrice())
                    .subtract(averageBuyPrice)
                    .multiply(tranche.getSharesSold());
        }

        BigDecimal percentToExit = BigDecimal.ZERO;
        if (adjustedBasis.signum() > 0) {
            percentToExit = Decimals.clamp(
                    Decimals.safeDivide(adjustedBasis.subtract(marketValue), adjustedBasis),
                    BigDecimal.ZERO,
                    BigDecimal.ONE);
        }

        Long heldDays = tranche.getAcquisitionDate() != null
                ? ChronoUnit.DAYS.between(tranche.getAcquisitionDate(), today)
                : null;

        return TrancheSnapshot.builder()
                .lotId(tranche.getLotId())
                .symbol(tranche.getSymbol())
                .acquisitionDate(tranche.getAcquisitionDate())
                .status(tranche.getStatus())
                .sharesBought(tranche.getSharesBought())
                .sharesSold(tranche.getSharesSold())
                .sharesRemaining(remaining)
                .costBasis(costBasis)
                .averageBuyPrice(averageBuyPrice)
                .lastSalePrice(tranche.getLastSalePrice())
                .cumulativeIncome(tranche.getCumulativeIncome())
                .cumulativeRoc(cumulativeRoc)
                .adjustedBasis(adjustedBasis)
                .consumedBasisRatio(Decimals.safeDivide(cumulativeRoc, costBasis))
                .currentPrice(currentPrice)
                .marketValue(marketValue)
                .unrealizedGain(marketValue.subtract(adjustedBasis))
                .realizedGain(realizedGain)
                .percentToExit(percentToExit)
                .heldDays(heldDays)
                .exitReadiness(exitReadiness(tranche.getStatus(), marketValue, adjustedBasis))
                .build();
    }

    private ExitReadiness exitReadiness(TrancheStatus status, BigDecimal marketValue, BigDecimal adjustedBasis) {
        if (status == TrancheStatus.CLOSED) {
            return ExitReadiness.EXITED;
        }
        return marketValue.compareTo(exitReadyRatio.multiply(adjustedBasis)) >= 0
                ? ExitReadiness.READY
                : ExitReadiness.HOLD;
    }
}
