package com.trancheledger.unit.gain;

import static com.trancheledger.unit.TransactionFixtures.buy;
import static com.trancheledger.unit.TransactionFixtures.dividend;
import static com.trancheledger.unit.TransactionFixtures.sell;
import static org.assertj.core.api.Assertions.assertThat;

import com.trancheledger.aggregation.WeekStartResolver;
import com.trancheledger.allocation.DistributionAllocator;
import com.trancheledger.domain.enums.ExitReadiness;
import com.trancheledger.domain.enums.TrancheStatus;
import com.trancheledger.domain.model.TransactionEvent;
import com.trancheledger.gain.BasisGainCalculator;
import com.trancheledger.gain.PriceLookup;
import com.trancheledger.gain.TrancheSnapshot;
import com.trancheledger.ledger.TrancheLedger;
import com.trancheledger.ledger.TrancheStateMachine;
import com.trancheledger.source.MapPriceLookup;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for BasisGainCalculator.
 *
 * <p>Verifies: adjusted basis after ROC, zero-basis safety, realized and unrealized gain,
 * percent-to-exit clamping, held days, and exit readiness.
 */
class BasisGainCalculatorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 1);

    private TrancheStateMachine stateMachine;
    private DistributionAllocator allocator;
    private BasisGainCalculator calculator;

    @BeforeEach
    void setUp() {
        stateMachine = new TrancheStateMachine();
        allocator = new DistributionAllocator(new WeekStartResolver(DayOfWeek.MONDAY));
        calculator = new BasisGainCalculator(BigDecimal.ONE);
    }

    private TrancheSnapshot snapshotOf(List<TransactionEvent> events, String lotId, PriceLookup prices) {
        TrancheLedger ledger = stateMachine.replay(events);
        allocator.allocate(events, ledger);
        return calculator.snapshot(ledger.find(lotId).orElseThrow(), prices, TODAY);
    }

    @Test
    @DisplayName("ROC reduces the basis: $1000 cost less $20 ROC is $980")
    void adjustedBasisAfterRoc() {
        TrancheSnapshot snapshot = snapshotOf(
                List.of(buy(1, "2024-01-01", "ABC", "100", "10"), dividend(2, "2024-01-08", "ABC", "50", "0.4")),
                "ABC_240101_A",
                symbol -> new BigDecimal("9.50"));

        assertThat(snapshot.getCostBasis()).isEqualByComparingTo("1000");
        assertThat(snapshot.getCumulativeRoc()).isEqualByComparingTo("20");
        assertThat(snapshot.getCumulativeIncome()).isEqualByComparingTo("30");
        assertThat(snapshot.getAdjustedBasis()).isEqualByComparingTo("980");
        assertThat(snapshot.getConsumedBasisRatio()).isEqualByComparingTo("0.02");
        assertThat(snapshot.getMarketValue()).isEqualByComparingTo("950");
        assertThat(snapshot.getUnrealizedGain()).isEqualByComparingTo("-30");
        // (980 - 950) / 980
        assertThat(snapshot.getPercentToExit()).isEqualByComparingTo("0.0306122449");
        assertThat(snapshot.getExitReadiness()).isEqualTo(ExitReadiness.HOLD);
        assertThat(snapshot.getRealizedGain()).isNull();
        assertThat(snapshot.getHeldDays()).isEqualTo(60L);
    }

    @Test
    @DisplayName("Free shares report a zero consumed-basis ratio instead of dividing by zero")
    void zeroCostBasis() {
        TrancheSnapshot snapshot = snapshotOf(
                List.of(buy(1, "2024-01-01", "ABC", "10", "0"), dividend(2, "2024-01-08", "ABC", "5", "1")),
                "ABC_240101_A",
                symbol -> new BigDecimal("3"));

        assertThat(snapshot.getCostBasis()).isEqualByComparingTo("0");
        assertThat(snapshot.getConsumedBasisRatio()).isEqualByComparingTo("0");
        assertThat(snapshot.getAverageBuyPrice()).isEqualByComparingTo("0");
        assertThat(snapshot.getAdjustedBasis()).isEqualByComparingTo("-5");
        assertThat(snapshot.getPercentToExit()).isEqualByComparingTo("0");
        assertThat(snapshot.getExitReadiness()).isEqualTo(ExitReadiness.READY);
    }

    @Test
    @DisplayName("Realized gain uses the last sale price against the average buy price")
    void realizedGain() {
        TrancheSnapshot snapshot = snapshotOf(
                List.of(
                        buy(1, "2024-01-01", "ABC", "100", "10", "L"),
                        buy(2, "2024-01-02", "ABC", "100", "12", "L"),
                        sell(3, "2024-02-01", "ABC", "50", "14", "L")),
                "L",
                new MapPriceLookup(Map.of("ABC", new BigDecimal("13"))));

        assertThat(snapshot.getStatus()).isEqualTo(TrancheStatus.PARTIAL);
        assertThat(snapshot.getAverageBuyPrice()).isEqualByComparingTo("11");
        // (14 - 11) * 50
        assertThat(snapshot.getRealizedGain()).isEqualByComparingTo("150");
        assertThat(snapshot.getMarketValue()).isEqualByComparingTo("1950");
        assertThat(snapshot.getExitReadiness()).isEqualTo(ExitReadiness.HOLD);
    }

    @Test
    @DisplayName("Closed lots are EXITED with no market value; unknown prices are zero")
    void closedLot() {
        TrancheSnapshot snapshot = snapshotOf(
                List.of(buy(1, "2024-01-01", "ABC", "10", "10"), sell(2, "2024-01-05", "ABC", "10", "12")),
                "ABC_240101_A",
                MapPriceLookup.empty());

        assertThat(snapshot.getStatus()).isEqualTo(TrancheStatus.CLOSED);
        assertThat(snapshot.getExitReadiness()).isEqualTo(ExitReadiness.EXITED);
        assertThat(snapshot.getMarketValue()).isEqualByComparingTo("0");
        assertThat(snapshot.getCurrentPrice()).isEqualByComparingTo("0");
        assertThat(snapshot.getPercentToExit()).isEqualByComparingTo("1");
        assertThat(snapshot.getRealizedGain()).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("Market value at the configured ratio of adjusted basis is READY")
    void readyAtRatio() {
        BasisGainCalculator strict = new BasisGainCalculator(new BigDecimal("1.10"));
        TrancheLedger ledger = stateMachine.replay(List.of(buy(1, "2024-01-01", "ABC", "100", "10")));

        TrancheSnapshot atBasis =
                strict.snapshot(ledger.find("ABC_240101_A").orElseThrow(), s -> new BigDecimal("10"), TODAY);
        TrancheSnapshot aboveRatio =
                strict.snapshot(ledger.find("ABC_240101_A").orElseThrow(), s -> new BigDecimal("11"), TODAY);

        assertThat(atBasis.getExitReadiness()).isEqualTo(ExitReadiness.HOLD);
        assertThat(aboveRatio.getExitReadiness()).isEqualTo(ExitReadiness.READY);
        assertThat(aboveRatio.getPercentToExit()).isEqualByComparingTo("0");
    }
}
