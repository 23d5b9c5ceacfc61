package com.trancheledger.unit.reporting;

import static com.trancheledger.unit.TransactionFixtures.buy;
import static com.trancheledger.unit.TransactionFixtures.dividend;
import static com.trancheledger.unit.TransactionFixtures.dividendPerShare;
import static com.trancheledger.unit.TransactionFixtures.sell;
import static org.assertj.core.api.Assertions.assertThat;

import com.trancheledger.aggregation.WeekStartResolver;
import com.trancheledger.domain.enums.TrancheStatus;
import com.trancheledger.domain.model.TransactionEvent;
import com.trancheledger.ledger.TrancheLedger;
import com.trancheledger.ledger.TrancheStateMachine;
import com.trancheledger.reporting.TransactionLogBuilder;
import com.trancheledger.reporting.TransactionLogRow;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransactionLogBuilderTest {

    private TrancheStateMachine stateMachine;
    private TransactionLogBuilder builder;

    @BeforeEach
    void setUp() {
        stateMachine = new TrancheStateMachine();
        builder = new TransactionLogBuilder(new WeekStartResolver(DayOfWeek.MONDAY));
    }

    private List<TransactionLogRow> build(List<TransactionEvent> events) {
        TrancheLedger ledger = stateMachine.replay(events);
        return builder.build(events, ledger);
    }

    @Test
    void annotatesTradesWithLotAndRunningShares() {
        List<TransactionLogRow> rows = build(List.of(
                buy(1, "2024-01-03", "ABC", "100", "10"),
                buy(2, "2024-01-05", "ABC", "50", "12"),
                sell(3, "2024-01-10", "ABC", "30", "13")));

        assertThat(rows).extracting(TransactionLogRow::getLotId)
                .containsExactly("ABC_240103_A", "ABC_240105_A", "ABC_240105_A");
        assertThat(rows).extracting(r -> r.getRunningShares().intValue()).containsExactly(100, 150, 120);
        assertThat(rows.get(0).getBuyCost()).isEqualByComparingTo("1000");
        assertThat(rows.get(0).getWeekStart()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(rows.get(2).getBuyCost()).isNull();
        assertThat(rows.get(2).getLotSharesRemaining()).isEqualByComparingTo("20");
        assertThat(rows.get(2).getLotStatus()).isEqualTo(TrancheStatus.PARTIAL);
    }

    @Test
    void lotStatusIsAsOfTheRowDate() {
        List<TransactionLogRow> rows = build(List.of(
                buy(1, "2024-01-03", "ABC", "100", "10"), sell(2, "2024-02-01", "ABC", "100", "11")));

        assertThat(rows.get(0).getLotStatus()).isEqualTo(TrancheStatus.OPEN);
        assertThat(rows.get(0).getLotSharesRemaining()).isEqualByComparingTo("100");
        assertThat(rows.get(1).getLotStatus()).isEqualTo(TrancheStatus.CLOSED);
    }

    @Test
    void dividendRowsCarryPerShareFiguresOnRunningShares() {
        List<TransactionLogRow> rows = build(List.of(
                buy(1, "2024-01-03", "ABC", "100", "10"),
                dividend(2, "2024-01-08", "ABC", "50", "0.4"),
                dividendPerShare(3, "2024-01-15", "ABC", "0.25", "0")));

        TransactionLogRow total = rows.get(1);
        assertThat(total.getLotId()).isNull();
        assertThat(total.getRunningShares()).isEqualByComparingTo("100");
        assertThat(total.getDistribution()).isEqualByComparingTo("50");
        assertThat(total.getRoc()).isEqualByComparingTo("20");
        assertThat(total.getTaxableIncome()).isEqualByComparingTo("30");
        assertThat(total.getDistributionPerShare()).isEqualByComparingTo("0.5");
        assertThat(total.getRocPerShare()).isEqualByComparingTo("0.2");

        TransactionLogRow perShare = rows.get(2);
        assertThat(perShare.getDistribution()).isEqualByComparingTo("25");
        assertThat(perShare.getTaxablePerShare()).isEqualByComparingTo("0.25");
    }

    @Test
    void rowsStayInSourceOrderWhileSharesRunInDateOrder() {
        List<TransactionLogRow> rows = build(List.of(
                sell(1, "2024-02-01", "ABC", "40", "12"), buy(2, "2024-01-01", "ABC", "100", "10")));

        assertThat(rows).extracting(TransactionLogRow::getRowNumber).containsExactly(1, 2);
        assertThat(rows.get(0).getRunningShares()).isEqualByComparingTo("60");
        assertThat(rows.get(1).getRunningShares()).isEqualByComparingTo("100");
    }

    @Test
    void failedSymbolRowsHaveNoLot() {
        List<TransactionLogRow> rows = build(List.of(sell(1, "2024-01-01", "ABC", "5", "10")));

        assertThat(rows.get(0).getLotId()).isNull();
        assertThat(rows.get(0).getLotStatus()).isNull();
        assertThat(rows.get(0).getRunningShares()).isEqualByComparingTo("-5");
    }
}
