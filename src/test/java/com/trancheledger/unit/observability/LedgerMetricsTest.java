package com.trancheledger.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.trancheledger.allocation.UnallocatedDividend;
import com.trancheledger.domain.enums.UnallocatedReason;
import com.trancheledger.event.LedgerRunCompletedEvent;
import com.trancheledger.ledger.SymbolFailure;
import com.trancheledger.normalize.RowRejection;
import com.trancheledger.observability.LedgerMetrics;
import com.trancheledger.reporting.LedgerDiagnostics;
import com.trancheledger.reporting.LedgerReport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for LedgerMetrics verifying that the run counters and timer are registered and follow
 * {@link LedgerRunCompletedEvent}s.
 */
class LedgerMetricsTest {

    private MeterRegistry meterRegistry;
    private LedgerMetrics ledgerMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ledgerMetrics = new LedgerMetrics(meterRegistry);
    }

    private static LedgerRunCompletedEvent event(int rejected, int unallocated, int failed, Duration duration) {
        List<RowRejection> rejections = IntStream.range(0, rejected)
                .mapToObj(i -> RowRejection.builder().rowNumber(i + 1).column("Date").rule("date").build())
                .toList();
        List<UnallocatedDividend> dividends = IntStream.range(0, unallocated)
                .mapToObj(i -> UnallocatedDividend.builder()
                        .rowNumber(i + 1)
                        .symbol("ABC")
                        .reason(UnallocatedReason.NO_OPEN_LOTS)
                        .build())
                .toList();
        List<SymbolFailure> failures = IntStream.range(0, failed)
                .mapToObj(i -> SymbolFailure.builder().symbol("S" + i).errorCode("OVER_SELL").build())
                .toList();
        LedgerReport report = LedgerReport.builder()
                .diagnostics(LedgerDiagnostics.builder()
                        .rejectedRows(rejections)
                        .unallocatedDividends(dividends)
                        .symbolFailures(failures)
                        .build())
                .build();
        return new LedgerRunCompletedEvent(LedgerMetricsTest.class, report, duration);
    }

    private double count(String name) {
        return meterRegistry.find(name).counter().count();
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("all counters and the timer exist before any run")
        void metersRegistered() {
            assertThat(meterRegistry.find("ledger.runs").counter()).isNotNull();
            assertThat(meterRegistry.find("ledger.rows.rejected").counter()).isNotNull();
            assertThat(meterRegistry.find("ledger.dividends.unallocated").counter()).isNotNull();
            assertThat(meterRegistry.find("ledger.symbols.failed").counter()).isNotNull();
            assertThat(meterRegistry.find("ledger.run.duration").timer()).isNotNull();
            assertThat(count("ledger.runs")).isZero();
        }
    }

    @Nested
    @DisplayName("Run completed")
    class RunCompleted {

        @Test
        @DisplayName("a run increments each counter by its diagnostics size")
        void countsDiagnostics() {
            ledgerMetrics.onLedgerRunCompleted(event(2, 1, 3, Duration.ofMillis(40)));

            assertThat(count("ledger.runs")).isEqualTo(1.0);
            assertThat(count("ledger.rows.rejected")).isEqualTo(2.0);
            assertThat(count("ledger.dividends.unallocated")).isEqualTo(1.0);
            assertThat(count("ledger.symbols.failed")).isEqualTo(3.0);
        }

        @Test
        @DisplayName("counters accumulate across runs and the timer records each run")
        void accumulates() {
            ledgerMetrics.onLedgerRunCompleted(event(1, 0, 0, Duration.ofMillis(10)));
            ledgerMetrics.onLedgerRunCompleted(event(0, 2, 0, Duration.ofMillis(30)));

            assertThat(count("ledger.runs")).isEqualTo(2.0);
            assertThat(count("ledger.rows.rejected")).isEqualTo(1.0);
            assertThat(count("ledger.dividends.unallocated")).isEqualTo(2.0);
            assertThat(meterRegistry.find("ledger.run.duration").timer().count()).isEqualTo(2);
            assertThat(meterRegistry.find("ledger.run.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                    .isEqualTo(40.0);
        }
    }
}
