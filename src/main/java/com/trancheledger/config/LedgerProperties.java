package com.trancheledger.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ledger run.
 *
 * <p>Names the transaction and market-data files, the weekday weeks start on, and the
 * market-value-to-basis ratio at which a lot counts as ready to exit. Properties are read from
 * the {@code tranche-ledger} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "tranche-ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    /** Transaction log CSV. */
    private String transactionsFile = "data/transactions.csv";

    /** Market data CSV with one current price per symbol. Optional; blank prices everything at 0. */
    private String pricesFile = "data/prices.csv";

    /** Day a reporting week starts on. */
    @NotNull
    private DayOfWeek weekAnchor = DayOfWeek.MONDAY;

    /** A lot is READY once market value reaches this multiple of its adjusted basis. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal exitReadyRatio = BigDecimal.ONE;

    /** Zone for the report clock. Blank uses the system default. */
    private String zoneId;

    /** Run one report when the application starts and log the summary. */
    private boolean runOnStartup = false;
}
