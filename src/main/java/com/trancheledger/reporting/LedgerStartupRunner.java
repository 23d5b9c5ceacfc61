package com.trancheledger.reporting;

import com.trancheledger.config.LedgerProperties;
import com.trancheledger.exception.BaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Runs one ledger report once the application is up, when {@code tranche-ledger.run-on-startup}
 * is set, and logs what it found.
 *
 * <p>A failed run is logged and the application keeps serving; the REST endpoints report the
 * same error on request.
 */
@Component
public class LedgerStartupRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(LedgerStartupRunner.class);

    private final LedgerProperties properties;
    private final LedgerReportService ledgerReportService;

    public LedgerStartupRunner(LedgerProperties properties, LedgerReportService ledgerReportService) {
        this.properties = properties;
        this.ledgerReportService = ledgerReportService;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!properties.isRunOnStartup()) {
            log.debug("Startup ledger run disabled");
            return;
        }
        runOnce();
    }

    void runOnce() {
        log.info("Startup: running ledger over {}", properties.getTransactionsFile());
        try {
            LedgerReport report = ledgerReportService.generate();
            LedgerDiagnostics diagnostics = report.getDiagnostics();
            if (diagnostics.isClean()) {
                log.info("Startup ledger run clean: {} lots across {} symbols",
                        report.getTranches().size(), report.getSymbols().size());
            } else {
                log.warn(
                        "Startup ledger run finished with {} rejected rows, {} unallocated dividends, "
                                + "{} failed symbols",
                        diagnostics.getRejectedRowCount(),
                        diagnostics.getUnallocatedDividends().size(),
                        diagnostics.getSymbolFailures().size());
            }
        } catch (BaseException e) {
            log.error("Startup ledger run failed [{}]: {}", e.getErrorCode().getCode(), e.getMessage());
        }
    }
}
