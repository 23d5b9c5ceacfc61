package com.trancheledger.source;

import com.trancheledger.config.LedgerProperties;
import com.trancheledger.domain.model.RawTransactionTable;
import com.trancheledger.exception.LedgerSourceException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the transaction log from the configured CSV file. The first record is the header row.
 */
@Component
public class CsvTransactionSource implements TransactionSource {

    private static final Logger log = LoggerFactory.getLogger(CsvTransactionSource.class);

    private final LedgerProperties properties;

    public CsvTransactionSource(LedgerProperties properties) {
        this.properties = properties;
    }

    @Override
    public RawTransactionTable load() {
        String file = properties.getTransactionsFile();
        if (file == null || file.isBlank()) {
            throw new LedgerSourceException("No transactions file configured", "tranche-ledger.transactions-file", null);
        }
        Path path = Path.of(file);
        List<List<String>> records = CsvTables.read(path);
        if (records.isEmpty()) {
            throw new LedgerSourceException("Transactions file is empty: " + path, path.toString(), null);
        }
        RawTransactionTable table = RawTransactionTable.of(records.get(0), records.subList(1, records.size()));
        log.info("Read {} transaction rows from {}", table.getRows().size(), path);
        return table;
    }
}
