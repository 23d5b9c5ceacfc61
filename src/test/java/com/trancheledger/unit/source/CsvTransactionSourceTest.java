package com.trancheledger.unit.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.trancheledger.config.LedgerProperties;
import com.trancheledger.domain.model.RawTransactionTable;
import com.trancheledger.exception.ErrorCode;
import com.trancheledger.exception.LedgerSourceException;
import com.trancheledger.source.CsvTransactionSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for CsvTransactionSource.
 *
 * <p>Verifies: header and row reading, BOM and delimiter handling, quoted cells, and the errors
 * raised for an unusable file.
 */
class CsvTransactionSourceTest {

    @TempDir
    Path tempDir;

    private LedgerProperties properties;
    private CsvTransactionSource source;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        source = new CsvTransactionSource(properties);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        properties.setTransactionsFile(file.toString());
        return file;
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("first record is the header, data rows are numbered from 1")
        void readsHeaderAndRows() throws IOException {
            write("tx.csv", "Type,Date,Sym,Shr,Price\nBuy,2024-01-01,ABC,100,10\nSell,2024-02-01,ABC,50,12\n");

            RawTransactionTable table = source.load();

            assertThat(table.getHeaders()).containsExactly("Type", "Date", "Sym", "Shr", "Price");
            assertThat(table.getRows()).hasSize(2);
            assertThat(table.getRows().get(0).getRowNumber()).isEqualTo(1);
            assertThat(table.getRows().get(1).getCells()).containsExactly("Sell", "2024-02-01", "ABC", "50", "12");
        }

        @Test
        @DisplayName("byte-order mark is dropped and semicolons are detected")
        void stripsBomAndSniffsSemicolon() throws IOException {
            write("tx.csv", "\uFEFFType;Date;Sym;Dist\nDividend;2024-01-08;ABC;1,50\n");

            RawTransactionTable table = source.load();

            assertThat(table.getHeaders()).containsExactly("Type", "Date", "Sym", "Dist");
            assertThat(table.getRows().get(0).getCells()).containsExactly("Dividend", "2024-01-08", "ABC", "1,50");
        }

        @Test
        @DisplayName("quoted cells keep embedded commas")
        void keepsQuotedCommas() throws IOException {
            write("tx.csv", "Type,Date,Sym,Shr,Price\nBuy,2024-01-01,ABC,\"1,000\",10\n");

            RawTransactionTable table = source.load();

            assertThat(table.getRows().get(0).cell(3)).isEqualTo("1,000");
        }

        @Test
        @DisplayName("a header-only file yields no rows")
        void headerOnly() throws IOException {
            write("tx.csv", "Type,Date,Sym\n");

            assertThat(source.load().getRows()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void missingFileIsSourceUnavailable() {
            properties.setTransactionsFile(tempDir.resolve("absent.csv").toString());

            assertThatThrownBy(() -> source.load())
                    .isInstanceOf(LedgerSourceException.class)
                    .hasMessageContaining("absent.csv")
                    .satisfies(e -> assertThat(((LedgerSourceException) e).getErrorCode())
                            .isEqualTo(ErrorCode.SOURCE_UNAVAILABLE));
        }

        @Test
        void emptyFileIsRejected() throws IOException {
            write("empty.csv", "");

            assertThatThrownBy(() -> source.load())
                    .isInstanceOf(LedgerSourceException.class)
                    .hasMessageContaining("empty");
        }

        @Test
        void blankPathIsRejected() {
            properties.setTransactionsFile("  ");

            assertThatThrownBy(() -> source.load())
                    .isInstanceOf(LedgerSourceException.class)
                    .hasMessageContaining("No transactions file configured");
        }
    }
}
