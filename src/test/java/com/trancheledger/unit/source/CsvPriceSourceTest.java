package com.trancheledger.unit.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.trancheledger.config.LedgerProperties;
import com.trancheledger.exception.LedgerSourceException;
import com.trancheledger.gain.PriceLookup;
import com.trancheledger.source.CsvPriceSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvPriceSourceTest {

    @TempDir
    Path tempDir;

    private LedgerProperties properties;
    private CsvPriceSource source;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        source = new CsvPriceSource(properties);
    }

    private void write(String content) throws IOException {
        Path file = tempDir.resolve("prices.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        properties.setPricesFile(file.toString());
    }

    @Test
    void loadsPricesCaseInsensitively() throws IOException {
        write("Sym,CurrPx\nABC,10.50\nxyz,24\n");

        PriceLookup prices = source.load();

        assertThat(prices.priceOf("abc")).isEqualByComparingTo("10.50");
        assertThat(prices.priceOf("XYZ")).isEqualByComparingTo("24");
    }

    @Test
    void unknownSymbolPricesAtZero() throws IOException {
        write("Sym,CurrPx\nABC,10.50\n");

        assertThat(source.load().priceOf("QQQ")).isEqualByComparingTo("0");
    }

    @Test
    void acceptsAlternateHeadersAndCurrencyText() throws IOException {
        write("\uFEFFTicker;Last\nABC;$12.50\n");

        assertThat(source.load().priceOf("ABC")).isEqualByComparingTo("12.50");
    }

    @Test
    void skipsUnreadablePrices() throws IOException {
        write("Symbol,Price\nABC,n/a\nXYZ,\nDEF,3\n");

        PriceLookup prices = source.load();

        assertThat(prices.priceOf("ABC")).isEqualByComparingTo("0");
        assertThat(prices.priceOf("XYZ")).isEqualByComparingTo("0");
        assertThat(prices.priceOf("DEF")).isEqualByComparingTo("3");
    }

    @Test
    void missingColumnsPriceEverythingAtZero() throws IOException {
        write("Name,Value\nABC,10\n");

        assertThat(source.load().priceOf("ABC")).isEqualByComparingTo("0");
    }

    @Test
    void blankPathPricesEverythingAtZero() {
        properties.setPricesFile("");

        assertThat(source.load().priceOf("ABC")).isEqualByComparingTo("0");
    }

    @Test
    void configuredButMissingFileFails() {
        properties.setPricesFile(tempDir.resolve("nope.csv").toString());

        assertThatThrownBy(() -> source.load()).isInstanceOf(LedgerSourceException.class);
    }
}
