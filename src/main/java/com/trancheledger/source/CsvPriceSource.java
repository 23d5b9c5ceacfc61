package com.trancheledger.source;

import com.trancheledger.config.LedgerProperties;
import com.trancheledger.gain.PriceLookup;
import com.trancheledger.normalize.AmountParser;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads current prices from the configured market-data CSV.
 *
 * <p>The header row must name a symbol column ({@code Sym}, {@code Symbol} or {@code Ticker}) and a
 * price column ({@code CurrPx}, {@code Price}, {@code CurrentPrice} or {@code Last}). Rows with a
 * blank symbol or an unreadable price are skipped with a warning. With no file configured every
 * symbol prices at zero.
 */
@Component
public class CsvPriceSource implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(CsvPriceSource.class);

    private static final List<String> SYMBOL_HEADERS = List.of("sym", "symbol", "ticker");
    private static final List<String> PRICE_HEADERS = List.of("currpx", "price", "currentprice", "last");

    private final LedgerProperties properties;

    public CsvPriceSource(LedgerProperties properties) {
        this.properties = properties;
    }

    @Override
    public PriceLookup load() {
        String file = properties.getPricesFile();
        if (file == null || file.isBlank()) {
            log.info("No prices file configured, pricing every symbol at 0");
            return MapPriceLookup.empty();
        }
        Path path = Path.of(file);
        return fromRecords(CsvTables.read(path), path.toString());
    }

    static MapPriceLookup fromRecords(List<List<String>> records, String location) {
        if (records.isEmpty()) {
            return MapPriceLookup.empty();
        }
        List<String> headers = records.get(0);
        int symbolIndex = indexOf(headers, SYMBOL_HEADERS);
        int priceIndex = indexOf(headers, PRICE_HEADERS);
        if (symbolIndex < 0 || priceIndex < 0) {
            log.warn("{} has no symbol/price columns (headers {}), pricing every symbol at 0", location, headers);
            return MapPriceLookup.empty();
        }

        Map<String, BigDecimal> prices = new HashMap<>();
        for (int i = 1; i < records.size(); i++) {
            List<String> row = records.get(i);
            String symbol = cell(row, symbolIndex);
            String priceText = cell(row, priceIndex);
            if (symbol == null || symbol.isBlank()) {
                continue;
            }
            try {
                BigDecimal price = AmountParser.parseDecimal(priceText);
                if (price == null) {
                    log.warn("{} row {}: no price for {}", location, i, symbol);
                    continue;
                }
                prices.put(symbol, price);
            } catch (NumberFormatException e) {
                log.warn("{} row {}: unreadable price '{}' for {}", location, i, priceText, symbol);
            }
        }
        log.info("Loaded {} prices from {}", prices.size(), location);
        return new MapPriceLookup(prices);
    }

    private static int indexOf(List<String> headers, List<String> candidates) {
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i).replaceAll("[\\s_-]", "").toLowerCase(Locale.ROOT);
            if (candidates.contains(header)) {
                return i;
            }
        }
        return -1;
    }

    private static String cell(List<String> row, int index) {
        return index < row.size() ? row.get(index) : null;
    }
}
