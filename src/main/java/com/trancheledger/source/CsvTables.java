package com.trancheledger.source;

import com.trancheledger.exception.LedgerSourceException;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads a delimited text file into a header row plus data rows of raw strings.
 *
 * <p>A leading byte-order mark is dropped. The delimiter is sniffed from the header line:
 * semicolon when present, comma otherwise.
 */
final class CsvTables {

    private CsvTables() {}

    static List<List<String>> read(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new LedgerSourceException("Input file not found: " + path, path.toString(), e);
        } catch (IOException e) {
            throw new LedgerSourceException("Failed to read " + path + ": " + e.getMessage(), path.toString(), e);
        }
        return parse(content, path.toString());
    }

    static List<List<String>> parse(String raw, String location) {
        String content = stripBom(raw);
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(sniffDelimiter(firstLine(content)))
                .setIgnoreEmptyLines(false)
                .build();
        List<List<String>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(record.size());
                record.forEach(cells::add);
                rows.add(cells);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new LedgerSourceException("Failed to parse " + location + ": " + e.getMessage(), location, e);
        }
        return rows;
    }

    static String stripBom(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return value.charAt(0) == '\uFEFF' ? value.substring(1) : value;
    }

    static char sniffDelimiter(String headerLine) {
        if (headerLine == null || headerLine.isEmpty()) {
            return ',';
        }
        return headerLine.indexOf(';') >= 0 ? ';' : ',';
    }

    private static String firstLine(String content) {
        int end = content.indexOf('\n');
        return end >= 0 ? content.substring(0, end) : content;
    }
}
