package com.swingtrading.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.swingtrading.error.TradingException;
import com.swingtrading.model.Bar;
import com.swingtrading.model.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Reads daily bars from CSV files with a {@code Date,Open,High,Low,Close,Volume}
 * header, one file per symbol named {@code <SYMBOL>.csv}. Extra columns are ignored.
 */
public final class HistoricalDataLoader {
    private static final Logger logger = LoggerFactory.getLogger(HistoricalDataLoader.class);

    private final CsvMapper mapper = CsvMapper.builder()
        .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
        .build();
    private final CsvSchema schema = CsvSchema.emptySchema().withHeader();

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CsvBar(
        @JsonProperty("Date") String date,
        @JsonProperty("Open") Double open,
        @JsonProperty("High") Double high,
        @JsonProperty("Low") Double low,
        @JsonProperty("Close") Double close,
        @JsonProperty("Volume") Double volume
    ) {}

    /**
     * Load one CSV file. Rows without a parseable date or close are skipped
     * with a warning; duplicate dates keep the last row.
     */
    public PriceSeries load(String symbol, Path file) {
        TreeMap<LocalDate, Bar> bars = new TreeMap<>();
        int skipped = 0;
        try (Reader reader = Files.newBufferedReader(file);
             MappingIterator<CsvBar> rows = mapper.readerFor(CsvBar.class).with(schema).readValues(reader)) {
            while (rows.hasNext()) {
                Bar bar = toBar(rows.next());
                if (bar == null) {
                    skipped++;
                    continue;
                }
                bars.put(bar.date(), bar);
            }
        } catch (IOException | RuntimeException e) {
            throw new TradingException("Failed to read price data for " + symbol + " from " + file, e);
        }

        if (skipped > 0) {
            logger.warn("{}: skipped {} malformed rows in {}", symbol, skipped, file.getFileName());
        }
        logger.debug("{}: loaded {} bars ({} to {})", symbol, bars.size(),
            bars.isEmpty() ? "-" : bars.firstKey(), bars.isEmpty() ? "-" : bars.lastKey());
        return new PriceSeries(symbol, new ArrayList<>(bars.values()));
    }

    /**
     * Load {@code <symbol>.csv} for each symbol from {@code directory}. When
     * {@code symbols} is empty every CSV file in the directory is loaded.
     * Missing files are logged and left out.
     */
    public Map<String, PriceSeries> loadDirectory(Path directory, List<String> symbols) {
        List<String> wanted = symbols.isEmpty() ? listSymbols(directory) : symbols;
        Map<String, PriceSeries> universe = new TreeMap<>();
        for (String symbol : wanted) {
            Path file = directory.resolve(symbol + ".csv");
            if (!Files.exists(file)) {
                logger.warn("{}: no data file at {}", symbol, file);
                continue;
            }
            PriceSeries series = load(symbol, file);
            if (series.isEmpty()) {
                logger.warn("{}: data file is empty, skipping", symbol);
                continue;
            }
            universe.put(symbol, series);
        }
        logger.info("Loaded price data for {} of {} symbols from {}", universe.size(), wanted.size(), directory);
        return universe;
    }

    private List<String> listSymbols(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(".csv"))
                .map(name -> name.substring(0, name.length() - 4))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new TradingException("Failed to list data directory " + directory, e);
        }
    }

    private static Bar toBar(CsvBar row) {
        if (row.date() == null || row.date().isBlank() || row.close() == null || row.close().isNaN()) {
            return null;
        }
        LocalDate date;
        try {
            // accepts "2024-01-02" and timestamps such as "2024-01-02 00:00:00+05:30"
            date = LocalDate.parse(row.date().trim().substring(0, Math.min(10, row.date().trim().length())));
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable date '{}': {}", row.date(), e.getMessage());
            return null;
        }
        double close = row.close();
        double open = orDefault(row.open(), close);
        double high = Math.max(orDefault(row.high(), close), Math.max(open, close));
        double low = Math.min(orDefault(row.low(), close), Math.min(open, close));
        long volume = row.volume() == null || row.volume().isNaN() ? 0L : row.volume().longValue();
        return new Bar(date, open, high, low, close, volume);
    }

    private static double orDefault(Double value, double fallback) {
        return value == null || value.isNaN() ? fallback : value;
    }
}
