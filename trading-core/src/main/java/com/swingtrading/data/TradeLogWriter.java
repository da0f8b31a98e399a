package com.swingtrading.data;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.swingtrading.error.TradingException;
import com.swingtrading.model.ClosedTrade;
import com.swingtrading.model.EquityPoint;
import com.swingtrading.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Exports the closed-trade log and the equity curve as CSV. Numbers are
 * formatted with a fixed precision so identical runs give identical files.
 */
public final class TradeLogWriter {
    private static final Logger logger = LoggerFactory.getLogger(TradeLogWriter.class);

    private final CsvMapper mapper = new CsvMapper();

    @JsonPropertyOrder({"symbol", "entryDate", "entryPrice", "exitDate", "exitPrice", "quantity",
        "capitalCommitted", "netProceeds", "pnl", "pnlPercent", "daysHeld", "exitReason",
        "signalStrength", "regime"})
    record TradeRow(
        String symbol,
        String entryDate,
        String entryPrice,
        String exitDate,
        String exitPrice,
        long quantity,
        String capitalCommitted,
        String netProceeds,
        String pnl,
        String pnlPercent,
        long daysHeld,
        String exitReason,
        String signalStrength,
        String regime
    ) {
        static TradeRow of(ClosedTrade trade) {
            Position p = trade.position();
            return new TradeRow(p.symbol(), p.entryDate().toString(), money(p.entryPrice()),
                trade.exitDate().toString(), money(trade.exitPrice()), p.quantity(),
                money(p.capitalCommitted()), money(trade.netProceeds()), money(trade.pnl()),
                money(trade.pnlPercent()), trade.daysHeld(), trade.exitReason().label(),
                String.format(Locale.ROOT, "%.4f", p.signalStrength()), trade.regimeAtExit().name());
        }
    }

    @JsonPropertyOrder({"date", "totalValue", "freeCapital", "openPositions"})
    record EquityRow(String date, String totalValue, String freeCapital, int openPositions) {
        static EquityRow of(EquityPoint point) {
            return new EquityRow(point.date().toString(), money(point.totalValue()),
                money(point.freeCapital()), point.openPositions());
        }
    }

    public String tradesToCsv(List<ClosedTrade> trades) {
        List<TradeRow> rows = trades.stream().map(TradeRow::of).toList();
        return write(rows, TradeRow.class);
    }

    public String equityToCsv(List<EquityPoint> equityCurve) {
        List<EquityRow> rows = equityCurve.stream().map(EquityRow::of).toList();
        return write(rows, EquityRow.class);
    }

    public void writeTrades(Path file, List<ClosedTrade> trades) {
        writeFile(file, tradesToCsv(trades));
        logger.info("Wrote {} trades to {}", trades.size(), file.toAbsolutePath());
    }

    public void writeEquity(Path file, List<EquityPoint> equityCurve) {
        writeFile(file, equityToCsv(equityCurve));
        logger.info("Wrote {} equity points to {}", equityCurve.size(), file.toAbsolutePath());
    }

    private <T> String write(List<T> rows, Class<T> type) {
        CsvSchema schema = mapper.schemaFor(type).withHeader();
        try {
            return mapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new TradingException("Failed to render " + type.getSimpleName() + " CSV", e);
        }
    }

    private static void writeFile(Path file, String content) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TradingException("Failed to write " + file, e);
        }
    }

    private static String money(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
