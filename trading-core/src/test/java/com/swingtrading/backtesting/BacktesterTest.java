package com.swingtrading.backtesting;

import com.swingtrading.Fixtures;
import com.swingtrading.backtesting.Backtester.BacktestRequest;
import com.swingtrading.backtesting.Backtester.BacktestResult;
import com.swingtrading.config.TradingConfig;
import com.swingtrading.data.TradeLogWriter;
import com.swingtrading.error.InvalidConfigurationException;
import com.swingtrading.model.EquityPoint;
import com.swingtrading.model.PriceSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

import static com.swingtrading.Fixtures.START;
import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Backtester Tests")
class BacktesterTest {

    private static TradingConfig config() {
        return Fixtures.config("MA_SHORT_PERIOD", "5", "MA_LONG_PERIOD", "20",
            "MIN_HOLD_DAYS", "5", "MAX_HOLD_DAYS", "25");
    }

    private static Map<String, PriceSeries> universe() {
        Map<String, PriceSeries> universe = new TreeMap<>();
        for (int i = 0; i < 6; i++) {
            universe.put("SYM" + i, Fixtures.randomWalk("SYM" + i, 7L * (i + 1), 300));
        }
        return universe;
    }

    @Test
    @DisplayName("Identical inputs give identical trade logs and equity curves")
    void deterministic() {
        var writer = new TradeLogWriter();
        BacktestResult first = new Backtester(config()).run(new BacktestRequest(universe(), null));
        BacktestResult second = new Backtester(config()).run(new BacktestRequest(universe(), null));

        assertThat(first.trades()).isNotEmpty();
        assertEquals(writer.tradesToCsv(first.trades()), writer.tradesToCsv(second.trades()));
        assertEquals(first.equityCurve(), second.equityCurve());
        assertEquals(first.report(), second.report());
    }

    @Test
    @DisplayName("Independent runs can execute in parallel")
    void parallelRuns() {
        Backtester backtester = new Backtester(config());
        var a = CompletableFuture.supplyAsync(() -> backtester.run(new BacktestRequest(universe(), null)));
        var b = CompletableFuture.supplyAsync(() -> backtester.run(new BacktestRequest(universe(), null)));

        assertEquals(a.join().equityCurve(), b.join().equityCurve());
    }

    @Test
    @DisplayName("One equity point per date inside the requested window")
    void dateWindow() {
        var request = new BacktestRequest(universe(), null, START.plusDays(50), START.plusDays(149));

        BacktestResult result = new Backtester(config()).run(request);

        assertEquals(100, result.equityCurve().size());
        assertEquals(START.plusDays(50), result.equityCurve().get(0).date());
        assertThat(result.trades()).allSatisfy(trade ->
            assertThat(trade.position().entryDate()).isAfterOrEqualTo(START.plusDays(50)));
    }

    @Test
    @DisplayName("Final equity matches free capital plus open positions at their last close")
    void finalEquity() {
        Map<String, PriceSeries> universe = universe();
        BacktestResult result = new Backtester(config()).run(new BacktestRequest(universe, null));

        EquityPoint last = result.equityCurve().get(result.equityCurve().size() - 1);
        double open = result.openPositions().stream()
            .mapToDouble(p -> p.marketValue(universe.get(p.symbol()).last().close()))
            .sum();
        assertEquals(last.freeCapital() + open, last.totalValue(), 1e-6);
        assertEquals(last.totalValue(), result.report().finalEquity(), 1e-9);
    }

    @Test
    @DisplayName("Benchmark symbol is never traded")
    void benchmarkExcluded() {
        Map<String, PriceSeries> universe = universe();
        universe.put("NIFTY50", Fixtures.randomWalk("NIFTY50", 99L, 300));

        BacktestResult result = new Backtester(config()).run(new BacktestRequest(universe, universe.get("NIFTY50")));

        assertThat(result.trades()).noneMatch(trade -> trade.symbol().equals("NIFTY50"));
        assertThat(result.openPositions()).noneMatch(p -> p.symbol().equals("NIFTY50"));
    }

    @Test
    @DisplayName("Invalid configuration is rejected before any bar is processed")
    void invalidConfig() {
        var e = assertThrows(InvalidConfigurationException.class,
            () -> new Backtester(Fixtures.config("MAX_POSITIONS", "0", "STOP_LOSS_PERCENT", "20")));

        assertThat(e.getViolations()).hasSize(2);
    }
}
