package com.swingtrading.backtesting;

import com.swingtrading.analysis.MarketRegimeFilter;
import com.swingtrading.config.TradingConfig;
import com.swingtrading.data.HistoricalDataLoader;
import com.swingtrading.data.TradeLogWriter;
import com.swingtrading.engine.BarSummary;
import com.swingtrading.engine.TradingEngine;
import com.swingtrading.error.InvalidConfigurationException;
import com.swingtrading.metrics.PerformanceMetrics;
import com.swingtrading.metrics.PerformanceReport;
import com.swingtrading.model.ClosedTrade;
import com.swingtrading.model.EquityPoint;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.Position;
import com.swingtrading.model.PriceSeries;
import com.swingtrading.persistence.TradeEventPublisher;
import com.swingtrading.persistence.TradeEventSink;
import com.swingtrading.portfolio.PortfolioLedger;
import com.swingtrading.risk.BreakerTrip;
import com.swingtrading.risk.RiskGovernor;
import com.swingtrading.strategy.StrategyFactory;
import com.swingtrading.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Deterministic multi-instrument backtest over daily bars.
 * <p>
 * Iterates the sorted union of all instrument dates. Each run builds its own
 * ledger, governor and engine, so independent runs may execute in parallel.
 * Positions still open on the last bar are reported, not liquidated.
 */
public final class Backtester {
    private static final Logger logger = LoggerFactory.getLogger(Backtester.class);

    /**
     * @param universe  price series keyed by symbol (benchmark excluded)
     * @param benchmark benchmark series for the regime filter, or null
     * @param startDate first date to trade, or null for the first available bar
     * @param endDate   last date to trade, or null for the last available bar
     */
    public record BacktestRequest(
        Map<String, PriceSeries> universe,
        PriceSeries benchmark,
        LocalDate startDate,
        LocalDate endDate
    ) {
        public BacktestRequest {
            universe = new TreeMap<>(universe);
        }

        public BacktestRequest(Map<String, PriceSeries> universe, PriceSeries benchmark) {
            this(universe, benchmark, null, null);
        }
    }

    public record BacktestResult(
        String strategy,
        List<ClosedTrade> trades,
        List<Position> openPositions,
        List<EquityPoint> equityCurve,
        List<BreakerTrip> breakerTrips,
        PerformanceReport report,
        int dataGaps
    ) {}

    private final TradingConfig config;
    private final List<TradeEventSink> sinks;

    public Backtester(TradingConfig config) {
        this(config, List.of());
    }

    public Backtester(TradingConfig config, List<TradeEventSink> sinks) {
        this.config = config.validate();
        this.sinks = List.copyOf(sinks);
    }

    public BacktestResult run(BacktestRequest request) {
        TradingStrategy strategy = StrategyFactory.create(config);
        PortfolioLedger ledger = new PortfolioLedger(config);
        RiskGovernor governor = new RiskGovernor(config);
        MarketRegimeFilter regimeFilter = new MarketRegimeFilter(
            config.isRegimeFilterEnabled(), request.benchmark(), config.getRegimeMaPeriod());
        TradingEngine engine = new TradingEngine(config, strategy, ledger, governor, regimeFilter,
            new TradeEventPublisher(sinks));

        Map<String, IndicatorSeries> universe = new LinkedHashMap<>();
        for (Map.Entry<String, PriceSeries> entry : request.universe().entrySet()) {
            if (entry.getKey().equals(config.getBenchmarkSymbol())) {
                continue;
            }
            universe.put(entry.getKey(), strategy.prepare(entry.getValue()));
        }

        TreeSet<LocalDate> dates = new TreeSet<>();
        universe.values().forEach(series -> series.prices().bars().forEach(bar -> dates.add(bar.date())));
        if (request.startDate() != null) {
            dates.headSet(request.startDate(), false).clear();
        }
        if (request.endDate() != null) {
            dates.tailSet(request.endDate(), false).clear();
        }

        logger.info("Starting backtest: {} on {} symbols, {} bars ({} to {})", strategy.name(),
            universe.size(), dates.size(), dates.isEmpty() ? "-" : dates.first(), dates.isEmpty() ? "-" : dates.last());

        int entries = 0;
        for (LocalDate date : dates) {
            BarSummary summary = engine.processBar(date, universe);
            entries += summary.entries().size();
        }

        List<ClosedTrade> trades = ledger.closedTrades();
        List<EquityPoint> equity = ledger.equityCurve();
        PerformanceReport report = PerformanceMetrics.compute(trades, equity, ledger.getInitialCapital());
        List<Position> stillOpen = ledger.openPositions();

        logger.info("Backtest complete: {} entries, {} closed trades, {} still open, return {}%",
            entries, trades.size(), stillOpen.size(), String.format("%.2f", report.totalReturn() * 100));
        if (engine.getDataGaps() > 0) {
            logger.warn("{} position-bars skipped for missing price data", engine.getDataGaps());
        }

        return new BacktestResult(strategy.name(), trades, stillOpen, equity, governor.getTrips(),
            report, engine.getDataGaps());
    }

    // CLI Entry Point: Backtester <data-dir> [config.properties] [output-dir]
    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: Backtester <data-dir> [config.properties] [output-dir]");
            System.exit(2);
        }
        Path dataDir = Path.of(args[0]);
        TradingConfig config = args.length > 1 ? TradingConfig.load(Path.of(args[1])) : TradingConfig.load();
        Path outputDir = args.length > 2 ? Path.of(args[2]) : Path.of("results");

        try {
            config.validate();
        } catch (InvalidConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getViolations());
            System.exit(1);
            return;
        }
        config.logSummary();

        var loader = new HistoricalDataLoader();
        List<String> symbols = new ArrayList<>(config.getSymbols());
        Map<String, PriceSeries> universe = loader.loadDirectory(dataDir, symbols);
        PriceSeries benchmark = universe.remove(config.getBenchmarkSymbol());
        if (benchmark == null && config.isRegimeFilterEnabled()) {
            Path benchmarkFile = dataDir.resolve(config.getBenchmarkSymbol() + ".csv");
            if (benchmarkFile.toFile().exists()) {
                benchmark = loader.load(config.getBenchmarkSymbol(), benchmarkFile);
            } else {
                logger.warn("Regime filter enabled but no benchmark data for {}", config.getBenchmarkSymbol());
            }
        }

        var result = new Backtester(config).run(new BacktestRequest(universe, benchmark));
        PerformanceMetrics.printDashboard(result.report());
        result.openPositions().forEach(p ->
            System.out.printf("   OPEN %-12s %d @ %.2f since %s%n", p.symbol(), p.quantity(), p.entryPrice(), p.entryDate()));

        var writer = new TradeLogWriter();
        writer.writeTrades(outputDir.resolve("trades.csv"), result.trades());
        writer.writeEquity(outputDir.resolve("equity.csv"), result.equityCurve());
    }
}
