package com.swingtrading.live;

import com.swingtrading.analysis.MarketRegimeFilter;
import com.swingtrading.config.TradingConfig;
import com.swingtrading.engine.EntryCandidate;
import com.swingtrading.engine.TradingEngine;
import com.swingtrading.error.BrokerAuthenticationException;
import com.swingtrading.error.DataGapException;
import com.swingtrading.error.ExternalServiceException;
import com.swingtrading.exits.ExitDecision;
import com.swingtrading.exits.PendingExit;
import com.swingtrading.live.approval.ApprovalRequest;
import com.swingtrading.live.approval.TradeApprover;
import com.swingtrading.live.broker.BrokerGateway;
import com.swingtrading.live.broker.MarketDataProvider;
import com.swingtrading.live.broker.OrderRequest;
import com.swingtrading.live.broker.OrderResult;
import com.swingtrading.live.broker.Quote;
import com.swingtrading.live.persistence.PositionStore;
import com.swingtrading.model.Bar;
import com.swingtrading.model.ClosedTrade;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.Position;
import com.swingtrading.model.PriceSeries;
import com.swingtrading.model.TradeAction;
import com.swingtrading.persistence.TradeEventPublisher;
import com.swingtrading.persistence.TradeEventSink;
import com.swingtrading.portfolio.PortfolioLedger;
import com.swingtrading.risk.RiskGovernor;
import com.swingtrading.strategy.StrategyFactory;
import com.swingtrading.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;

/**
 * Polling live driver over the shared {@link TradingEngine}.
 * <p>
 * Each iteration turns the latest quote of every instrument into today's bar
 * on top of its daily history, then runs exits, mark-to-market, the risk check
 * and entry admission. Orders go out only inside the trading window and, when
 * enabled, after operator approval. The ledger re-validates after approval and
 * is rolled back when the order fails. {@link #stop()} halts entries at once and
 * leaves open positions untouched.
 */
public final class LiveTrader {
    private static final Logger logger = LoggerFactory.getLogger(LiveTrader.class);

    private final TradingConfig config;
    private final MarketDataProvider marketData;
    private final BrokerGateway broker;
    private final TradeApprover approver;
    private final PositionStore positionStore;  // null: positions are not persisted
    private final Clock clock;
    private final TradingHoursWindow hoursWindow;
    private final DataGapTracker gapTracker;
    private final TradingStrategy strategy;
    private final PortfolioLedger ledger;
    private final RiskGovernor governor;
    private final List<TradeEventSink> sinks;

    private final Map<String, PriceSeries> history = new HashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean entriesHalted = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private TradingEngine engine;

    public LiveTrader(TradingConfig config, MarketDataProvider marketData, BrokerGateway broker,
                      TradeApprover approver, PositionStore positionStore, List<TradeEventSink> sinks, Clock clock) {
        this.config = config.validate();
        this.marketData = marketData;
        this.broker = broker;
        this.approver = approver;
        this.positionStore = positionStore;
        this.sinks = List.copyOf(sinks);
        this.clock = clock;
        this.hoursWindow = new TradingHoursWindow(config, clock);
        this.gapTracker = new DataGapTracker(config.getDataGapReportAfter());
        this.strategy = StrategyFactory.create(config);
        this.ledger = new PortfolioLedger(config);
        this.governor = new RiskGovernor(config);
    }

    // ==================== Lifecycle ====================

    /**
     * Load daily history, build the engine and restore saved positions.
     */
    public void start() {
        int lookback = historyDays();
        for (String symbol : config.getSymbols()) {
            try {
                history.put(symbol, marketData.fetchDailyHistory(symbol, lookback));
            } catch (BrokerAuthenticationException e) {
                throw e;
            } catch (ExternalServiceException e) {
                logger.warn("{}: no daily history, instrument skipped until restart - {}", symbol, e.getMessage());
            }
        }

        PriceSeries benchmark = null;
        if (config.isRegimeFilterEnabled()) {
            try {
                benchmark = marketData.fetchDailyHistory(config.getBenchmarkSymbol(), lookback);
            } catch (ExternalServiceException e) {
                logger.warn("Regime filter enabled but benchmark {} unavailable: {}",
                    config.getBenchmarkSymbol(), e.getMessage());
            }
        }
        MarketRegimeFilter regimeFilter = new MarketRegimeFilter(config.isRegimeFilterEnabled(), benchmark,
            config.getRegimeMaPeriod());
        engine = new TradingEngine(config, strategy, ledger, governor, regimeFilter,
            new TradeEventPublisher(sinks), clock);

        if (positionStore != null) {
            for (Position position : positionStore.load()) {
                try {
                    ledger.restore(position);
                    PriceSeries series = history.get(position.symbol());
                    if (series != null && !series.isEmpty()) {
                        engine.observePrice(position.symbol(), series.last().close());
                    }
                } catch (IllegalStateException | IllegalArgumentException e) {
                    logger.error("{}: saved position not restored - {}", position.symbol(), e.getMessage());
                }
            }
        }
        logger.info("Live trader ready: {} on {} instruments, {} open positions, broker {}",
            strategy.name(), history.size(), ledger.openCount(), broker.name());
    }

    /**
     * Poll until {@link #stop()} is called. Authentication failures end the loop;
     * every other failure is logged and the next iteration runs as scheduled.
     */
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Live trader is already running");
        }
        if (engine == null) {
            start();
        }
        logger.info("Live trading started: window {} - {} {}, checking every {}s",
            config.getTradingStartTime(), config.getTradingEndTime(), config.getTradingZone(),
            config.getCheckIntervalSeconds());
        try {
            while (running.get()) {
                try {
                    runIteration();
                } catch (BrokerAuthenticationException e) {
                    logger.error("Broker authentication failed, stopping: {}", e.getMessage());
                    throw e;
                } catch (RuntimeException e) {
                    logger.error("Iteration failed: {}", e.getMessage(), e);
                }
                if (stopSignal.await(config.getCheckIntervalSeconds(), TimeUnit.SECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Live loop interrupted");
        } finally {
            running.set(false);
            entriesHalted.set(true);
            persistPositions();
            logOpenPositions();
        }
    }

    /**
     * Halt new entries immediately and end the loop after the current iteration.
     * Open positions are kept; nothing is liquidated.
     */
    public void stop() {
        if (entriesHalted.compareAndSet(false, true)) {
            logger.warn("Stop requested: new entries halted, {} open positions kept", ledger.openCount());
        }
        running.set(false);
        stopSignal.countDown();
    }

    // ==================== Iteration ====================

    public LiveIterationSummary runIteration() {
        if (engine == null) {
            throw new IllegalStateException("start() must run before the first iteration");
        }
        Instant now = clock.instant();
        if (!hoursWindow.isOpen(now)) {
            logger.info("Outside trading hours ({}), waiting", hoursWindow.closedReason(now));
            return LiveIterationSummary.closed(now);
        }
        LocalDate date = hoursWindow.tradingDate(now);
        Map<String, IndicatorSeries> universe = buildUniverse(date);

        List<ClosedTrade> exits = new ArrayList<>();
        for (PendingExit pending : engine.findExits(date, universe)) {
            exitPosition(pending).ifPresent(exits::add);
        }

        double equity = engine.markToMarket(date, universe);
        governor.updateEquity(date, equity);

        List<Position> entries = new ArrayList<>();
        if (entriesHalted.get()) {
            logger.debug("Entries halted, skipping admission");
        } else if (engine.entriesAllowed(date)) {
            for (EntryCandidate candidate : engine.rankCandidates(date, universe)) {
                if (entriesHalted.get() || !ledger.hasFreeSlot()) {
                    break;
                }
                enterPosition(date, candidate).ifPresent(entries::add);
            }
        }

        double closingEquity = engine.recordEquity(date);
        if (!exits.isEmpty() || !entries.isEmpty()) {
            persistPositions();
        }
        logger.info("Iteration {}: {} quotes, {} exits, {} entries, {} open, equity {}", date,
            universe.size(), exits.size(), entries.size(), ledger.openCount(),
            String.format("%,.2f", closingEquity));
        return new LiveIterationSummary(now, true, universe.size(), exits, entries, closingEquity);
    }

    /**
     * Today's bar for every instrument with a fresh quote, folded into the
     * daily history. A failed quote leaves the instrument out, so it gets
     * neither a signal nor an exit check.
     */
    private Map<String, IndicatorSeries> buildUniverse(LocalDate date) {
        Map<String, IndicatorSeries> universe = new TreeMap<>();
        for (Map.Entry<String, PriceSeries> entry : new TreeMap<>(history).entrySet()) {
            String symbol = entry.getKey();
            Quote quote;
            try {
                quote = marketData.fetchQuote(symbol);
                if (!quote.hasPrice()) {
                    throw new ExternalServiceException("market-data", "quote without price for " + symbol);
                }
            } catch (BrokerAuthenticationException e) {
                throw e;
            } catch (ExternalServiceException e) {
                logger.debug("{}: quote failed - {}", symbol, e.getMessage());
                try {
                    gapTracker.recordMiss(symbol, date);
                } catch (DataGapException gap) {
                    logger.atWarn()
                        .addKeyValue("symbol", symbol)
                        .addKeyValue("misses", gap.getConsecutiveMisses())
                        .log("Data gap: {}", gap.getMessage());
                }
                continue;
            }
            gapTracker.recordHit(symbol);
            Bar today = liveBar(entry.getValue(), date, quote);
            PriceSeries series = entry.getValue().withBar(today);
            // the last quote of a day stays as that day's close once the date rolls over
            history.put(symbol, series);
            universe.put(symbol, strategy.prepare(series));
        }
        return universe;
    }

    /**
     * Quote as a daily bar. Open, range and volume carry over from an earlier
     * quote of the same day when the history already holds one.
     */
    static Bar liveBar(PriceSeries series, LocalDate date, Quote quote) {
        double last = quote.last();
        double open = last;
        double high = Math.max(quote.highOrLast(), last);
        double low = Math.min(quote.lowOrLast(), last);
        long volume = 0L;
        if (!series.isEmpty() && series.last().date().equals(date)) {
            Bar earlier = series.last();
            open = earlier.open();
            high = Math.max(high, earlier.high());
            low = Math.min(low, earlier.low());
            volume = earlier.volume();
        }
        high = Math.max(high, open);
        low = Math.min(low, open);
        return new Bar(date, open, high, low, last, volume);
    }

    private Optional<ClosedTrade> exitPosition(PendingExit pending) {
        Position position = pending.position();
        ExitDecision decision = pending.decision();
        var request = new ApprovalRequest(TradeAction.SELL, position.symbol(), position.quantity(),
            decision.price(), decision.reason().label());
        if (!awaitApproval(request)) {
            logger.warn("{}: exit ({}) not approved, position kept", position.symbol(), decision.reason().label());
            return Optional.empty();
        }

        OrderResult result;
        try {
            result = broker.placeOrder(OrderRequest.sell(position.symbol(), position.quantity(),
                decision.price(), decision.reason().label()));
        } catch (BrokerAuthenticationException e) {
            throw e;
        } catch (ExternalServiceException e) {
            logger.error("{}: sell order failed, position kept - {}", position.symbol(), e.getMessage());
            return Optional.empty();
        }
        if (!result.isFilled()) {
            logger.error("{}: sell order {} rejected, position kept - {}", position.symbol(),
                result.orderId(), result.message());
            return Optional.empty();
        }
        PendingExit filled = new PendingExit(position, pending.date(),
            new ExitDecision(decision.reason(), result.fillPrice()));
        return Optional.of(engine.executeExit(filled));
    }

    private Optional<Position> enterPosition(LocalDate date, EntryCandidate candidate) {
        long quantity = ledger.quantityFor(candidate.price());
        if (quantity <= 0) {
            return Optional.empty();
        }
        var request = new ApprovalRequest(TradeAction.BUY, candidate.symbol(), quantity, candidate.price(),
            String.format("Entry signal (strength %.2f)", candidate.strength()));
        if (!awaitApproval(request)) {
            logger.info("{}: entry not approved", candidate.symbol());
            return Optional.empty();
        }
        if (entriesHalted.get()) {
            logger.info("{}: approved after stop, entry dropped", candidate.symbol());
            return Optional.empty();
        }

        // Slots, cooldown and capital may have changed while the approval was pending
        Optional<Position> reserved = engine.reserveEntry(date, candidate);
        if (reserved.isEmpty()) {
            logger.info("{}: entry no longer admissible after approval", candidate.symbol());
            return Optional.empty();
        }
        Position position = reserved.get();
        try {
            OrderResult result = broker.placeOrder(OrderRequest.buy(position.symbol(), position.quantity(),
                position.entryPrice(), request.reason()));
            if (!result.isFilled()) {
                logger.error("{}: buy order {} rejected - {}", position.symbol(), result.orderId(), result.message());
                ledger.revertEntry(position.symbol());
                return Optional.empty();
            }
        } catch (ExternalServiceException e) {
            ledger.revertEntry(position.symbol());
            if (e instanceof BrokerAuthenticationException) {
                throw e;
            }
            logger.error("{}: buy order failed - {}", position.symbol(), e.getMessage());
            return Optional.empty();
        }
        engine.confirmEntry(position, date);
        return Optional.of(position);
    }

    private boolean awaitApproval(ApprovalRequest request) {
        if (!config.isRequireManualApproval()) {
            return true;
        }
        CompletableFuture<Boolean> answer = approver.requestApproval(request).toCompletableFuture();
        try {
            return Boolean.TRUE.equals(answer.get(config.getApprovalTimeoutSeconds(), TimeUnit.SECONDS));
        } catch (TimeoutException e) {
            answer.cancel(true);
            logger.warn("No approval within {}s for {}, treated as rejected",
                config.getApprovalTimeoutSeconds(), request.describe());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | CancellationException e) {
            logger.warn("Approval failed for {}: {}", request.describe(), e.getMessage());
            return false;
        }
    }

    private int historyDays() {
        int longest = IntStream.of(config.getMaLongPeriod(), config.getMacdSlow() + config.getMacdSignal(),
            config.getRegimeMaPeriod(), config.getRsiPeriod() + 1, config.getBollingerPeriod(),
            config.getAtrLookback() + config.getAtrPeriod()).max().orElse(1);
        return longest * 2 + 10;
    }

    private void persistPositions() {
        if (positionStore == null) {
            return;
        }
        try {
            positionStore.save(ledger.openPositions());
        } catch (ExternalServiceException e) {
            logger.error("Failed to persist open positions: {}", e.getMessage());
        }
    }

    private void logOpenPositions() {
        for (Position position : ledger.openPositions()) {
            logger.info("   OPEN {} {} @ {} since {} (SL {}, TP {})", position.symbol(), position.quantity(),
                String.format("%.2f", position.entryPrice()), position.entryDate(),
                String.format("%.2f", position.stopLossPrice()), String.format("%.2f", position.takeProfitPrice()));
        }
    }

    // ==================== Accessors ====================

    public PortfolioLedger getLedger() {
        return ledger;
    }

    public RiskGovernor getGovernor() {
        return governor;
    }

    public DataGapTracker getGapTracker() {
        return gapTracker;
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isEntriesHalted() {
        return entriesHalted.get();
    }
}
