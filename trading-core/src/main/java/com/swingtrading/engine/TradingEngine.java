package com.swingtrading.engine;

import com.swingtrading.analysis.MarketRegimeFilter;
import com.swingtrading.config.TradingConfig;
import com.swingtrading.error.DataGapException;
import com.swingtrading.error.InsufficientCapitalException;
import com.swingtrading.exits.ExitResolver;
import com.swingtrading.exits.PendingExit;
import com.swingtrading.model.Bar;
import com.swingtrading.model.ClosedTrade;
import com.swingtrading.model.EquityPoint;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.Position;
import com.swingtrading.model.TradeEvent;
import com.swingtrading.persistence.TradeEventPublisher;
import com.swingtrading.portfolio.PortfolioLedger;
import com.swingtrading.risk.RiskGovernor;
import com.swingtrading.strategy.EntrySignal;
import com.swingtrading.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-bar entry, exit and risk steps shared by the backtest and live drivers.
 * <p>
 * Bar order: exits, mark-to-market, risk check, entry admission, equity record.
 * Each engine owns its ledger and governor; nothing is shared between runs.
 */
public final class TradingEngine {
    private static final Logger logger = LoggerFactory.getLogger(TradingEngine.class);

    private static final Comparator<EntryCandidate> CANDIDATE_ORDER =
        Comparator.comparingDouble(EntryCandidate::strength).reversed()
            .thenComparing(EntryCandidate::symbol);

    private final TradingStrategy strategy;
    private final PortfolioLedger ledger;
    private final RiskGovernor governor;
    private final MarketRegimeFilter regimeFilter;
    private final ExitResolver exitResolver;
    private final TradeEventPublisher publisher;
    private final double minSignalStrength;
    private final Clock eventClock;  // null: events carry the bar date

    private final Map<String, Double> lastPrices = new HashMap<>();
    private int dataGaps;

    public TradingEngine(TradingConfig config, TradingStrategy strategy, PortfolioLedger ledger,
                         RiskGovernor governor, MarketRegimeFilter regimeFilter, TradeEventPublisher publisher) {
        this(config, strategy, ledger, governor, regimeFilter, publisher, null);
    }

    /**
     * @param eventClock wall clock stamped on trade events, or null to stamp the bar date
     */
    public TradingEngine(TradingConfig config, TradingStrategy strategy, PortfolioLedger ledger,
                         RiskGovernor governor, MarketRegimeFilter regimeFilter, TradeEventPublisher publisher,
                         Clock eventClock) {
        this.eventClock = eventClock;
        this.strategy = strategy;
        this.ledger = ledger;
        this.governor = governor;
        this.regimeFilter = regimeFilter;
        this.exitResolver = new ExitResolver(config, strategy);
        this.publisher = publisher;
        this.minSignalStrength = config.getMinSignalStrength();
    }

    // ==================== Full bar (backtest) ====================

    /**
     * Run every step for one date without suspension points.
     */
    public BarSummary processBar(LocalDate date, Map<String, IndicatorSeries> universe) {
        List<ClosedTrade> exits = new ArrayList<>();
        for (PendingExit pending : findExits(date, universe)) {
            exits.add(executeExit(pending));
        }

        double equity = markToMarket(date, universe);
        governor.updateEquity(date, equity);

        boolean suspended = governor.isSuspended(date);
        boolean tradeable = regimeFilter.isTradeable(date);
        List<Position> entries = new ArrayList<>();
        if (!suspended && tradeable) {
            for (EntryCandidate candidate : rankCandidates(date, universe)) {
                if (!ledger.hasFreeSlot()) {
                    break;
                }
                executeEntry(date, candidate).ifPresent(entries::add);
            }
        } else {
            logger.debug("{}: entries blocked (suspended={}, tradeable={})", date, suspended, tradeable);
        }

        double closingEquity = recordEquity(date);
        return new BarSummary(date, exits, entries, suspended, tradeable, closingEquity);
    }

    // ==================== Steps ====================

    /**
     * Update each open position's highest price with today's high and evaluate the
     * exit chain. Positions without a bar today are skipped.
     */
    public List<PendingExit> findExits(LocalDate date, Map<String, IndicatorSeries> universe) {
        List<PendingExit> pending = new ArrayList<>();
        for (Position position : ledger.openPositions()) {
            String symbol = position.symbol();
            int index;
            try {
                index = requireBar(universe.get(symbol), symbol, date);
            } catch (DataGapException e) {
                dataGaps++;
                logger.debug("Exit check skipped: {}", e.getMessage());
                continue;
            }
            exitResolver.check(ledger, position, universe.get(symbol), index).ifPresent(pending::add);
        }
        return pending;
    }

    /**
     * Settle an exit in the ledger, inform the governor and publish the event.
     */
    public ClosedTrade executeExit(PendingExit pending) {
        ClosedTrade trade = ledger.close(pending.symbol(), pending.date(), pending.decision().price(),
            pending.decision().reason(), regimeFilter.classify(pending.date()));
        governor.recordTrade(trade);
        publisher.publish(TradeEvent.exit(trade, strategy.name(), eventTime(pending.date())));
        return trade;
    }

    /**
     * Portfolio value with each open position at its latest known close.
     */
    public double markToMarket(LocalDate date, Map<String, IndicatorSeries> universe) {
        for (Map.Entry<String, IndicatorSeries> entry : universe.entrySet()) {
            int index = entry.getValue().indexOf(date);
            if (index >= 0) {
                lastPrices.put(entry.getKey(), entry.getValue().bar(index).close());
            }
        }
        return ledger.totalValue(lastPrices);
    }

    /**
     * Whether new entries may be admitted on {@code date}.
     */
    public boolean entriesAllowed(LocalDate date) {
        return !governor.isSuspended(date) && regimeFilter.isTradeable(date);
    }

    /**
     * Instruments with a strong enough signal that are free to enter, strongest
     * first, ties broken by symbol.
     */
    public List<EntryCandidate> rankCandidates(LocalDate date, Map<String, IndicatorSeries> universe) {
        List<EntryCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, IndicatorSeries> entry : new TreeMap<>(universe).entrySet()) {
            String symbol = entry.getKey();
            IndicatorSeries series = entry.getValue();
            int index = series.indexOf(date);
            if (index < 0 || ledger.hasOpenPosition(symbol) || ledger.isInCooldown(symbol, date)) {
                continue;
            }
            EntrySignal signal = strategy.signal(series, index);
            if (!signal.signal()) {
                continue;
            }
            if (signal.strength() < minSignalStrength) {
                logger.debug("{}: signal on {} below minimum strength ({} < {})", symbol, date,
                    String.format("%.3f", signal.strength()), String.format("%.3f", minSignalStrength));
                continue;
            }
            Bar bar = series.bar(index);
            candidates.add(new EntryCandidate(symbol, signal.strength(), bar.close(),
                strategy.entrySnapshot(series, index)));
        }
        candidates.sort(CANDIDATE_ORDER);
        return candidates;
    }

    /**
     * Open a position through the ledger, which re-checks slots, cooldown and capital,
     * and publish the entry.
     */
    public Optional<Position> executeEntry(LocalDate date, EntryCandidate candidate) {
        Optional<Position> position = reserveEntry(date, candidate);
        position.ifPresent(p -> confirmEntry(p, date));
        return position;
    }

    /**
     * Claim a slot and capital for the candidate without publishing. The live
     * driver reserves before sending the order and reverts if the order fails.
     */
    public Optional<Position> reserveEntry(LocalDate date, EntryCandidate candidate) {
        try {
            return ledger.open(candidate.symbol(), date, candidate.price(),
                candidate.strength(), candidate.snapshot());
        } catch (InsufficientCapitalException e) {
            logger.info("{}: entry skipped on {} - {}", candidate.symbol(), date, e.getMessage());
            return Optional.empty();
        }
    }

    public void confirmEntry(Position position, LocalDate date) {
        publisher.publish(TradeEvent.entry(position, strategy.name(), eventTime(date)));
    }

    /**
     * Append the closing portfolio value for {@code date} to the equity curve.
     */
    public double recordEquity(LocalDate date) {
        double equity = ledger.totalValue(lastPrices);
        ledger.recordEquity(new EquityPoint(date, equity, ledger.getFreeCapital(), ledger.openCount()));
        return equity;
    }

    /**
     * Record a price observed outside a bar series, used for live mark-to-market.
     */
    public void observePrice(String symbol, double price) {
        lastPrices.put(symbol, price);
    }

    private static int requireBar(IndicatorSeries series, String symbol, LocalDate date) {
        int index = series == null ? -1 : series.indexOf(date);
        if (index < 0) {
            throw new DataGapException(symbol, date, 1);
        }
        return index;
    }

    private Instant eventTime(LocalDate date) {
        return eventClock != null ? eventClock.instant() : TradeEvent.barTimestamp(date);
    }

    public TradingStrategy getStrategy() {
        return strategy;
    }

    public PortfolioLedger getLedger() {
        return ledger;
    }

    public RiskGovernor getGovernor() {
        return governor;
    }

    public MarketRegimeFilter getRegimeFilter() {
        return regimeFilter;
    }

    public Map<String, Double> getLastPrices() {
        return Map.copyOf(lastPrices);
    }

    /** Bars skipped because a held instrument had no price that day. */
    public int getDataGaps() {
        return dataGaps;
    }
}
