package com.swingtrading.portfolio;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.error.InsufficientCapitalException;
import com.swingtrading.model.ClosedTrade;
import com.swingtrading.model.EquityPoint;
import com.swingtrading.model.ExitReason;
import com.swingtrading.model.MarketRegime;
import com.swingtrading.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Single owner of capital and position slots for one run.
 * <p>
 * Invariant at every bar boundary: {@code freeCapital + committed(open) == initialCapital + realizedPnl}.
 * Every mutator is synchronized so the live driver can re-validate slots
 * and capital at order submission, after an approval that may have taken minutes.
 */
public final class PortfolioLedger {
    private static final Logger logger = LoggerFactory.getLogger(PortfolioLedger.class);

    private final double initialCapital;
    private final int maxPositions;
    private final SizingMode sizingMode;
    private final double costDecimal;
    private final double stopLossDecimal;
    private final double takeProfitDecimal;
    private final int reentryCooldownDays;

    private double freeCapital;
    private double realizedPnl;
    private final TreeMap<String, Position> openPositions = new TreeMap<>();  // sorted for deterministic iteration
    private final Map<String, LocalDate> cooldownUntil = new HashMap<>();
    private final List<ClosedTrade> closedTrades = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    public PortfolioLedger(TradingConfig config) {
        this(config.getInitialCapital(), config.getMaxPositions(), config.getSizingMode(),
            config.getTransactionCostDecimal(), config.getStopLossDecimal(),
            config.getTakeProfitDecimal(), config.getReentryCooldownDays());
    }

    public PortfolioLedger(double initialCapital, int maxPositions, SizingMode sizingMode, double costDecimal,
                           double stopLossDecimal, double takeProfitDecimal, int reentryCooldownDays) {
        if (initialCapital <= 0 || maxPositions < 1) {
            throw new IllegalArgumentException("Capital must be positive and maxPositions at least 1");
        }
        this.initialCapital = initialCapital;
        this.maxPositions = maxPositions;
        this.sizingMode = sizingMode;
        this.costDecimal = costDecimal;
        this.stopLossDecimal = stopLossDecimal;
        this.takeProfitDecimal = takeProfitDecimal;
        this.reentryCooldownDays = reentryCooldownDays;
        this.freeCapital = initialCapital;

        logger.info("Ledger initialized: {} capital, {} slots, {} per position",
            String.format("%,.2f", initialCapital), maxPositions, String.format("%,.2f", capitalPerPosition()));
    }

    // ==================== Sizing ====================

    /**
     * Allocation for the next entry. Never derived from free capital.
     */
    public synchronized double capitalPerPosition() {
        double base = sizingMode == SizingMode.REALIZED_EQUITY ? initialCapital + realizedPnl : initialCapital;
        return base / maxPositions;
    }

    /**
     * Whole shares affordable for one allocation at {@code price}, fee included.
     */
    public synchronized long quantityFor(double price) {
        if (price <= 0) {
            return 0;
        }
        return (long) Math.floor(capitalPerPosition() / (price * (1.0 + costDecimal)));
    }

    // ==================== Mutators ====================

    /**
     * Open a position if every admission rule holds at this instant.
     *
     * @return the new position, or empty when the slot limit, an existing
     *         position or a cooldown blocks the instrument
     * @throws InsufficientCapitalException when free capital cannot fund a full allocation
     */
    public synchronized Optional<Position> open(String symbol, LocalDate date, double price,
                                                double signalStrength, Map<String, Double> entrySnapshot) {
        if (openPositions.containsKey(symbol)) {
            logger.debug("{}: already holding a position, entry skipped", symbol);
            return Optional.empty();
        }
        if (openPositions.size() >= maxPositions) {
            logger.debug("{}: all {} slots in use, entry skipped", symbol, maxPositions);
            return Optional.empty();
        }
        if (isInCooldown(symbol, date)) {
            logger.debug("{}: in cooldown until {}, entry skipped", symbol, cooldownUntil.get(symbol));
            return Optional.empty();
        }

        double allocation = capitalPerPosition();
        if (freeCapital < allocation) {
            throw new InsufficientCapitalException(symbol, allocation, freeCapital);
        }
        long quantity = quantityFor(price);
        if (quantity <= 0) {
            throw new InsufficientCapitalException(symbol, price * (1.0 + costDecimal), allocation);
        }

        Position position = Position.open(symbol, date, price, quantity, costDecimal,
            stopLossDecimal, takeProfitDecimal, signalStrength, entrySnapshot);
        openPositions.put(symbol, position);
        freeCapital -= position.capitalCommitted();

        logger.info("{}: BUY {} @ {} on {} (committed {}, SL {}, TP {})", symbol, quantity,
            String.format("%.2f", price), date, String.format("%,.2f", position.capitalCommitted()),
            String.format("%.2f", position.stopLossPrice()), String.format("%.2f", position.takeProfitPrice()));
        return Optional.of(position);
    }

    /**
     * Close the open position for {@code symbol}, settle its P&L and start a
     * cooldown when the trade lost money.
     */
    public synchronized ClosedTrade close(String symbol, LocalDate date, double exitPrice,
                                          ExitReason reason, MarketRegime regime) {
        Position position = openPositions.remove(symbol);
        if (position == null) {
            throw new IllegalStateException("No open position for " + symbol);
        }
        ClosedTrade trade = ClosedTrade.of(position, date, exitPrice, reason, costDecimal, regime);
        freeCapital += trade.netProceeds();
        realizedPnl += trade.pnl();
        closedTrades.add(trade);

        if (trade.isLoss()) {
            LocalDate until = date.plusDays(reentryCooldownDays);
            cooldownUntil.put(symbol, until);
            logger.debug("{}: loss cooldown until {}", symbol, until);
        }

        logger.info("{}: SELL {} @ {} on {} - {} | P&L {} ({}%) after {} days", symbol,
            position.quantity(), String.format("%.2f", exitPrice), date, reason.label(),
            String.format("%,.2f", trade.pnl()), String.format("%.2f", trade.pnlPercent()), trade.daysHeld());
        return trade;
    }

    /**
     * Raise the position's highest price to {@code high} if it exceeds it.
     */
    public synchronized Optional<Position> updateHighestPrice(String symbol, double high) {
        Position position = openPositions.get(symbol);
        if (position == null) {
            return Optional.empty();
        }
        Position updated = position.withHighestPrice(high);
        openPositions.put(symbol, updated);
        return Optional.of(updated);
    }

    /**
     * Undo an entry whose order was rejected or failed. Committed capital returns in full.
     */
    public synchronized void revertEntry(String symbol) {
        Position position = openPositions.remove(symbol);
        if (position == null) {
            logger.warn("{}: nothing to revert", symbol);
            return;
        }
        freeCapital += position.capitalCommitted();
        logger.warn("{}: entry reverted, {} returned to free capital",
            symbol, String.format("%,.2f", position.capitalCommitted()));
    }

    /**
     * Re-register a position persisted by an earlier session.
     */
    public synchronized void restore(Position position) {
        if (!position.isOpen()) {
            throw new IllegalArgumentException("Only open positions can be restored: " + position.symbol());
        }
        if (openPositions.containsKey(position.symbol())) {
            throw new IllegalStateException("Position already open for " + position.symbol());
        }
        if (openPositions.size() >= maxPositions) {
            throw new IllegalStateException("Cannot restore " + position.symbol() + ": all slots in use");
        }
        openPositions.put(position.symbol(), position);
        freeCapital -= position.capitalCommitted();
        logger.info("{}: restored position of {} @ {} from {}", position.symbol(),
            position.quantity(), String.format("%.2f", position.entryPrice()), position.entryDate());
    }

    public synchronized void recordEquity(EquityPoint point) {
        equityCurve.add(point);
    }

    // ==================== Queries ====================

    /**
     * Instrument is blocked from re-entry on {@code date}.
     */
    public synchronized boolean isInCooldown(String symbol, LocalDate date) {
        LocalDate until = cooldownUntil.get(symbol);
        return until != null && date.isBefore(until);
    }

    public synchronized Optional<LocalDate> getCooldownUntil(String symbol) {
        return Optional.ofNullable(cooldownUntil.get(symbol));
    }

    public synchronized boolean hasOpenPosition(String symbol) {
        return openPositions.containsKey(symbol);
    }

    public synchronized Optional<Position> getPosition(String symbol) {
        return Optional.ofNullable(openPositions.get(symbol));
    }

    /** Open positions ordered by symbol. */
    public synchronized List<Position> openPositions() {
        return List.copyOf(openPositions.values());
    }

    public synchronized int openCount() {
        return openPositions.size();
    }

    public synchronized boolean hasFreeSlot() {
        return openPositions.size() < maxPositions;
    }

    /**
     * Portfolio value with each open position valued at its price in {@code prices},
     * or at its entry price when no price is known.
     */
    public synchronized double totalValue(Map<String, Double> prices) {
        double value = freeCapital;
        for (Position position : openPositions.values()) {
            Double price = prices.get(position.symbol());
            value += position.marketValue(price != null ? price : position.entryPrice());
        }
        return value;
    }

    public synchronized double committedCapital() {
        return openPositions.values().stream().mapToDouble(Position::capitalCommitted).sum();
    }

    /** initial capital + settled realized P&L */
    public synchronized double totalCapital() {
        return initialCapital + realizedPnl;
    }

    public synchronized double getFreeCapital() {
        return freeCapital;
    }

    public synchronized double getRealizedPnl() {
        return realizedPnl;
    }

    public double getInitialCapital() {
        return initialCapital;
    }

    public int getMaxPositions() {
        return maxPositions;
    }

    public synchronized List<ClosedTrade> closedTrades() {
        return List.copyOf(closedTrades);
    }

    public synchronized List<EquityPoint> equityCurve() {
        return List.copyOf(equityCurve);
    }
}
