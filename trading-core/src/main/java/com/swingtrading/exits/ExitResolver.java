package com.swingtrading.exits;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.model.Bar;
import com.swingtrading.model.ExitReason;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.Position;
import com.swingtrading.portfolio.PortfolioLedger;
import com.swingtrading.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Exit priority chain for open positions. The first matching rule wins:
 * <ol>
 *   <li>Stop Loss: bar low at or below the stop, fills at the stop</li>
 *   <li>Take Profit: bar high at or above the target, fills at the target</li>
 *   <li>Trailing Stop (after the minimum hold): low at or below highest * (1 - trail)</li>
 *   <li>Death Cross (after the minimum hold): the strategy reports a trend reversal, fills at close</li>
 *   <li>Max Hold Period: held for the maximum number of days, fills at close</li>
 * </ol>
 * A bar that touches both stop and target always exits at the stop.
 */
public final class ExitResolver {
    private static final Logger logger = LoggerFactory.getLogger(ExitResolver.class);

    private final TradingStrategy strategy;
    private final double trailingStopDecimal;
    private final int minHoldDays;
    private final int maxHoldDays;

    public ExitResolver(TradingConfig config, TradingStrategy strategy) {
        this(strategy, config.getTrailingStopDecimal(), config.getMinHoldDays(), config.getMaxHoldDays());
    }

    public ExitResolver(TradingStrategy strategy, double trailingStopDecimal, int minHoldDays, int maxHoldDays) {
        this.strategy = strategy;
        this.trailingStopDecimal = trailingStopDecimal;
        this.minHoldDays = minHoldDays;
        this.maxHoldDays = maxHoldDays;
    }

    /**
     * Evaluate the chain for a position whose highest price already includes this bar's high.
     */
    public Optional<ExitDecision> evaluate(Position position, IndicatorSeries series, int index) {
        Bar bar = series.bar(index);
        long daysHeld = position.daysHeld(bar.date());

        // Priority 1: Stop loss (always highest priority)
        if (bar.low() <= position.stopLossPrice()) {
            return Optional.of(new ExitDecision(ExitReason.STOP_LOSS, position.stopLossPrice()));
        }

        // Priority 2: Take profit
        if (bar.high() >= position.takeProfitPrice()) {
            return Optional.of(new ExitDecision(ExitReason.TAKE_PROFIT, position.takeProfitPrice()));
        }

        if (daysHeld >= minHoldDays) {
            // Priority 3: Trailing stop
            double trailingPrice = position.trailingStopPrice(trailingStopDecimal);
            if (bar.low() <= trailingPrice) {
                return Optional.of(new ExitDecision(ExitReason.TRAILING_STOP, trailingPrice));
            }

            // Priority 4: Trend reversal
            if (strategy.trendReversed(series, index)) {
                return Optional.of(new ExitDecision(ExitReason.DEATH_CROSS, bar.close()));
            }
        }

        // Priority 5: Max hold
        if (daysHeld >= maxHoldDays) {
            return Optional.of(new ExitDecision(ExitReason.MAX_HOLD, bar.close()));
        }

        return Optional.empty();
    }

    /**
     * Raise the ledger's high-water mark for {@code position} with the bar high,
     * then evaluate the chain against the updated position.
     *
     * @return the exit to settle, or empty while the position is held
     */
    public Optional<PendingExit> check(PortfolioLedger ledger, Position position, IndicatorSeries series, int index) {
        Bar bar = series.bar(index);
        Position updated = ledger.updateHighestPrice(position.symbol(), bar.high()).orElse(position);
        Optional<ExitDecision> decision = evaluate(updated, series, index);
        if (decision.isEmpty()) {
            logger.debug("{}: holding on {} (high-water {})", position.symbol(), bar.date(),
                String.format("%.2f", updated.highestPrice()));
            return Optional.empty();
        }
        return Optional.of(new PendingExit(updated, bar.date(), decision.get()));
    }
}
