package com.swingtrading.risk;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.model.ClosedTrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Portfolio circuit breakers. Either trigger suspends new entries for a fixed
 * number of days; exits continue while suspended.
 * <ul>
 *   <li>Drawdown: drawdown from peak equity reaches the limit while the breaker is armed.
 *       It disarms on tripping and re-arms after a winning trade or once drawdown
 *       recovers below the limit.</li>
 *   <li>Consecutive losses: the loss streak reaches the limit. The streak resets on
 *       a win and is consumed by the trip.</li>
 * </ul>
 * Suspension ends only when its resume date is reached. A trip while a resume
 * date is still pending never moves that date.
 */
public final class RiskGovernor {
    private static final Logger logger = LoggerFactory.getLogger(RiskGovernor.class);

    private final double maxDrawdown;
    private final int maxConsecutiveLosses;
    private final int cooldownDays;

    private double peakEquity;
    private double currentEquity;
    private int consecutiveLosses;
    private boolean drawdownArmed = true;
    private LocalDate suspendedUntil;
    private final List<BreakerTrip> trips = new ArrayList<>();

    public RiskGovernor(TradingConfig config) {
        this(config.getInitialCapital(), config.getMaxDrawdownDecimal(),
            config.getMaxConsecutiveLosses(), config.getCircuitBreakerCooldownDays());
    }

    public RiskGovernor(double initialEquity, double maxDrawdown, int maxConsecutiveLosses, int cooldownDays) {
        this.peakEquity = initialEquity;
        this.currentEquity = initialEquity;
        this.maxDrawdown = maxDrawdown;
        this.maxConsecutiveLosses = maxConsecutiveLosses;
        this.cooldownDays = cooldownDays;

        logger.info("RiskGovernor initialized: MaxDD={}%, MaxLosses={}, Cooldown={} days",
            String.format("%.1f", maxDrawdown * 100), maxConsecutiveLosses, cooldownDays);
    }

    /**
     * Feed the marked-to-market equity for {@code date}.
     */
    public synchronized void updateEquity(LocalDate date, double equity) {
        currentEquity = equity;
        if (equity > peakEquity) {
            peakEquity = equity;
        }
        double drawdown = getCurrentDrawdown();
        if (drawdown >= maxDrawdown) {
            if (drawdownArmed) {
                drawdownArmed = false;
                trip(BreakerType.DRAWDOWN, date, drawdown);
            }
        } else if (!drawdownArmed) {
            drawdownArmed = true;
            logger.info("Drawdown recovered to {}%, breaker re-armed", String.format("%.2f", drawdown * 100));
        }
    }

    /**
     * Feed a closed trade. Losses extend the streak, wins reset it.
     */
    public synchronized void recordTrade(ClosedTrade trade) {
        if (trade.isWin()) {
            consecutiveLosses = 0;
            drawdownArmed = true;
        } else if (trade.isLoss()) {
            consecutiveLosses++;
            logger.debug("Consecutive losses: {}/{}", consecutiveLosses, maxConsecutiveLosses);
            if (consecutiveLosses >= maxConsecutiveLosses) {
                int streak = consecutiveLosses;
                consecutiveLosses = 0;
                trip(BreakerType.CONSECUTIVE_LOSSES, trade.exitDate(), getCurrentDrawdown(), streak);
            }
        }
    }

    /**
     * New entries are blocked on {@code date}. A suspension whose resume date
     * has been reached is cleared here.
     */
    public synchronized boolean isSuspended(LocalDate date) {
        if (suspendedUntil == null) {
            return false;
        }
        if (date.isBefore(suspendedUntil)) {
            return true;
        }
        logger.info("Circuit breaker cooldown over on {}, entries resume", date);
        suspendedUntil = null;
        return false;
    }

    private void trip(BreakerType type, LocalDate date, double drawdown) {
        trip(type, date, drawdown, consecutiveLosses);
    }

    private void trip(BreakerType type, LocalDate date, double drawdown, int streak) {
        if (suspendedUntil == null || !suspendedUntil.isAfter(date)) {
            suspendedUntil = date.plusDays(cooldownDays);
        }
        trips.add(new BreakerTrip(type, date, suspendedUntil, drawdown, streak));
        logger.atWarn()
            .addKeyValue("breaker", type)
            .addKeyValue("drawdownPct", String.format("%.2f", drawdown * 100))
            .addKeyValue("consecutiveLosses", streak)
            .addKeyValue("resumeDate", suspendedUntil)
            .log("CIRCUIT BREAKER: {} tripped on {}, entries suspended until {}", type, date, suspendedUntil);
    }

    public synchronized double getCurrentDrawdown() {
        if (peakEquity <= 0) {
            return 0.0;
        }
        return Math.max(0.0, (peakEquity - currentEquity) / peakEquity);
    }

    public synchronized double getPeakEquity() {
        return peakEquity;
    }

    public synchronized int getConsecutiveLosses() {
        return consecutiveLosses;
    }

    public synchronized boolean isDrawdownArmed() {
        return drawdownArmed;
    }

    public synchronized Optional<LocalDate> getSuspendedUntil() {
        return Optional.ofNullable(suspendedUntil);
    }

    public synchronized List<BreakerTrip> getTrips() {
        return List.copyOf(trips);
    }
}
