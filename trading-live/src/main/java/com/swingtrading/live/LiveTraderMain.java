package com.swingtrading.live;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.error.BrokerAuthenticationException;
import com.swingtrading.error.InvalidConfigurationException;
import com.swingtrading.live.approval.AutoApprover;
import com.swingtrading.live.approval.ConsoleApprover;
import com.swingtrading.live.approval.TradeApprover;
import com.swingtrading.live.broker.NseQuoteClient;
import com.swingtrading.live.broker.PaperBrokerGateway;
import com.swingtrading.live.broker.ResilientMarketDataProvider;
import com.swingtrading.live.persistence.PositionStore;
import com.swingtrading.live.persistence.TradeDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Paper-trading entry point: NSE quotes, daily history from CSV, console approvals.
 */
public final class LiveTraderMain {
    private static final Logger logger = LoggerFactory.getLogger(LiveTraderMain.class);

    private LiveTraderMain() {}

    // Usage: LiveTraderMain <history-dir> [config.properties]
    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: LiveTraderMain <history-dir> [config.properties]");
            System.exit(2);
        }
        TradingConfig config = args.length > 1 ? TradingConfig.load(Path.of(args[1])) : TradingConfig.load();
        try {
            config.validate();
        } catch (InvalidConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getViolations());
            System.exit(1);
            return;
        }
        config.logSummary();

        Clock clock = Clock.system(config.getTradingZone());
        var marketData = new ResilientMarketDataProvider(
            new NseQuoteClient(Path.of(args[0]), clock), new SimpleMeterRegistry());
        var positionStore = new PositionStore(Path.of(config.getProperty("POSITIONS_FILE", "open_positions.json")));

        ConsoleApprover consoleApprover = config.isRequireManualApproval() ? new ConsoleApprover() : null;
        TradeApprover approver = consoleApprover != null ? consoleApprover : new AutoApprover();

        try (var database = new TradeDatabase(config.getProperty("TRADE_DB_PATH", "trades.db"))) {
            var trader = new LiveTrader(config, marketData, new PaperBrokerGateway(), approver,
                positionStore, List.of(database), clock);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received, halting entries");
                trader.stop();
            }, "live-shutdown"));

            trader.start();
            trader.run();

            var stats = database.getTradeStatistics();
            logger.info("Session closed: {} closed trades, win rate {}%, realized P&L {}",
                stats.closedTrades(), String.format("%.1f", stats.winRate() * 100),
                String.format("%,.2f", stats.totalPnL()));
        } catch (BrokerAuthenticationException e) {
            logger.error("Fatal: {}", e.getMessage());
            System.exit(1);
        } finally {
            if (consoleApprover != null) {
                consoleApprover.close();
            }
        }
    }
}
