package com.swingtrading.live.persistence;

import com.swingtrading.error.ExternalServiceException;
import com.swingtrading.model.TradeAction;
import com.swingtrading.model.TradeEvent;
import com.swingtrading.persistence.TradeEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite store for trade events.
 * <p>
 * Thread-safety: StampedLock with optimistic reads for queries and write locks
 * for inserts. Write failures surface as {@link ExternalServiceException};
 * the event publisher logs and counts them.
 */
public final class TradeDatabase implements TradeEventSink, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TradeDatabase.class);
    private static final String SERVICE = "trade-db";

    private final Connection connection;
    private final StampedLock lock = new StampedLock();

    public TradeDatabase(String dbPath) {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            createTables();
            logger.info("Trade database initialized: {}", dbPath);
        } catch (SQLException e) {
            throw new ExternalServiceException(SERVICE, "failed to open " + dbPath, e);
        }
    }

    private void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS trade_events (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                symbol TEXT NOT NULL,
                action TEXT NOT NULL,
                price REAL NOT NULL,
                quantity INTEGER NOT NULL,
                capital REAL NOT NULL,
                reason TEXT,
                event_time TEXT NOT NULL,
                realized_pnl REAL,
                strategy TEXT,
                created_at TEXT DEFAULT CURRENT_TIMESTAMP
            )
            """;
        String createIndexSql = """
            CREATE INDEX IF NOT EXISTS idx_symbol_action
            ON trade_events(symbol, action)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
            stmt.execute(createIndexSql);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void record(TradeEvent event) {
        String sql = """
            INSERT INTO trade_events (symbol, action, price, quantity, capital, reason, event_time, realized_pnl, strategy)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, event.symbol());
            stmt.setString(2, event.action().name());
            stmt.setDouble(3, event.price());
            stmt.setLong(4, event.quantity());
            stmt.setDouble(5, event.capital());
            stmt.setString(6, event.reason());
            stmt.setString(7, event.timestamp().toString());
            if (event.realizedPnl() == null) {
                stmt.setNull(8, Types.REAL);
            } else {
                stmt.setDouble(8, event.realizedPnl());
            }
            stmt.setString(9, event.strategy());
            stmt.executeUpdate();

            logger.atDebug()
                .addKeyValue("symbol", event.symbol())
                .addKeyValue("action", event.action())
                .addKeyValue("price", event.price())
                .log("Trade event stored");
        } catch (SQLException e) {
            throw new ExternalServiceException(SERVICE, "failed to store " + event.action() + " " + event.symbol(), e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Sum of realized P&L over all SELL events, optimistic read first.
     */
    public double getTotalPnL() {
        String sql = "SELECT COALESCE(SUM(realized_pnl), 0) AS total FROM trade_events WHERE action = 'SELL'";

        long stamp = lock.tryOptimisticRead();
        double result = queryDouble(sql);
        if (!lock.validate(stamp)) {
            stamp = lock.readLock();
            try {
                result = queryDouble(sql);
            } finally {
                lock.unlockRead(stamp);
            }
        }
        return result;
    }

    public int countEvents(TradeAction action) {
        String sql = "SELECT COUNT(*) FROM trade_events WHERE action = '" + action.name() + "'";

        long stamp = lock.tryOptimisticRead();
        int result = (int) queryDouble(sql);
        if (!lock.validate(stamp)) {
            stamp = lock.readLock();
            try {
                result = (int) queryDouble(sql);
            } finally {
                lock.unlockRead(stamp);
            }
        }
        return result;
    }

    public record TradeStatistics(int closedTrades, double winRate, double totalPnL) {}

    public TradeStatistics getTradeStatistics() {
        int closed = countEvents(TradeAction.SELL);
        double pnl = getTotalPnL();
        String winSql = "SELECT COUNT(*) FROM trade_events WHERE action = 'SELL' AND realized_pnl > 0";

        long stamp = lock.readLock();
        try {
            int wins = (int) queryDouble(winSql);
            return new TradeStatistics(closed, closed > 0 ? (double) wins / closed : 0.0, pnl);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private double queryDouble(String sql) {
        try (var stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getDouble(1) : 0.0;
        } catch (SQLException e) {
            throw new ExternalServiceException(SERVICE, "query failed", e);
        }
    }

    @Override
    public void close() {
        long stamp = lock.writeLock();
        try {
            connection.close();
            logger.info("Trade database closed");
        } catch (SQLException e) {
            logger.error("Error closing trade database", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }
}
