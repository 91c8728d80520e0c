package com.inboxpilot.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link SideEffectLedger}. Reservation relies on the primary key:
 * {@code ON CONFLICT DO NOTHING} inserts at most one row per key.
 */
public class JdbcSideEffectLedger implements SideEffectLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcSideEffectLedger.class);

    static final String TABLE_NAME = "inbox_side_effects";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                effect_key  VARCHAR(512) PRIMARY KEY,
                state       VARCHAR(16)  NOT NULL,
                result      TEXT,
                updated_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String RESERVE_SQL = """
            INSERT INTO %s (effect_key, state) VALUES (?, 'RESERVED')
            ON CONFLICT (effect_key) DO NOTHING
            """.formatted(TABLE_NAME);

    private static final String COMPLETE_SQL = """
            UPDATE %s SET state = 'COMPLETED', result = ?, updated_at = CURRENT_TIMESTAMP
            WHERE effect_key = ?
            """.formatted(TABLE_NAME);

    private static final String RELEASE_SQL = """
            DELETE FROM %s WHERE effect_key = ? AND state = 'RESERVED'
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT effect_key, state, result FROM %s WHERE effect_key = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcSideEffectLedger(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Side-effect table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<Entry> find(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Entry(rs.getString("effect_key"),
                            State.valueOf(rs.getString("state")), rs.getString("result")));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read side effect " + key, e);
        }
        return Optional.empty();
    }

    @Override
    public boolean reserve(String key) {
        return executeUpdate(RESERVE_SQL, "reserve", key) == 1;
    }

    @Override
    public void complete(String key, String result) {
        executeUpdate(COMPLETE_SQL, "complete", result, key);
    }

    @Override
    public void release(String key) {
        executeUpdate(RELEASE_SQL, "release", key);
    }

    private int executeUpdate(String sql, String operation, String... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            int rows = stmt.executeUpdate();
            log.debug("Ledger {} affected {} row(s)", operation, rows);
            return rows;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to " + operation + " side effect", e);
        }
    }
}
