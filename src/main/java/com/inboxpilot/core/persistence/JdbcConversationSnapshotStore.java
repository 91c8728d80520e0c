package com.inboxpilot.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link ConversationSnapshotStore} that persists snapshots to a PostgreSQL table.
 * <p>
 * Each conversation is one row holding the JSON-serialized snapshot plus the columns the
 * timeout sweep queries on. The table {@code inbox_conversations} is created by {@link #createTables()}.
 */
public class JdbcConversationSnapshotStore implements ConversationSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcConversationSnapshotStore.class);

    static final String TABLE_NAME = "inbox_conversations";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                conversation_id VARCHAR(255) PRIMARY KEY,
                status          VARCHAR(32)  NOT NULL,
                epoch           INTEGER      NOT NULL,
                awaiting        BOOLEAN      NOT NULL,
                archived        BOOLEAN      NOT NULL DEFAULT FALSE,
                snapshot        TEXT         NOT NULL,
                updated_at      TIMESTAMP    NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (conversation_id, status, epoch, awaiting, archived, snapshot, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (conversation_id)
            DO UPDATE SET status = EXCLUDED.status,
                          epoch = EXCLUDED.epoch,
                          awaiting = EXCLUDED.awaiting,
                          archived = EXCLUDED.archived,
                          snapshot = EXCLUDED.snapshot,
                          updated_at = EXCLUDED.updated_at
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT snapshot FROM %s WHERE conversation_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_AWAITING_SQL = """
            SELECT snapshot FROM %s
            WHERE awaiting = TRUE AND archived = FALSE
            ORDER BY conversation_id
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcConversationSnapshotStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = snapshotMapper();
    }

    static ObjectMapper snapshotMapper() {
        var mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Creates the snapshot table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Snapshot table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void save(ConversationSnapshot snapshot) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, snapshot.conversationId());
            stmt.setString(2, snapshot.status().name());
            stmt.setInt(3, snapshot.epoch());
            stmt.setBoolean(4, snapshot.isAwaitingInput());
            stmt.setBoolean(5, snapshot.archived());
            stmt.setString(6, serialize(snapshot));
            stmt.setTimestamp(7, Timestamp.from(snapshot.updatedAt()));
            stmt.executeUpdate();
            log.debug("Saved snapshot for '{}' (epoch {}, status {})",
                    snapshot.conversationId(), snapshot.epoch(), snapshot.status());
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save snapshot for " + snapshot.conversationId(), e);
        }
    }

    @Override
    public Optional<ConversationSnapshot> load(String conversationId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, conversationId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(deserialize(rs.getString("snapshot")));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load snapshot for " + conversationId, e);
        }
        return Optional.empty();
    }

    @Override
    public List<ConversationSnapshot> findAwaiting() {
        List<ConversationSnapshot> awaiting = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_AWAITING_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                awaiting.add(deserialize(rs.getString("snapshot")));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list awaiting conversations", e);
        }
        return awaiting;
    }

    @Override
    public void archive(String conversationId, Instant at) {
        load(conversationId).ifPresent(snapshot -> save(snapshot.archive(at)));
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    String serialize(ConversationSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot " + snapshot.conversationId(), e);
        }
    }

    ConversationSnapshot deserialize(String json) {
        try {
            return objectMapper.readValue(json, ConversationSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize conversation snapshot", e);
        }
    }
}
