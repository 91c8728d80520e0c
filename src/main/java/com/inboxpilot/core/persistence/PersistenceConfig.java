package com.inboxpilot.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Chooses the snapshot store and side-effect ledger.
 * <p>
 * {@code inbox.persistence.mode=jdbc} stores both in PostgreSQL through the configured
 * {@link DataSource}; the default {@code memory} keeps them in process (development and tests).
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Configuration
    @ConditionalOnProperty(name = "inbox.persistence.mode", havingValue = "jdbc")
    static class JdbcPersistence {

        @Bean
        public ConversationSnapshotStore jdbcSnapshotStore(DataSource dataSource) throws SQLException {
            log.info("Configuring JDBC conversation snapshot store (PostgreSQL)");
            var store = new JdbcConversationSnapshotStore(dataSource);
            store.createTables();
            return store;
        }

        @Bean
        public SideEffectLedger jdbcSideEffectLedger(DataSource dataSource) throws SQLException {
            var ledger = new JdbcSideEffectLedger(dataSource);
            ledger.createTables();
            return ledger;
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "inbox.persistence.mode", havingValue = "memory", matchIfMissing = true)
    static class MemoryPersistence {

        @Bean
        public ConversationSnapshotStore memorySnapshotStore() {
            log.info("Using in-memory snapshot store (conversations will not survive a restart)");
            return new InMemoryConversationSnapshotStore();
        }

        @Bean
        public SideEffectLedger memorySideEffectLedger() {
            return new InMemorySideEffectLedger();
        }
    }
}
