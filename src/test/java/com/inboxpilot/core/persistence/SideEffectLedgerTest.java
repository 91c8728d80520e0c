package com.inboxpilot.core.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SideEffectLedgerTest {

    // ── In-memory ────────────────────────────────────────────────────

    @Nested
    class InMemory {

        private InMemorySideEffectLedger ledger;

        @BeforeEach
        void setUp() {
            ledger = new InMemorySideEffectLedger();
        }

        @Test
        @DisplayName("a key is reserved once, completed, and never released after completion")
        void lifecycle() {
            assertTrue(ledger.reserve("c:1:send"));
            assertFalse(ledger.reserve("c:1:send"));

            ledger.complete("c:1:send", "msg-1");
            ledger.release("c:1:send");

            var entry = ledger.find("c:1:send").orElseThrow();
            assertEquals(SideEffectLedger.State.COMPLETED, entry.state());
            assertEquals("msg-1", entry.result());
        }

        @Test
        @DisplayName("a released reservation can be taken again")
        void releaseAllowsRetry() {
            ledger.reserve("c:1:book");
            ledger.release("c:1:book");

            assertTrue(ledger.find("c:1:book").isEmpty());
            assertTrue(ledger.reserve("c:1:book"));
        }

        @Test
        @DisplayName("concurrent reservations of one key have exactly one winner")
        void concurrentReserve() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            var start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return ledger.reserve("c:1:send");
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            pool.shutdown();

            assertEquals(1, winners);
        }
    }

    // ── JDBC ─────────────────────────────────────────────────────────

    @Nested
    class Jdbc {

        private PreparedStatement statement;
        private ResultSet resultSet;
        private JdbcSideEffectLedger ledger;

        @BeforeEach
        void setUp() throws SQLException {
            var dataSource = mock(DataSource.class);
            var connection = mock(Connection.class);
            statement = mock(PreparedStatement.class);
            resultSet = mock(ResultSet.class);
            when(dataSource.getConnection()).thenReturn(connection);
            when(connection.prepareStatement(anyString())).thenReturn(statement);
            when(statement.executeQuery()).thenReturn(resultSet);
            ledger = new JdbcSideEffectLedger(dataSource);
        }

        @Test
        @DisplayName("reserve wins only when a row was inserted")
        void reserve() throws SQLException {
            when(statement.executeUpdate()).thenReturn(1, 0);

            assertTrue(ledger.reserve("c:1:send"));
            assertFalse(ledger.reserve("c:1:send"));
            verify(statement, times(2)).setString(1, "c:1:send");
        }

        @Test
        @DisplayName("complete binds the result before the key")
        void complete() throws SQLException {
            ledger.complete("c:1:send", "msg-1");

            verify(statement).setString(1, "msg-1");
            verify(statement).setString(2, "c:1:send");
        }

        @Test
        @DisplayName("find maps the stored row")
        void find() throws SQLException {
            when(resultSet.next()).thenReturn(true);
            when(resultSet.getString("effect_key")).thenReturn("c:1:book");
            when(resultSet.getString("state")).thenReturn("COMPLETED");
            when(resultSet.getString("result")).thenReturn("evt-1");

            var entry = ledger.find("c:1:book").orElseThrow();

            assertEquals(new SideEffectLedger.Entry("c:1:book", SideEffectLedger.State.COMPLETED, "evt-1"), entry);
        }

        @Test
        @DisplayName("database errors surface as PersistenceException")
        void failure() throws SQLException {
            when(statement.executeUpdate()).thenThrow(new SQLException("deadlock"));

            assertThrows(PersistenceException.class, () -> ledger.reserve("c:1:send"));
        }
    }
}
