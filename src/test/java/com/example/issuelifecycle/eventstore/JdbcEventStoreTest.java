package com.example.issuelifecycle.eventstore;

import com.example.issuelifecycle.events.IssueClosed;
import com.example.issuelifecycle.events.IssueEvent;
import com.example.issuelifecycle.events.IssueOpened;
import com.example.issuelifecycle.shared.IssueId;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the shared event store behavior against an in-memory H2 database, plus table specifics.
 */
class JdbcEventStoreTest extends AbstractEventStoreTest {

    private JdbcDataSource dataSource;

    @Override
    protected EventStore createStore() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:events-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        JdbcEventStore jdbcStore = new JdbcEventStore(dataSource);
        jdbcStore.createSchema();
        return jdbcStore;
    }

    @Test
    @DisplayName("Creating the schema twice is harmless")
    void createSchema_isIdempotent() {
        store.append(streamId, List.of(new IssueOpened(streamId, 1, T0)), 0);

        ((JdbcEventStore) store).createSchema();

        assertThat(store.read(streamId)).hasSize(1);
    }

    @Test
    @DisplayName("Each event is one row keyed by stream id and version")
    void events_areStoredOneRowPerEvent() throws SQLException {
        store.append(streamId, List.of(
                new IssueOpened(streamId, 1, T0),
                new IssueClosed(streamId, 2, T0)), 0);

        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT stream_version, event_kind, payload FROM issue_events WHERE stream_id = ? ORDER BY id")) {
            statement.setString(1, streamId.toString());
            try (ResultSet rows = statement.executeQuery()) {
                assertThat(rows.next()).isTrue();
                assertThat(rows.getLong("stream_version")).isEqualTo(1);
                assertThat(rows.getString("event_kind")).isEqualTo("OPENED");
                assertThat(rows.getString("payload")).contains(streamId.toString()).contains("2026-03-01T12:00:00Z");
                assertThat(rows.next()).isTrue();
                assertThat(rows.getString("event_kind")).isEqualTo("CLOSED");
                assertThat(rows.next()).isFalse();
            }
        }
    }

    @Test
    @DisplayName("The unique index rejects a duplicate version written behind the store's back")
    void uniqueIndex_rejectsDuplicateVersion() throws SQLException {
        store.append(streamId, List.of(new IssueOpened(streamId, 1, T0)), 0);

        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            assertThatThrownBy(() -> statement.executeUpdate(
                    "INSERT INTO issue_events (stream_id, stream_version, event_kind, payload) VALUES ('"
                            + streamId + "', 1, 'CLOSED', '{}')"))
                    .isInstanceOf(SQLException.class)
                    .satisfies(e -> assertThat(((SQLException) e).getSQLState()).startsWith("23"));
        }
    }

    @Test
    @DisplayName("A custom table name keeps streams apart from the default table")
    void customTable_isSeparate() {
        JdbcEventStore other = new JdbcEventStore(dataSource, new IssueEventCodec(), "archived_issue_events");
        other.createSchema();
        IssueId id = IssueId.newId();

        other.append(id, List.of(new IssueOpened(id, 1, T0)), 0);

        assertThat(other.read(id)).hasSize(1);
        assertThat(store.read(id)).isEmpty();
    }

    @Test
    @DisplayName("Table names that are not plain identifiers are refused")
    void invalidTableName_isRefused() {
        assertThatThrownBy(() -> new JdbcEventStore(dataSource, new IssueEventCodec(), "events; DROP TABLE x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A missing table surfaces as EventStoreException with the SQL cause")
    void missingTable_isWrapped() {
        JdbcEventStore unprepared = new JdbcEventStore(dataSource, new IssueEventCodec(), "no_such_table");

        assertThatThrownBy(() -> unprepared.read(streamId))
                .isInstanceOf(EventStoreException.class)
                .hasCauseInstanceOf(DataAccessException.class)
                .hasRootCauseInstanceOf(SQLException.class);
    }

    @Test
    @DisplayName("Many writers racing for the same next version: one wins, every other one conflicts")
    void manyWritersRacing_exactlyOneWinsPerRound() throws Exception {
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            for (int round = 0; round < 25; round++) {
                IssueId stream = IssueId.newId();
                store.append(stream, List.of(new IssueOpened(stream, 1, T0)), 0);
                CountDownLatch start = new CountDownLatch(1);
                List<Future<?>> futures = new ArrayList<>();
                for (int writer = 0; writer < writers; writer++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        store.append(stream, List.of(new IssueClosed(stream, 2, T0)), 1);
                        return null;
                    }));
                }
                start.countDown();

                int succeeded = 0;
                for (Future<?> future : futures) {
                    try {
                        future.get(30, TimeUnit.SECONDS);
                        succeeded++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause())
                                .isInstanceOf(ConcurrencyConflictException.class)
                                .satisfies(cause -> assertThat(
                                        ((ConcurrencyConflictException) cause).getActualVersion()).isEqualTo(2));
                    }
                }

                assertThat(succeeded).isEqualTo(1);
                assertThat(store.read(stream)).extracting(IssueEvent::version).containsExactly(1L, 2L);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
