package com.example.issuelifecycle.eventstore;

import com.example.issuelifecycle.events.EventKind;
import com.example.issuelifecycle.events.IssueEvent;
import com.example.issuelifecycle.shared.IssueId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.List;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Event store backed by a single append-only relational table.
 *
 * <h2>Table layout</h2>
 * <pre>{@code
 * issue_events(id, stream_id, stream_version, event_kind, payload)
 *   UNIQUE (stream_id, stream_version)
 * }</pre>
 *
 * <h2>Conditional append</h2>
 * An append runs in one read-committed transaction: it reads the stream's current maximum version,
 * rejects the call if that differs from the expected version, and batch-inserts the events. Two
 * transactions that both pass the version check race on the unique index; the loser's
 * {@link DuplicateKeyException} is reported as {@link ConcurrencyConflictException}. Every other
 * {@link DataAccessException} is wrapped in {@link EventStoreException}.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    public static final String DEFAULT_TABLE = "issue_events";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final IssueEventCodec codec;
    private final String table;
    private final RowMapper<IssueEvent> eventMapper;

    public JdbcEventStore(DataSource dataSource) {
        this(dataSource, new IssueEventCodec(), DEFAULT_TABLE);
    }

    public JdbcEventStore(DataSource dataSource, IssueEventCodec codec, String table) {
        if (dataSource == null) {
            throw new IllegalArgumentException("DataSource cannot be null");
        }
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid event table name: " + table);
        }
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        DefaultTransactionDefinition transactionDefinition =
                new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
        transactionDefinition.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate =
                new TransactionTemplate(new DataSourceTransactionManager(dataSource), transactionDefinition);
        this.codec = codec;
        this.table = table;
        this.eventMapper = (rs, rowNum) ->
                codec.decode(EventKind.valueOf(rs.getString("event_kind")), rs.getString("payload"));
    }

    /**
     * Creates the event table and its unique index if they do not exist yet.
     */
    public void createSchema() {
        String ddl = """
                CREATE TABLE IF NOT EXISTS %1$s (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    stream_id VARCHAR(36) NOT NULL,
                    stream_version BIGINT NOT NULL,
                    event_kind VARCHAR(64) NOT NULL,
                    payload VARCHAR(1024) NOT NULL,
                    CONSTRAINT uq_%1$s_stream_version UNIQUE (stream_id, stream_version)
                )
                """.formatted(table);
        try {
            jdbcTemplate.execute(ddl);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to create event table " + table, e);
        }
        log.info("Event table {} is ready", table);
    }

    @Override
    public void append(IssueId streamId, List<? extends IssueEvent> events, long expectedVersion) {
        AppendPreconditions.check(streamId, events, expectedVersion);
        List<Object[]> rows = events.stream()
                .map(event -> new Object[]{
                        streamId.toString(), event.version(), event.kind().name(), codec.encode(event)})
                .toList();
        String sql = "INSERT INTO " + table
                + " (stream_id, stream_version, event_kind, payload) VALUES (?, ?, ?, ?)";

        try {
            transactionTemplate.executeWithoutResult(status -> {
                long actualVersion = currentVersion(streamId);
                if (actualVersion != expectedVersion) {
                    throw new ConcurrencyConflictException(streamId, expectedVersion, actualVersion);
                }
                jdbcTemplate.batchUpdate(sql, rows);
            });
        } catch (DuplicateKeyException e) {
            // a concurrent writer committed the same version after our check
            log.debug("Unique index rejected append to stream {} after version {}", streamId, expectedVersion);
            throw new ConcurrencyConflictException(streamId, expectedVersion, latestVersion(streamId).orElse(0));
        } catch (DataAccessException | TransactionException e) {
            throw new EventStoreException("Failed to append " + events.size() + " event(s) to stream " + streamId, e);
        }
        log.debug("Appended {} event(s) to stream {} after version {}", events.size(), streamId, expectedVersion);
    }

    @Override
    public List<IssueEvent> read(IssueId streamId) {
        return readAfter(streamId, 0);
    }

    @Override
    public List<IssueEvent> readAfter(IssueId streamId, long afterVersion) {
        return query(streamId, "stream_version > ?", afterVersion);
    }

    @Override
    public List<IssueEvent> readUpTo(IssueId streamId, long upToVersion) {
        return query(streamId, "stream_version <= ?", upToVersion);
    }

    @Override
    public OptionalLong latestVersion(IssueId streamId) {
        try {
            long version = currentVersion(streamId);
            return version == 0 ? OptionalLong.empty() : OptionalLong.of(version);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read latest version of stream " + streamId, e);
        }
    }

    private List<IssueEvent> query(IssueId streamId, String versionBound, long version) {
        String sql = "SELECT event_kind, payload FROM " + table
                + " WHERE stream_id = ? AND " + versionBound + " ORDER BY stream_version";
        try {
            return List.copyOf(jdbcTemplate.query(sql, eventMapper, streamId.toString(), version));
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read stream " + streamId, e);
        }
    }

    private long currentVersion(IssueId streamId) {
        Long version = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(stream_version), 0) FROM " + table + " WHERE stream_id = ?",
                Long.class, streamId.toString());
        return version == null ? 0 : version;
    }
}
