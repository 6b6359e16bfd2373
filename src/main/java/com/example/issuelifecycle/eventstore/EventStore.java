package com.example.issuelifecycle.eventstore;

import com.example.issuelifecycle.events.IssueEvent;
import com.example.issuelifecycle.shared.IssueId;

import java.util.List;
import java.util.OptionalLong;

/**
 * Append-only, per-stream ordered log of issue events with optimistic concurrency control.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Versions within a stream start at 1 and have no gaps</li>
 *   <li>{@link #append} is atomic: either every event of the call becomes visible, or none does</li>
 *   <li>Readers never observe a partially written append</li>
 *   <li>The store is the only serialization point between concurrent writers of one stream.
 *       Of two appends carrying the same expected version, exactly one succeeds</li>
 * </ul>
 *
 * <p>{@link ConcurrencyConflictException} is the only failure callers are expected to handle.
 * Storage failures surface as {@link EventStoreException}.</p>
 */
public interface EventStore {

    /**
     * Appends events to a stream if its latest version still equals {@code expectedVersion}.
     *
     * @param streamId        the stream to append to
     * @param events          non-empty, all for {@code streamId}, versions contiguous from {@code expectedVersion + 1}
     * @param expectedVersion the version the caller read, 0 for a stream without events
     * @throws ConcurrencyConflictException if another writer appended first
     * @throws IllegalArgumentException     if {@code events} violates the preconditions above
     */
    void append(IssueId streamId, List<? extends IssueEvent> events, long expectedVersion);

    /**
     * Returns the complete history of a stream in ascending version order.
     * An unknown stream has an empty history.
     */
    List<IssueEvent> read(IssueId streamId);

    /**
     * Returns the events of a stream with a version greater than {@code afterVersion}, in ascending order.
     */
    default List<IssueEvent> readAfter(IssueId streamId, long afterVersion) {
        return read(streamId).stream()
                .filter(event -> event.version() > afterVersion)
                .toList();
    }

    /**
     * Returns the events of a stream with a version up to and including {@code upToVersion}, in ascending order.
     */
    default List<IssueEvent> readUpTo(IssueId streamId, long upToVersion) {
        return read(streamId).stream()
                .filter(event -> event.version() <= upToVersion)
                .toList();
    }

    /**
     * Returns the version of the last event in a stream, or empty if the stream has no events.
     */
    default OptionalLong latestVersion(IssueId streamId) {
        List<IssueEvent> events = read(streamId);
        if (events.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(events.get(events.size() - 1).version());
    }
}
