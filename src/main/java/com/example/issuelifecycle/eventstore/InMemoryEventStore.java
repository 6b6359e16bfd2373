package com.example.issuelifecycle.eventstore;

import com.example.issuelifecycle.events.IssueEvent;
import com.example.issuelifecycle.shared.IssueId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Event store keeping every stream as an immutable list in memory.
 *
 * <p>An append replaces a stream's list through {@link ConcurrentMap#compute}, which makes the
 * version check and the write one atomic step per stream. Readers always get a complete,
 * immutable list.</p>
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<IssueId, List<IssueEvent>> streams = new ConcurrentHashMap<>();

    @Override
    public void append(IssueId streamId, List<? extends IssueEvent> events, long expectedVersion) {
        AppendPreconditions.check(streamId, events, expectedVersion);
        streams.compute(streamId, (id, current) -> {
            List<IssueEvent> existing = current == null ? List.of() : current;
            long actualVersion = existing.isEmpty() ? 0 : existing.get(existing.size() - 1).version();
            if (actualVersion != expectedVersion) {
                throw new ConcurrencyConflictException(id, expectedVersion, actualVersion);
            }
            List<IssueEvent> appended = new ArrayList<>(existing.size() + events.size());
            appended.addAll(existing);
            appended.addAll(events);
            return List.copyOf(appended);
        });
        log.debug("Appended {} event(s) to stream {} after version {}", events.size(), streamId, expectedVersion);
    }

    @Override
    public List<IssueEvent> read(IssueId streamId) {
        return streams.getOrDefault(streamId, List.of());
    }
}
