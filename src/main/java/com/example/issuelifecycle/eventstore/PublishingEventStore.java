package com.example.issuelifecycle.eventstore;

import com.example.issuelifecycle.events.IssueEvent;
import com.example.issuelifecycle.shared.IssueId;
import org.axonframework.eventhandling.EventBus;
import org.axonframework.eventhandling.EventMessage;
import org.axonframework.eventhandling.GenericEventMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Event store decorator that publishes every successfully appended event on an Axon {@link EventBus},
 * so downstream projections see exactly what was persisted.
 *
 * <p>Publication happens only after the delegate accepted the append. A conflicting or invalid
 * append publishes nothing. When called inside an Axon unit of work (a command dispatched through
 * the command bus) the event bus defers delivery until that unit of work commits.</p>
 */
public class PublishingEventStore implements EventStore {

    private final EventStore delegate;
    private final EventBus eventBus;

    public PublishingEventStore(EventStore delegate, EventBus eventBus) {
        this.delegate = delegate;
        this.eventBus = eventBus;
    }

    @Override
    public void append(IssueId streamId, List<? extends IssueEvent> events, long expectedVersion) {
        delegate.append(streamId, events, expectedVersion);

        List<EventMessage<?>> messages = new ArrayList<>(events.size());
        for (IssueEvent event : events) {
            messages.add(GenericEventMessage.asEventMessage(event));
        }
        eventBus.publish(messages);
    }

    @Override
    public List<IssueEvent> read(IssueId streamId) {
        return delegate.read(streamId);
    }

    @Override
    public List<IssueEvent> readAfter(IssueId streamId, long afterVersion) {
        return delegate.readAfter(streamId, afterVersion);
    }

    @Override
    public List<IssueEvent> readUpTo(IssueId streamId, long upToVersion) {
        return delegate.readUpTo(streamId, upToVersion);
    }

    @Override
    public OptionalLong latestVersion(IssueId streamId) {
        return delegate.latestVersion(streamId);
    }
}
