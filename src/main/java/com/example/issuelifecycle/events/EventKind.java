package com.example.issuelifecycle.events;

import com.example.issuelifecycle.shared.IssueId;

import java.time.Instant;

/**
 * The six kinds of issue events. The constant name is what gets persisted as the event kind.
 */
public enum EventKind {
    OPENED(IssueOpened.class),
    PROGRESS_STARTED(IssueProgressStarted.class),
    PROGRESS_STOPPED(IssueProgressStopped.class),
    REOPENED(IssueReopened.class),
    RESOLVED(IssueResolved.class),
    CLOSED(IssueClosed.class);

    private final Class<? extends IssueEvent> eventType;

    EventKind(Class<? extends IssueEvent> eventType) {
        this.eventType = eventType;
    }

    public Class<? extends IssueEvent> eventType() {
        return eventType;
    }

    /**
     * Creates the event record of this kind.
     */
    public IssueEvent newEvent(IssueId issueId, long version, Instant timestamp) {
        return switch (this) {
            case OPENED -> new IssueOpened(issueId, version, timestamp);
            case PROGRESS_STARTED -> new IssueProgressStarted(issueId, version, timestamp);
            case PROGRESS_STOPPED -> new IssueProgressStopped(issueId, version, timestamp);
            case REOPENED -> new IssueReopened(issueId, version, timestamp);
            case RESOLVED -> new IssueResolved(issueId, version, timestamp);
            case CLOSED -> new IssueClosed(issueId, version, timestamp);
        };
    }
}
