package com.example.issuelifecycle.events;

import com.example.issuelifecycle.shared.IssueId;

import java.time.Instant;

public record IssueClosed(
        IssueId issueId,
        long version,
        Instant timestamp
) implements IssueEvent {

    public IssueClosed {
        IssueEvent.checkEnvelope(issueId, version, timestamp);
    }

    @Override
    public EventKind kind() {
        return EventKind.CLOSED;
    }
}
