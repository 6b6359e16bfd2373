package com.example.issuelifecycle.events;

import com.example.issuelifecycle.shared.IssueId;

import java.time.Instant;

public record IssueResolved(
        IssueId issueId,
        long version,
        Instant timestamp
) implements IssueEvent {

    public IssueResolved {
        IssueEvent.checkEnvelope(issueId, version, timestamp);
    }

    @Override
    public EventKind kind() {
        return EventKind.RESOLVED;
    }
}
