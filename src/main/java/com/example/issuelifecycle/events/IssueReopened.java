package com.example.issuelifecycle.events;

import com.example.issuelifecycle.shared.IssueId;

import java.time.Instant;

public record IssueReopened(
        IssueId issueId,
        long version,
        Instant timestamp
) implements IssueEvent {

    public IssueReopened {
        IssueEvent.checkEnvelope(issueId, version, timestamp);
    }

    @Override
    public EventKind kind() {
        return EventKind.REOPENED;
    }
}
