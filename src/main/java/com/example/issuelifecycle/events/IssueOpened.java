package com.example.issuelifecycle.events;

import com.example.issuelifecycle.shared.IssueId;

import java.time.Instant;

public record IssueOpened(
        IssueId issueId,
        long version,
        Instant timestamp
) implements IssueEvent {

    public IssueOpened {
        IssueEvent.checkEnvelope(issueId, version, timestamp);
    }

    @Override
    public EventKind kind() {
        return EventKind.OPENED;
    }
}
