package com.example.issuelifecycle.events;

import com.example.issuelifecycle.shared.IssueId;

import java.time.Instant;

public record IssueProgressStarted(
        IssueId issueId,
        long version,
        Instant timestamp
) implements IssueEvent {

    public IssueProgressStarted {
        IssueEvent.checkEnvelope(issueId, version, timestamp);
    }

    @Override
    public EventKind kind() {
        return EventKind.PROGRESS_STARTED;
    }
}
