package com.example.issuelifecycle.eventstore;

import com.example.issuelifecycle.events.IssueEvent;
import com.example.issuelifecycle.shared.IssueId;

import java.util.List;

final class AppendPreconditions {

    static void check(IssueId streamId, List<? extends IssueEvent> events, long expectedVersion) {
        if (streamId == null) {
            throw new IllegalArgumentException("Stream id cannot be null");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Cannot append an empty list of events to stream " + streamId);
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("Expected version cannot be negative, was " + expectedVersion);
        }
        long nextVersion = expectedVersion + 1;
        for (IssueEvent event : events) {
            if (!streamId.equals(event.issueId())) {
                throw new IllegalArgumentException(
                        "Event for stream " + event.issueId() + " cannot be appended to stream " + streamId);
            }
            if (event.version() != nextVersion) {
                throw new IllegalArgumentException(
                        "Expected event version " + nextVersion + " on stream " + streamId
                                + " but got " + event.version());
            }
            nextVersion++;
        }
    }

    private AppendPreconditions() {
    }
}
