package com.example.issuelifecycle.events;

import com.example.issuelifecycle.shared.IssueId;

import java.time.Instant;

/**
 * An immutable fact in an issue's event stream. Identity is ({@link #issueId()}, {@link #version()}).
 *
 * <p>The timestamp is informational only. Ordering is given by the version, which is 1-based
 * and gapless within a stream.</p>
 */
public sealed interface IssueEvent
        permits IssueOpened, IssueProgressStarted, IssueProgressStopped, IssueReopened, IssueResolved, IssueClosed {

    IssueId issueId();

    long version();

    Instant timestamp();

    EventKind kind();

    static void checkEnvelope(IssueId issueId, long version, Instant timestamp) {
        if (issueId == null) {
            throw new IllegalArgumentException("Event issueId cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("Event version must be positive, was " + version);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Event timestamp cannot be null");
        }
    }
}
