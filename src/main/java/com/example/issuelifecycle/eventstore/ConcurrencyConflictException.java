package com.example.issuelifecycle.eventstore;

import com.example.issuelifecycle.shared.IssueId;

/**
 * Thrown when an append finds the stream at a different version than the caller expected,
 * i.e. a competing writer appended first.
 *
 * <p>The failed append left the store unchanged. Callers recover by reloading the stream,
 * re-evaluating their decision and appending again.</p>
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final IssueId streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(IssueId streamId, long expectedVersion, long actualVersion) {
        super("Concurrency conflict on stream " + streamId + ": expected version " + expectedVersion
                + " but stream is at version " + actualVersion);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public IssueId getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    /**
     * The stream's version at the time of the failed append, 0 for a stream without events.
     */
    public long getActualVersion() {
        return actualVersion;
    }
}
