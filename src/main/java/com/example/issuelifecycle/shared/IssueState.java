package com.example.issuelifecycle.shared;

/**
 * Issue lifecycle state. An issue without any events has no state at all,
 * which is modelled as an empty {@code Optional<IssueState>}.
 */
public enum IssueState {
    OPEN,
    IN_PROGRESS,
    REOPENED,
    RESOLVED,
    CLOSED
}
