package com.example.issuelifecycle.shared;

/**
 * Controls when a Create command is accepted.
 */
public enum CreatePolicy {

    /**
     * Create is legal whenever the issue is not currently {@link IssueState#OPEN}.
     * Creating a closed, resolved, reopened or in-progress issue re-opens it.
     */
    PERMISSIVE_RECREATE,

    /**
     * Create is legal only for an issue without any history.
     */
    STRICT
}
