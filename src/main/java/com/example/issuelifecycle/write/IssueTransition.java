package com.example.issuelifecycle.write;

import com.example.issuelifecycle.events.EventKind;

/**
 * The six lifecycle transitions, one per command, with the event each one emits.
 */
public enum IssueTransition {
    CREATE("CreateIssue", EventKind.OPENED),
    START_PROGRESS("StartIssueProgress", EventKind.PROGRESS_STARTED),
    STOP_PROGRESS("StopIssueProgress", EventKind.PROGRESS_STOPPED),
    CLOSE("CloseIssue", EventKind.CLOSED),
    REOPEN("ReopenIssue", EventKind.REOPENED),
    RESOLVE("ResolveIssue", EventKind.RESOLVED);

    private final String commandName;
    private final EventKind emits;

    IssueTransition(String commandName, EventKind emits) {
        this.commandName = commandName;
        this.emits = emits;
    }

    public String commandName() {
        return commandName;
    }

    public EventKind emits() {
        return emits;
    }
}
