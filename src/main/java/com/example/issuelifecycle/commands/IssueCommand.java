package com.example.issuelifecycle.commands;

import com.example.issuelifecycle.shared.IssueId;

/**
 * A request to move one issue through its lifecycle. Every command targets exactly one issue stream.
 *
 * <p>Dispatch goes through {@link #accept(Visitor)}, so adding a command type forces every
 * visitor to handle it.</p>
 */
public interface IssueCommand {

    IssueId issueId();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visit(CreateIssue command);

        R visit(StartIssueProgress command);

        R visit(StopIssueProgress command);

        R visit(CloseIssue command);

        R visit(ReopenIssue command);

        R visit(ResolveIssue command);
    }
}
