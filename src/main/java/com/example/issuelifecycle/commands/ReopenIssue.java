package com.example.issuelifecycle.commands;

import com.example.issuelifecycle.shared.IssueId;

public record ReopenIssue(
        IssueId issueId
) implements IssueCommand {

    public ReopenIssue {
        if (issueId == null) {
            throw new IllegalArgumentException("IssueId cannot be null");
        }
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
