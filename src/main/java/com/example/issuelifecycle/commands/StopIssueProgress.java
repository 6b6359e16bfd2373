package com.example.issuelifecycle.commands;

import com.example.issuelifecycle.shared.IssueId;

public record StopIssueProgress(
        IssueId issueId
) implements IssueCommand {

    public StopIssueProgress {
        if (issueId == null) {
            throw new IllegalArgumentException("IssueId cannot be null");
        }
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
