package com.example.issuelifecycle.write;

import com.example.issuelifecycle.shared.IssueId;
import com.example.issuelifecycle.shared.IssueState;

import java.util.Optional;

/**
 * Thrown when a command is not legal in the issue's current state.
 * A business-rule rejection: nothing was appended and retrying will not help.
 */
public class InvalidTransitionException extends RuntimeException {

    private final IssueTransition transition;
    private final IssueId issueId;
    private final IssueState currentState;

    public InvalidTransitionException(IssueTransition transition, IssueId issueId, IssueState currentState) {
        super(transition.commandName() + " is not allowed for issue " + issueId
                + (currentState == null ? " which does not exist" : " in state " + currentState));
        this.transition = transition;
        this.issueId = issueId;
        this.currentState = currentState;
    }

    public IssueTransition getTransition() {
        return transition;
    }

    public String getCommandName() {
        return transition.commandName();
    }

    public IssueId getIssueId() {
        return issueId;
    }

    public Optional<IssueState> getCurrentState() {
        return Optional.ofNullable(currentState);
    }
}
