package com.example.issuelifecycle.write;

import com.example.issuelifecycle.commands.CloseIssue;
import com.example.issuelifecycle.commands.CreateIssue;
import com.example.issuelifecycle.commands.ReopenIssue;
import com.example.issuelifecycle.commands.ResolveIssue;
import com.example.issuelifecycle.commands.StartIssueProgress;
import com.example.issuelifecycle.commands.StopIssueProgress;
import org.axonframework.commandhandling.CommandHandler;

/**
 * Axon command handlers for the Issue commands, subscribed to the command bus by {@link IssueConfiguration}.
 *
 * <p>Each handler delegates to {@link IssueCommandHandler}, which owns load, decide and append.
 * Exceptions propagate to the dispatcher unchanged, so the command bus rolls back its unit of work
 * and events queued on the event bus are never delivered.</p>
 */
public class IssueCommandHandlingComponent {

    private final IssueCommandHandler commandHandler;

    public IssueCommandHandlingComponent(IssueCommandHandler commandHandler) {
        this.commandHandler = commandHandler;
    }

    @CommandHandler
    public void handle(CreateIssue command) {
        commandHandler.handle(command);
    }

    @CommandHandler
    public void handle(StartIssueProgress command) {
        commandHandler.handle(command);
    }

    @CommandHandler
    public void handle(StopIssueProgress command) {
        commandHandler.handle(command);
    }

    @CommandHandler
    public void handle(CloseIssue command) {
        commandHandler.handle(command);
    }

    @CommandHandler
    public void handle(ReopenIssue command) {
        commandHandler.handle(command);
    }

    @CommandHandler
    public void handle(ResolveIssue command) {
        commandHandler.handle(command);
    }
}
