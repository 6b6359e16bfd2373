package com.example.issuelifecycle.write;

import com.example.issuelifecycle.commands.CloseIssue;
import com.example.issuelifecycle.commands.CreateIssue;
import com.example.issuelifecycle.commands.IssueCommand;
import com.example.issuelifecycle.commands.ReopenIssue;
import com.example.issuelifecycle.commands.ResolveIssue;
import com.example.issuelifecycle.commands.StartIssueProgress;
import com.example.issuelifecycle.commands.StopIssueProgress;
import com.example.issuelifecycle.eventstore.ConcurrencyConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Single entry point for Issue commands: load, decide, append.
 *
 * <h2>Protocol</h2>
 * <ol>
 *   <li>Replay the issue's full history into its current state and version</li>
 *   <li>Dispatch the command to the matching transition, which evaluates its guard</li>
 *   <li>On a rejected guard, fail with {@link InvalidTransitionException}; nothing is appended</li>
 *   <li>Otherwise append exactly one event with version {@code currentVersion + 1}, expecting
 *       {@code currentVersion}</li>
 * </ol>
 *
 * <p>The handler keeps no state between calls and takes no locks. Concurrent calls for the same
 * issue are serialized by the event store alone: the loser fails with
 * {@link ConcurrencyConflictException}, which is not retried here. The command gateway built by
 * {@link IssueConfiguration} retries it.</p>
 */
public class IssueCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(IssueCommandHandler.class);

    private static final IssueCommand.Visitor<Consumer<Issue>> TRANSITIONS = new IssueCommand.Visitor<>() {
        @Override
        public Consumer<Issue> visit(CreateIssue command) {
            return Issue::create;
        }

        @Override
        public Consumer<Issue> visit(StartIssueProgress command) {
            return Issue::startProgress;
        }

        @Override
        public Consumer<Issue> visit(StopIssueProgress command) {
            return Issue::stopProgress;
        }

        @Override
        public Consumer<Issue> visit(CloseIssue command) {
            return Issue::close;
        }

        @Override
        public Consumer<Issue> visit(ReopenIssue command) {
            return Issue::reopen;
        }

        @Override
        public Consumer<Issue> visit(ResolveIssue command) {
            return Issue::resolve;
        }
    };

    private final IssueRepository repository;

    public IssueCommandHandler(IssueRepository repository) {
        this.repository = repository;
    }

    /**
     * Handles one command against one issue stream.
     *
     * @throws InvalidTransitionException   if the command is illegal in the issue's current state
     * @throws ConcurrencyConflictException if another writer appended to the stream first
     */
    public void handle(IssueCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        log.debug("Handling {} for issue {}", command.getClass().getSimpleName(), command.issueId());
        repository.update(command.issueId(), command.accept(TRANSITIONS));
    }
}
