package com.example.issuelifecycle.write;

import com.example.issuelifecycle.events.IssueEvent;
import com.example.issuelifecycle.eventstore.ConcurrencyConflictException;
import com.example.issuelifecycle.eventstore.EventStore;
import com.example.issuelifecycle.shared.IssueId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.function.Consumer;

/**
 * Loads issues by replaying their event stream and saves their pending changes under a version guard.
 *
 * <p>Nothing is cached: every load reads the complete stream from the {@link EventStore}.</p>
 */
public class IssueRepository {

    private static final Logger log = LoggerFactory.getLogger(IssueRepository.class);

    private final EventStore eventStore;
    private final IssueStateMachine stateMachine;
    private final Clock clock;

    public IssueRepository(EventStore eventStore, IssueStateMachine stateMachine, Clock clock) {
        this.eventStore = eventStore;
        this.stateMachine = stateMachine;
        this.clock = clock;
    }

    /**
     * Replays the complete stream of an issue. An issue without events loads at version 0 with no state.
     */
    public Issue load(IssueId issueId) {
        Issue issue = new Issue(issueId, stateMachine, clock);
        issue.loadFromHistory(eventStore.read(issueId));
        return issue;
    }

    /**
     * Replays the stream only up to and including {@code upToVersion}, giving the issue as it was then.
     * Saving changes made to such an issue fails with {@link ConcurrencyConflictException} unless
     * {@code upToVersion} is still the latest version.
     */
    public Issue load(IssueId issueId, long upToVersion) {
        Issue issue = new Issue(issueId, stateMachine, clock);
        issue.loadFromHistory(eventStore.readUpTo(issueId, upToVersion));
        return issue;
    }

    /**
     * Appends the issue's pending changes, expecting the stream to still be at the loaded version.
     * Does nothing when there are no pending changes.
     *
     * @throws ConcurrencyConflictException if another writer appended to the stream in the meantime
     */
    public void save(Issue issue) {
        List<IssueEvent> changes = issue.getUncommittedChanges();
        if (changes.isEmpty()) {
            return;
        }
        eventStore.append(issue.getId(), List.copyOf(changes), issue.getLoadedVersion());
        log.debug("Saved issue {} at version {}", issue.getId(), issue.getVersion());
        issue.markChangesCommitted();
    }

    /**
     * Loads an issue, lets {@code mutation} invoke transitions on it, and saves the result.
     *
     * <p>The save runs only when {@code mutation} returns normally. If it throws, for example with
     * {@link InvalidTransitionException}, nothing is appended and the exception propagates as is.</p>
     */
    public void update(IssueId issueId, Consumer<Issue> mutation) {
        Issue issue = load(issueId);
        mutation.accept(issue);
        save(issue);
    }
}
