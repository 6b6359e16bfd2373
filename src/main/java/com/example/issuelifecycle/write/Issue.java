package com.example.issuelifecycle.write;

import com.example.issuelifecycle.events.EventKind;
import com.example.issuelifecycle.events.IssueEvent;
import com.example.issuelifecycle.shared.IssueId;
import com.example.issuelifecycle.shared.IssueState;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Event-sourced snapshot of one Issue, owned by a single command invocation.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link IssueRepository} creates it and replays the stream's full history</li>
 *   <li>A transition method ({@link #create()}, {@link #close()}, ...) checks its guard against the
 *       replayed state and records the resulting event as a pending change</li>
 *   <li>The repository appends the pending changes, expecting the version the issue was loaded at</li>
 * </ol>
 *
 * <h2>Synchronous event application</h2>
 * A transition applies its event to this instance immediately, so {@link #getState()} and
 * {@link #getVersion()} reflect the change before it is persisted. A rejected transition throws
 * {@link InvalidTransitionException} and leaves state, version and pending changes untouched.
 */
public class Issue {

    private final IssueId id;
    private final IssueStateMachine stateMachine;
    private final Clock clock;
    private final List<IssueEvent> changes = new ArrayList<>();

    private IssueState state;
    private long version;
    private long loadedVersion;

    public Issue(IssueId id, IssueStateMachine stateMachine, Clock clock) {
        if (id == null) {
            throw new IllegalArgumentException("IssueId cannot be null");
        }
        this.id = id;
        this.stateMachine = stateMachine;
        this.clock = clock;
    }

    // ========================================================================
    // Transitions
    // ========================================================================

    /**
     * Opens the issue. Legal unless the issue is currently OPEN (see {@link IssueStateMachine}).
     */
    public void create() {
        trigger(IssueTransition.CREATE);
    }

    public void startProgress() {
        trigger(IssueTransition.START_PROGRESS);
    }

    public void stopProgress() {
        trigger(IssueTransition.STOP_PROGRESS);
    }

    public void close() {
        trigger(IssueTransition.CLOSE);
    }

    public void reopen() {
        trigger(IssueTransition.REOPEN);
    }

    public void resolve() {
        trigger(IssueTransition.RESOLVE);
    }

    private void trigger(IssueTransition transition) {
        EventKind kind = stateMachine.decide(id, state, transition);
        IssueEvent event = kind.newEvent(id, version + 1, clock.instant());
        apply(event);
        changes.add(event);
    }

    // ========================================================================
    // Event Sourcing
    // ========================================================================

    /**
     * Replays persisted history onto a freshly created issue.
     *
     * @throws IllegalStateException if the history belongs to another stream, has a version gap,
     *                               or the issue already has pending changes
     */
    void loadFromHistory(List<? extends IssueEvent> history) {
        if (!changes.isEmpty()) {
            throw new IllegalStateException("Cannot replay history onto issue " + id + " with pending changes");
        }
        for (IssueEvent event : history) {
            apply(event);
        }
        loadedVersion = version;
    }

    private void apply(IssueEvent event) {
        if (!id.equals(event.issueId())) {
            throw new IllegalStateException("Event of stream " + event.issueId() + " applied to issue " + id);
        }
        if (event.version() != version + 1) {
            throw new IllegalStateException("Issue " + id + " at version " + version
                    + " cannot apply event version " + event.version());
        }
        state = IssueStateMachine.evolve(state, event.kind());
        version = event.version();
    }

    void markChangesCommitted() {
        changes.clear();
        loadedVersion = version;
    }

    // ========================================================================
    // Query Methods
    // ========================================================================

    public IssueId getId() {
        return id;
    }

    /**
     * The current state, empty while the issue has no events.
     */
    public Optional<IssueState> getState() {
        return Optional.ofNullable(state);
    }

    public boolean exists() {
        return state != null;
    }

    /**
     * Version of the last applied event, pending changes included. 0 for an issue without events.
     */
    public long getVersion() {
        return version;
    }

    /**
     * The stream version this issue was replayed to; the expected version of the next append.
     */
    public long getLoadedVersion() {
        return loadedVersion;
    }

    public List<IssueEvent> getUncommittedChanges() {
        return Collections.unmodifiableList(changes);
    }

    @Override
    public String toString() {
        return "Issue{id=" + id + ", version=" + version + ", state=" + state + "}";
    }
}
