package com.example.issuelifecycle.write;

import com.example.issuelifecycle.events.EventKind;
import com.example.issuelifecycle.events.IssueEvent;
import com.example.issuelifecycle.shared.CreatePolicy;
import com.example.issuelifecycle.shared.IssueId;
import com.example.issuelifecycle.shared.IssueState;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.example.issuelifecycle.shared.IssueState.CLOSED;
import static com.example.issuelifecycle.shared.IssueState.IN_PROGRESS;
import static com.example.issuelifecycle.shared.IssueState.OPEN;
import static com.example.issuelifecycle.shared.IssueState.REOPENED;
import static com.example.issuelifecycle.shared.IssueState.RESOLVED;

/**
 * The Issue lifecycle: which transitions are legal from which state, and how events fold into state.
 *
 * <h2>Transition table</h2>
 * <pre>
 * Command         Legal from                             Emits             New state
 * Create          any state except OPEN, or no history   Opened            OPEN
 * StartProgress   OPEN, REOPENED                         ProgressStarted   IN_PROGRESS
 * StopProgress    IN_PROGRESS                            ProgressStopped   OPEN
 * Close           OPEN, IN_PROGRESS, REOPENED, RESOLVED  Closed            CLOSED
 * Reopen          CLOSED, RESOLVED                       Reopened          REOPENED
 * Resolve         OPEN, REOPENED, IN_PROGRESS            Resolved          RESOLVED
 * </pre>
 *
 * <p>Create is deliberately guarded by "not currently OPEN" rather than "no history": creating a
 * closed or resolved issue re-opens it. {@link CreatePolicy#STRICT} limits Create to issues without
 * history instead.</p>
 *
 * <p>A {@code null} state means the issue has no events yet. All methods are pure.</p>
 */
public final class IssueStateMachine {

    private static final Set<IssueState> START_FROM = EnumSet.of(OPEN, REOPENED);
    private static final Set<IssueState> STOP_FROM = EnumSet.of(IN_PROGRESS);
    private static final Set<IssueState> CLOSE_FROM = EnumSet.of(OPEN, IN_PROGRESS, REOPENED, RESOLVED);
    private static final Set<IssueState> REOPEN_FROM = EnumSet.of(CLOSED, RESOLVED);
    private static final Set<IssueState> RESOLVE_FROM = EnumSet.of(OPEN, REOPENED, IN_PROGRESS);

    private final CreatePolicy createPolicy;

    public IssueStateMachine() {
        this(CreatePolicy.PERMISSIVE_RECREATE);
    }

    public IssueStateMachine(CreatePolicy createPolicy) {
        if (createPolicy == null) {
            throw new IllegalArgumentException("CreatePolicy cannot be null");
        }
        this.createPolicy = createPolicy;
    }

    public CreatePolicy getCreatePolicy() {
        return createPolicy;
    }

    public boolean isAllowed(IssueTransition transition, IssueState current) {
        return switch (transition) {
            case CREATE -> createPolicy == CreatePolicy.STRICT ? current == null : current != OPEN;
            case START_PROGRESS -> current != null && START_FROM.contains(current);
            case STOP_PROGRESS -> current != null && STOP_FROM.contains(current);
            case CLOSE -> current != null && CLOSE_FROM.contains(current);
            case REOPEN -> current != null && REOPEN_FROM.contains(current);
            case RESOLVE -> current != null && RESOLVE_FROM.contains(current);
        };
    }

    /**
     * Decides which event a transition emits from the current state.
     *
     * @throws InvalidTransitionException if the guard of {@code transition} rejects {@code current}
     */
    public EventKind decide(IssueId issueId, IssueState current, IssueTransition transition) {
        if (!isAllowed(transition, current)) {
            throw new InvalidTransitionException(transition, issueId, current);
        }
        return transition.emits();
    }

    /**
     * Folds one event into the next state. The result depends only on the event kind.
     */
    public static IssueState evolve(IssueState current, EventKind kind) {
        return switch (kind) {
            case OPENED -> OPEN;
            case PROGRESS_STARTED -> IN_PROGRESS;
            case PROGRESS_STOPPED -> OPEN;
            case REOPENED -> REOPENED;
            case RESOLVED -> RESOLVED;
            case CLOSED -> CLOSED;
        };
    }

    /**
     * Folds a complete history, in version order, into the issue's current state.
     */
    public static Optional<IssueState> project(List<? extends IssueEvent> history) {
        IssueState state = null;
        for (IssueEvent event : history) {
            state = evolve(state, event.kind());
        }
        return Optional.ofNullable(state);
    }
}
