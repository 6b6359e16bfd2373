package com.example.issuelifecycle.write;

import com.example.issuelifecycle.eventstore.ConcurrencyConflictException;
import com.example.issuelifecycle.eventstore.EventStore;
import com.example.issuelifecycle.eventstore.PublishingEventStore;
import com.example.issuelifecycle.shared.CreatePolicy;
import org.axonframework.commandhandling.AnnotationCommandHandlerAdapter;
import org.axonframework.commandhandling.CommandBus;
import org.axonframework.commandhandling.SimpleCommandBus;
import org.axonframework.commandhandling.gateway.CommandGateway;
import org.axonframework.commandhandling.gateway.DefaultCommandGateway;
import org.axonframework.commandhandling.gateway.IntervalRetryScheduler;
import org.axonframework.common.AxonThreadFactory;
import org.axonframework.eventhandling.EventBus;
import org.axonframework.eventhandling.SimpleEventBus;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Configuration for Issue command handling.
 *
 * <p>Wires the given event store into the repository and command handler, subscribes
 * {@link IssueCommandHandlingComponent} to a local Axon command bus, and publishes every appended
 * event on a local Axon event bus.</p>
 *
 * <h2>Conflict retries</h2>
 * The command gateway re-dispatches a command that failed with {@link ConcurrencyConflictException},
 * up to {@code maxConflictRetries} times. Every re-dispatch is a complete handling run, so the stream
 * is re-read and the guard re-evaluated. Any other failure, {@link InvalidTransitionException}
 * included, is returned to the caller without retrying. The direct {@link #commandHandler()} never
 * retries.
 */
public final class IssueConfiguration {

    public static final int DEFAULT_CONFLICT_RETRIES = 3;

    private static final int RETRY_INTERVAL_MILLIS = 10;

    private final EventStore eventStore;
    private final EventBus eventBus;
    private final IssueRepository repository;
    private final IssueCommandHandler commandHandler;
    private final CommandBus commandBus;
    private final CommandGateway commandGateway;
    private final ScheduledExecutorService retryExecutor;

    private IssueConfiguration(EventStore eventStore, EventBus eventBus, IssueRepository repository,
                               IssueCommandHandler commandHandler, CommandBus commandBus,
                               CommandGateway commandGateway, ScheduledExecutorService retryExecutor) {
        this.eventStore = eventStore;
        this.eventBus = eventBus;
        this.repository = repository;
        this.commandHandler = commandHandler;
        this.commandBus = commandBus;
        this.commandGateway = commandGateway;
        this.retryExecutor = retryExecutor;
    }

    /**
     * Configures Issue command handling with the permissive create policy, the UTC system clock and
     * {@value #DEFAULT_CONFLICT_RETRIES} conflict retries.
     */
    public static IssueConfiguration configure(EventStore eventStore) {
        return configure(eventStore, CreatePolicy.PERMISSIVE_RECREATE, Clock.systemUTC());
    }

    public static IssueConfiguration configure(EventStore eventStore, CreatePolicy createPolicy, Clock clock) {
        return configure(eventStore, createPolicy, clock, DEFAULT_CONFLICT_RETRIES);
    }

    /**
     * @param maxConflictRetries how often the gateway re-dispatches a conflicting command; 0 disables retries
     */
    public static IssueConfiguration configure(EventStore eventStore, CreatePolicy createPolicy, Clock clock,
                                               int maxConflictRetries) {
        if (eventStore == null) {
            throw new IllegalArgumentException("EventStore cannot be null");
        }
        if (maxConflictRetries < 0) {
            throw new IllegalArgumentException("maxConflictRetries cannot be negative, was " + maxConflictRetries);
        }
        EventBus eventBus = SimpleEventBus.builder().build();
        var repository = new IssueRepository(
                new PublishingEventStore(eventStore, eventBus),
                new IssueStateMachine(createPolicy),
                clock
        );
        var commandHandler = new IssueCommandHandler(repository);

        CommandBus commandBus = SimpleCommandBus.builder().build();
        new AnnotationCommandHandlerAdapter<>(new IssueCommandHandlingComponent(commandHandler))
                .subscribe(commandBus);

        var gatewayBuilder = DefaultCommandGateway.builder().commandBus(commandBus);
        ScheduledExecutorService retryExecutor = null;
        if (maxConflictRetries > 0) {
            retryExecutor = Executors.newSingleThreadScheduledExecutor(new AxonThreadFactory("issue-command-retry"));
            gatewayBuilder.retryScheduler(IntervalRetryScheduler.builder()
                    .retryExecutor(retryExecutor)
                    .retryInterval(RETRY_INTERVAL_MILLIS)
                    .maxRetryCount(maxConflictRetries)
                    .nonTransientFailurePredicate(failure -> !(failure instanceof ConcurrencyConflictException))
                    .build());
        }
        CommandGateway commandGateway = gatewayBuilder.build();

        return new IssueConfiguration(eventStore, eventBus, repository, commandHandler, commandBus,
                commandGateway, retryExecutor);
    }

    /**
     * Stops the retry scheduler thread. Commands already waiting for a retry are abandoned.
     */
    public void shutdown() {
        if (retryExecutor != null) {
            retryExecutor.shutdownNow();
        }
    }

    public EventStore eventStore() {
        return eventStore;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public IssueRepository repository() {
        return repository;
    }

    public IssueCommandHandler commandHandler() {
        return commandHandler;
    }

    public CommandBus commandBus() {
        return commandBus;
    }

    public CommandGateway commandGateway() {
        return commandGateway;
    }
}
