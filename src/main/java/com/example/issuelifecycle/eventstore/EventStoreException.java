package com.example.issuelifecycle.eventstore;

/**
 * A storage failure of an event store (I/O, SQL, serialization). Not recoverable by the core.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
