package com.example.issuelifecycle.shared;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.UUID;

/**
 * Strongly-typed identifier for an Issue. Doubles as the identity of the issue's event stream.
 */
public record IssueId(UUID value) {

    public IssueId {
        if (value == null) {
            throw new IllegalArgumentException("IssueId cannot be null");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static IssueId of(UUID value) {
        return new IssueId(value);
    }

    public static IssueId newId() {
        return new IssueId(UUID.randomUUID());
    }

    public static IssueId fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("IssueId cannot be null or blank");
        }
        return new IssueId(UUID.fromString(value));
    }

    @JsonValue
    @Override
    public UUID value() {
        return value;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
