package com.fintech.lightning.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an outgoing payment as reported to wallet consumers.
 * <p>
 * Transitions only move toward a terminal state:
 * PENDING may become FAILED or COMPLETE; NEVER_TRIED, FAILED and COMPLETE never change again.
 */
public enum Status {
    /**
     * The backend reported a native status this layer does not recognize.
     */
    UNKNOWN("unknown"),

    /**
     * The backend gave up before making a single attempt (e.g. no route found).
     */
    NEVER_TRIED("never-tried"),

    /**
     * An attempt is in flight.
     */
    PENDING("pending"),

    /**
     * At least one attempt was made and none succeeded.
     */
    FAILED("failed"),

    /**
     * Settled. The only state carrying a fee and a preimage.
     */
    COMPLETE("complete");

    private final String value;

    Status(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == NEVER_TRIED || this == FAILED || this == COMPLETE;
    }

    @JsonCreator
    public static Status fromValue(String value) {
        for (Status status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return value;
    }
}
