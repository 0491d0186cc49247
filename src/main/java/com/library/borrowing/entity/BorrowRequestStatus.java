package com.library.borrowing.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states of a {@link BorrowRequest}.
 *
 * <p>Persisted by name ({@code EnumType.STRING}); rendered in JSON and CSV output by
 * {@link #label()}. {@link #APPROVED} and {@link #DENIED} are reached only from
 * {@link #PENDING}, through an administrator's decision.
 */
public enum BorrowRequestStatus {
    PENDING("Pending"),
    APPROVED("Approved"),
    DENIED("Denied");

    private final String label;

    BorrowRequestStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
