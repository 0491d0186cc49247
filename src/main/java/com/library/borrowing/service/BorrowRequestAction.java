package com.library.borrowing.service;

import com.library.borrowing.exception.InvalidActionException;

import java.util.Arrays;

/**
 * Administrator decisions on a pending borrow request, as passed in the
 * {@code action} query parameter.
 */
public enum BorrowRequestAction {
    APPROVE("approve", "approved"),
    DENY("deny", "denied");

    private final String value;
    private final String pastTense;

    BorrowRequestAction(String value, String pastTense) {
        this.value = value;
        this.pastTense = pastTense;
    }

    public String pastTense() {
        return pastTense;
    }

    public static BorrowRequestAction fromValue(String value) {
        return Arrays.stream(values())
            .filter(action -> action.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new InvalidActionException(value));
    }
}
