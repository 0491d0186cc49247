package com.library.borrowing.exception;

public class InvalidActionException extends RuntimeException {

    public InvalidActionException(String action) {
        super("Invalid action '" + action + "', expected 'approve' or 'deny'");
    }
}
