package com.library.borrowing.exception;

import com.library.borrowing.entity.BorrowRequestStatus;

public class RequestAlreadyProcessedException extends RuntimeException {

    public RequestAlreadyProcessedException(Long requestId, BorrowRequestStatus currentStatus) {
        super("Request " + requestId + " already processed, current status is " + currentStatus.label());
    }
}
