package com.library.borrowing.exception;

import java.time.LocalDate;

public class BookAlreadyBorrowedException extends RuntimeException {

    public BookAlreadyBorrowedException(Long bookId, LocalDate startDate, LocalDate endDate) {
        super("Book " + bookId + " already borrowed during this period (" + startDate + " to " + endDate + ")");
    }
}
