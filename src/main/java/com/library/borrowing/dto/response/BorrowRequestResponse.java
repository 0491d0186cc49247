package com.library.borrowing.dto.response;

import com.library.borrowing.entity.BorrowRequestStatus;

import java.time.LocalDate;

public record BorrowRequestResponse(
    Long id,
    Long bookId,
    String bookTitle,
    LocalDate startDate,
    LocalDate endDate,
    BorrowRequestStatus status
) {}
