package com.library.borrowing.dto.response;

import com.library.borrowing.entity.BorrowRequestStatus;

import java.time.LocalDate;

public record HistoryEntryResponse(
    String bookTitle,
    LocalDate startDate,
    LocalDate endDate,
    BorrowRequestStatus status
) {}
