package com.library.borrowing.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record SubmitBorrowRequest(

    @NotNull(message = "Book ID is required")
    Long bookId,

    @NotNull(message = "Start date is required")
    LocalDate startDate,

    @NotNull(message = "End date is required")
    LocalDate endDate
) {

    /**
     * Rejects inverted ranges. Equal dates are a one-day loan.
     */
    @JsonIgnore
    @AssertTrue(message = "End date must not be before start date")
    public boolean isDateRangeValid() {
        return startDate == null || endDate == null || !endDate.isBefore(startDate);
    }
}
