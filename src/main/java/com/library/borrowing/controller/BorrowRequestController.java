package com.library.borrowing.controller;

import com.library.borrowing.dto.request.SubmitBorrowRequest;
import com.library.borrowing.dto.response.HistoryCsvResponse;
import com.library.borrowing.dto.response.HistoryEntryResponse;
import com.library.borrowing.dto.response.RequestSubmittedResponse;
import com.library.borrowing.security.AuthenticatedUser;
import com.library.borrowing.service.BorrowRequestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Tag(name = "Borrowing", description = "Borrow requests and personal history")
public class BorrowRequestController {

    private final BorrowRequestService borrowRequestService;

    @PostMapping("/requests")
    @Operation(summary = "Submit a borrow request", description = "Creates a pending request for the given date range. "
        + "Rejected if the end date is before the start date, the book has no copies left, "
        + "or an approved request already covers part of the range. A single-day range (start equals end) is allowed.")
    @ApiResponse(responseCode = "201", description = "Request submitted")
    @ApiResponse(responseCode = "400", description = "Missing field, end date before start date, no copies available, "
        + "or overlapping approved loan")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<RequestSubmittedResponse> submit(
            @Parameter(hidden = true) @AuthenticationPrincipal AuthenticatedUser caller,
            @Valid @RequestBody SubmitBorrowRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(borrowRequestService.submit(caller, request));
    }

    @GetMapping("/history")
    @Operation(summary = "View own borrowing history")
    public ResponseEntity<List<HistoryEntryResponse>> history(
            @Parameter(hidden = true) @AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(borrowRequestService.findHistory(caller.id()));
    }

    @GetMapping("/download-history")
    @Operation(summary = "Download own borrowing history", description = "Returns the history as CSV text inside a JSON object.")
    public ResponseEntity<HistoryCsvResponse> downloadHistory(
            @Parameter(hidden = true) @AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(borrowRequestService.exportHistory(caller.id()));
    }
}
