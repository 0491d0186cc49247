package com.library.borrowing.mapper;

import com.library.borrowing.dto.request.SubmitBorrowRequest;
import com.library.borrowing.dto.response.BorrowRequestResponse;
import com.library.borrowing.dto.response.HistoryEntryResponse;
import com.library.borrowing.entity.Book;
import com.library.borrowing.entity.BorrowRequest;
import com.library.borrowing.entity.BorrowRequestStatus;
import com.library.borrowing.entity.User;

public final class BorrowRequestMapper {

    private BorrowRequestMapper() {}

    public static BorrowRequest toEntity(SubmitBorrowRequest request, User user, Book book) {
        BorrowRequest borrowRequest = new BorrowRequest();
        borrowRequest.setUser(user);
        borrowRequest.setBook(book);
        borrowRequest.setStartDate(request.startDate());
        borrowRequest.setEndDate(request.endDate());
        borrowRequest.setStatus(BorrowRequestStatus.PENDING);
        return borrowRequest;
    }

    public static BorrowRequestResponse toResponse(BorrowRequest borrowRequest) {
        return new BorrowRequestResponse(
            borrowRequest.getId(),
            borrowRequest.getBook().getId(),
            borrowRequest.getBook().getTitle(),
            borrowRequest.getStartDate(),
            borrowRequest.getEndDate(),
            borrowRequest.getStatus()
        );
    }

    public static HistoryEntryResponse toHistoryEntry(BorrowRequest borrowRequest) {
        return new HistoryEntryResponse(
            borrowRequest.getBook().getTitle(),
            borrowRequest.getStartDate(),
            borrowRequest.getEndDate(),
            borrowRequest.getStatus()
        );
    }
}
