package com.library.borrowing.service;

import com.library.borrowing.dto.request.SubmitBorrowRequest;
import com.library.borrowing.dto.response.BorrowRequestResponse;
import com.library.borrowing.dto.response.HistoryCsvResponse;
import com.library.borrowing.dto.response.HistoryEntryResponse;
import com.library.borrowing.dto.response.MessageResponse;
import com.library.borrowing.dto.response.RequestSubmittedResponse;
import com.library.borrowing.entity.Book;
import com.library.borrowing.entity.BorrowRequest;
import com.library.borrowing.entity.BorrowRequestStatus;
import com.library.borrowing.entity.User;
import com.library.borrowing.exception.BookAlreadyBorrowedException;
import com.library.borrowing.exception.NoCopiesAvailableException;
import com.library.borrowing.exception.RequestAlreadyProcessedException;
import com.library.borrowing.exception.ResourceNotFoundException;
import com.library.borrowing.mapper.BorrowRequestMapper;
import com.library.borrowing.repository.BookRepository;
import com.library.borrowing.repository.BorrowRequestRepository;
import com.library.borrowing.repository.UserRepository;
import com.library.borrowing.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BorrowRequestService {

    private static final Logger log = LoggerFactory.getLogger(BorrowRequestService.class);

    private final BookRepository bookRepository;
    private final BorrowRequestRepository borrowRequestRepository;
    private final UserRepository userRepository;
    private final HistoryCsvExporter historyCsvExporter;

    @Transactional
    public RequestSubmittedResponse submit(AuthenticatedUser caller, SubmitBorrowRequest request) {
        Book book = bookRepository.findById(request.bookId())
            .orElseThrow(() -> new ResourceNotFoundException("Book", request.bookId()));

        if (book.getCopiesAvailable() <= 0) {
            throw new NoCopiesAvailableException(book.getId());
        }

        if (borrowRequestRepository.existsOverlapping(book.getId(), BorrowRequestStatus.APPROVED,
                request.startDate(), request.endDate())) {
            throw new BookAlreadyBorrowedException(book.getId(), request.startDate(), request.endDate());
        }

        User user = userRepository.getReferenceById(caller.id());
        BorrowRequest saved = borrowRequestRepository.save(
            BorrowRequestMapper.toEntity(request, user, book));
        log.info("User {} requested book {} for {} to {} (request {})",
                 caller.email(), book.getId(), request.startDate(), request.endDate(), saved.getId());
        return new RequestSubmittedResponse("Request submitted successfully", saved.getId());
    }

    /**
     * Applies an administrator's decision. The request row is locked first and, for
     * approvals, the book row second, so that the overlap check, the status change and
     * the copy decrement commit together.
     *
     * <p>Denial does not look at the current status: a denied or approved request can
     * be denied again.
     */
    @Transactional
    public MessageResponse process(Long requestId, String actionValue) {
        BorrowRequest borrowRequest = borrowRequestRepository.findByIdForUpdate(requestId)
            .orElseThrow(() -> new ResourceNotFoundException("Borrow request", requestId));

        BorrowRequestAction action = BorrowRequestAction.fromValue(actionValue);
        switch (action) {
            case APPROVE -> approve(borrowRequest);
            case DENY -> deny(borrowRequest);
        }
        return new MessageResponse("Request " + action.pastTense() + " successfully");
    }

    @Transactional(readOnly = true)
    public List<BorrowRequestResponse> findAll() {
        return borrowRequestRepository.findAllWithBook().stream()
            .map(BorrowRequestMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<HistoryEntryResponse> findHistory(Long userId) {
        return borrowRequestRepository.findAllByUserIdWithBook(userId).stream()
            .map(BorrowRequestMapper::toHistoryEntry)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<HistoryEntryResponse> findHistoryOfExistingUser(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User", userId);
        }
        return findHistory(userId);
    }

    @Transactional(readOnly = true)
    public HistoryCsvResponse exportHistory(Long userId) {
        return new HistoryCsvResponse(historyCsvExporter.export(findHistory(userId)));
    }

    private void approve(BorrowRequest borrowRequest) {
        if (borrowRequest.getStatus() != BorrowRequestStatus.PENDING) {
            throw new RequestAlreadyProcessedException(borrowRequest.getId(), borrowRequest.getStatus());
        }

        Long bookId = borrowRequest.getBook().getId();
        Book book = bookRepository.findByIdForUpdate(bookId)
            .orElseThrow(() -> new ResourceNotFoundException("Book", bookId));

        if (borrowRequestRepository.existsOverlappingExcluding(bookId, BorrowRequestStatus.APPROVED,
                borrowRequest.getStartDate(), borrowRequest.getEndDate(), borrowRequest.getId())) {
            log.warn("Approval of request {} rejected: book {} already borrowed between {} and {}",
                     borrowRequest.getId(), bookId, borrowRequest.getStartDate(), borrowRequest.getEndDate());
            throw new BookAlreadyBorrowedException(bookId, borrowRequest.getStartDate(), borrowRequest.getEndDate());
        }

        borrowRequest.setStatus(BorrowRequestStatus.APPROVED);
        book.decrementCopies();
        log.info("Approved request {}; book {} now has {} copies available",
                 borrowRequest.getId(), bookId, book.getCopiesAvailable());
    }

    private void deny(BorrowRequest borrowRequest) {
        log.info("Denied request {} (was {})", borrowRequest.getId(), borrowRequest.getStatus());
        borrowRequest.setStatus(BorrowRequestStatus.DENIED);
    }
}
