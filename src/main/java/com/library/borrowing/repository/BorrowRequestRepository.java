package com.library.borrowing.repository;

import com.library.borrowing.entity.BorrowRequest;
import com.library.borrowing.entity.BorrowRequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface BorrowRequestRepository extends JpaRepository<BorrowRequest, Long> {

    @Query("""
        SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END
        FROM BorrowRequest r
        WHERE r.book.id = :bookId
          AND r.status = :status
          AND r.startDate <= :endDate
          AND r.endDate >= :startDate
        """)
    boolean existsOverlapping(@Param("bookId") Long bookId,
                              @Param("status") BorrowRequestStatus status,
                              @Param("startDate") LocalDate startDate,
                              @Param("endDate") LocalDate endDate);

    @Query("""
        SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END
        FROM BorrowRequest r
        WHERE r.book.id = :bookId
          AND r.status = :status
          AND r.startDate <= :endDate
          AND r.endDate >= :startDate
          AND r.id <> :excludedId
        """)
    boolean existsOverlappingExcluding(@Param("bookId") Long bookId,
                                       @Param("status") BorrowRequestStatus status,
                                       @Param("startDate") LocalDate startDate,
                                       @Param("endDate") LocalDate endDate,
                                       @Param("excludedId") Long excludedId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT r FROM BorrowRequest r WHERE r.id = :id")
    Optional<BorrowRequest> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT r FROM BorrowRequest r JOIN FETCH r.book ORDER BY r.id")
    List<BorrowRequest> findAllWithBook();

    @Query("SELECT r FROM BorrowRequest r JOIN FETCH r.book WHERE r.user.id = :userId ORDER BY r.id")
    List<BorrowRequest> findAllByUserIdWithBook(@Param("userId") Long userId);
}
