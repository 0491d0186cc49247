package com.library.borrowing.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * A user's request to borrow a {@link Book} for the inclusive date range
 * {@code [startDate, endDate]}.
 *
 * <p>For a given book, the {@link BorrowRequestStatus#APPROVED APPROVED} requests must
 * have pairwise non-overlapping ranges. Two ranges overlap when
 * {@code a.startDate <= b.endDate AND a.endDate >= b.startDate}. The rule is checked by
 * {@code BorrowRequestService} on submission and again on approval; there is no
 * database constraint behind it.
 *
 * <p>Both associations are {@code LAZY}. Listing queries fetch the book explicitly
 * (see {@code BorrowRequestRepository}) because every response includes its title.
 *
 * <p>Requests are never deleted.
 */
@Entity
@Table(name = "borrow_requests")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class BorrowRequest extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false)
    private Book book;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BorrowRequestStatus status = BorrowRequestStatus.PENDING;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;
}
