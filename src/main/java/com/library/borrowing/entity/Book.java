package com.library.borrowing.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A catalog entry.
 *
 * <p>Books are seeded by migration V4 and are read-only from the API's point of view,
 * with one exception: {@link #copiesAvailable} is decremented each time a borrow
 * request for the book is approved. It is never incremented (there is no return
 * flow) and no floor is enforced, so the value can become negative.
 *
 * <p>Approval takes a {@code PESSIMISTIC_WRITE} lock on the book row before
 * re-checking overlaps and decrementing the counter (see
 * {@code BookRepository.findByIdForUpdate}). {@link #version} additionally guards
 * against lost updates from any path that modifies the row without that lock.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "id", callSuper = false)
public class Book extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "author", nullable = false, length = 255)
    private String author;

    @Column(name = "copies_available", nullable = false)
    private int copiesAvailable = 1;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public Book(String title, String author, int copiesAvailable) {
        this.title = title;
        this.author = author;
        this.copiesAvailable = copiesAvailable;
    }

    public void decrementCopies() {
        copiesAvailable--;
    }
}
