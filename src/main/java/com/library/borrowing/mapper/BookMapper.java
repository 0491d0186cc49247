package com.library.borrowing.mapper;

import com.library.borrowing.dto.response.BookResponse;
import com.library.borrowing.entity.Book;

public final class BookMapper {

    private BookMapper() {}

    public static BookResponse toResponse(Book book) {
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getAuthor(),
            book.getCopiesAvailable()
        );
    }
}
