package com.library.borrowing.service;

import com.library.borrowing.dto.response.BookResponse;
import com.library.borrowing.mapper.BookMapper;
import com.library.borrowing.repository.BookRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BookService {

    private final BookRepository bookRepository;

    @Transactional(readOnly = true)
    public List<BookResponse> findAll() {
        return bookRepository.findAllByOrderByIdAsc().stream()
            .map(BookMapper::toResponse)
            .toList();
    }
}
