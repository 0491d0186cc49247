package com.library.borrowing.dto.response;

public record BookResponse(
    Long id,
    String title,
    String author,
    int copiesAvailable
) {}
