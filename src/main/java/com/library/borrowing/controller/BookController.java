package com.library.borrowing.controller;

import com.library.borrowing.dto.response.BookResponse;
import com.library.borrowing.service.BookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Book catalog")
public class BookController {

    private final BookService bookService;

    @GetMapping
    @Operation(summary = "List all books", description = "Returns every book in the catalog with its available copy count.")
    @ApiResponse(responseCode = "200", description = "Catalog returned")
    @ApiResponse(responseCode = "401", description = "Missing or invalid credentials")
    public ResponseEntity<List<BookResponse>> findAll() {
        return ResponseEntity.ok(bookService.findAll());
    }
}
