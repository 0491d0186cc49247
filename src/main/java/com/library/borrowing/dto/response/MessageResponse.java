package com.library.borrowing.dto.response;

public record MessageResponse(String message) {}
