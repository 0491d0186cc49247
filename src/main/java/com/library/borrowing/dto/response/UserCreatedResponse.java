package com.library.borrowing.dto.response;

public record UserCreatedResponse(String message, Long userId) {}
