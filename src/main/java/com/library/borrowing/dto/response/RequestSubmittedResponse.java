package com.library.borrowing.dto.response;

public record RequestSubmittedResponse(String message, Long requestId) {}
