package com.library.borrowing.dto.response;

public record HistoryCsvResponse(String csv) {}
