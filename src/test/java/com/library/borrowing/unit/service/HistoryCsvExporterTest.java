package com.library.borrowing.unit.service;

import com.library.borrowing.dto.response.HistoryEntryResponse;
import com.library.borrowing.entity.BorrowRequestStatus;
import com.library.borrowing.service.HistoryCsvExporter;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryCsvExporterTest {

    private final HistoryCsvExporter exporter = new HistoryCsvExporter();

    @Test
    void export_emptyHistory_writesHeaderOnly() {
        assertThat(exporter.export(List.of())).isEqualTo("Book Title,Start Date,End Date,Status\r\n");
    }

    @Test
    void export_writesOneRowPerEntryInOrder() {
        List<HistoryEntryResponse> entries = List.of(
            new HistoryEntryResponse("Clean Code",
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 10), BorrowRequestStatus.APPROVED),
            new HistoryEntryResponse("Refactoring",
                LocalDate.of(2024, 2, 3), LocalDate.of(2024, 2, 4), BorrowRequestStatus.PENDING));

        String csv = exporter.export(entries);

        assertThat(csv.split("\r\n")).containsExactly(
            "Book Title,Start Date,End Date,Status",
            "Clean Code,2024-01-01,2024-01-10,Approved",
            "Refactoring,2024-02-03,2024-02-04,Pending");
    }

    @Test
    void export_quotesTitlesContainingSeparator() {
        List<HistoryEntryResponse> entries = List.of(
            new HistoryEntryResponse("Dune, Messiah",
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2), BorrowRequestStatus.DENIED));

        String csv = exporter.export(entries);

        assertThat(csv).contains("\"Dune, Messiah\",2024-03-01,2024-03-02,Denied\r\n");
    }

    @Test
    void export_quotesRowsContainingLineBreak() {
        List<HistoryEntryResponse> entries = List.of(
            new HistoryEntryResponse("a\nb",
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2), BorrowRequestStatus.DENIED),
            new HistoryEntryResponse("Clean Code",
                LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 4), BorrowRequestStatus.PENDING));

        String csv = exporter.export(entries);

        assertThat(csv).isEqualTo("Book Title,Start Date,End Date,Status\r\n"
            + "\"a\nb\",\"2024-01-01\",\"2024-01-02\",\"Denied\"\r\n"
            + "Clean Code,2024-01-03,2024-01-04,Pending\r\n");
    }

    @Test
    void export_doublesEmbeddedQuotes() {
        List<HistoryEntryResponse> entries = List.of(
            new HistoryEntryResponse("He said \"hi\"",
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2), BorrowRequestStatus.APPROVED));

        assertThat(exporter.export(entries)).endsWith("\"He said \"\"hi\"\"\",2024-01-01,2024-01-02,Approved\r\n");
    }
}
