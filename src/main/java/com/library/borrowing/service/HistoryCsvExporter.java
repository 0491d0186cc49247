package com.library.borrowing.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.library.borrowing.dto.response.HistoryEntryResponse;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Renders a borrowing history as CSV text with a header row and CRLF line endings.
 * Fields are quoted only when they contain a separator or quote. A row with a line
 * break in any field is written with every field quoted.
 */
@Component
public class HistoryCsvExporter {

    static final String LINE_SEPARATOR = "\r\n";

    private final CsvSchema schema;
    private final ObjectWriter minimalWriter;
    private final ObjectWriter quotingWriter;

    public HistoryCsvExporter() {
        CsvMapper csvMapper = new CsvMapper();
        this.schema = csvMapper.schemaFor(Row.class)
            .withoutHeader()
            .withLineSeparator(LINE_SEPARATOR);
        // The strict check only looks at the configured separator, so a bare LF would pass unquoted.
        this.minimalWriter = csvMapper.writer(schema)
            .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
        this.quotingWriter = csvMapper.writer(schema)
            .with(CsvGenerator.Feature.ALWAYS_QUOTE_STRINGS);
    }

    public String export(List<HistoryEntryResponse> entries) {
        StringBuilder csv = new StringBuilder(headerLine());
        for (HistoryEntryResponse entry : entries) {
            Row row = new Row(
                entry.bookTitle(),
                entry.startDate().toString(),
                entry.endDate().toString(),
                entry.status().label());
            csv.append(writeRow(row));
        }
        return csv.toString();
    }

    private String writeRow(Row row) {
        ObjectWriter writer = row.hasLineBreak() ? quotingWriter : minimalWriter;
        try {
            return writer.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render borrowing history as CSV", e);
        }
    }

    private String headerLine() {
        return StreamSupport.stream(schema.spliterator(), false)
            .map(CsvSchema.Column::getName)
            .collect(Collectors.joining(",", "", LINE_SEPARATOR));
    }

    @JsonPropertyOrder({"Book Title", "Start Date", "End Date", "Status"})
    record Row(
        @JsonProperty("Book Title") String bookTitle,
        @JsonProperty("Start Date") String startDate,
        @JsonProperty("End Date") String endDate,
        @JsonProperty("Status") String status
    ) {

        boolean hasLineBreak() {
            return Stream.of(bookTitle, startDate, endDate, status)
                .anyMatch(value -> value != null && (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0));
        }
    }
}
