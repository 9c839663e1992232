package com.genomecurator.core.report;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.genomecurator.core.exception.MalformedReportException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A delimited file held in memory as a header row plus data rows.
 *
 * <p>Columns are always resolved by header name through {@link #columnIndex}, never by
 * position, so readers tolerate reordered columns. Cells are trimmed. Parsing uses
 * Jackson's CSV data format in untyped array mode; tab-separated files are read
 * without a quote character.
 *
 * @param source file name used in error messages
 * @param header trimmed header cells
 * @param rows trimmed data rows; a row may be shorter than the header
 */
public record DelimitedTable(
    String source,
    List<String> header,
    List<List<String>> rows
) {
    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .build();

    /**
     * Compact constructor with validation.
     */
    public DelimitedTable {
        Objects.requireNonNull(source, "source must not be null");
        header = List.copyOf(header);
        rows = rows.stream().map(List::copyOf).toList();
    }

    /**
     * Reads a tab-separated file.
     *
     * @param path file to read
     * @return parsed table
     * @throws IOException if the file cannot be read
     * @throws MalformedReportException if the file has no header row
     */
    public static DelimitedTable readTsv(Path path) throws IOException {
        return read(path, '\t');
    }

    /**
     * Reads a delimited file.
     *
     * @param path file to read
     * @param separator column separator
     * @return parsed table
     * @throws IOException if the file cannot be read
     * @throws MalformedReportException if the file has no header row
     */
    public static DelimitedTable read(Path path, char separator) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);
        if (separator == '\t') {
            schema = schema.withoutQuoteChar();
        }

        List<String[]> lines;
        try (MappingIterator<String[]> iterator = CSV_MAPPER.readerFor(String[].class).with(schema).readValues(path.toFile())) {
            lines = iterator.readAll();
        }

        String source = path.getFileName().toString();
        if (lines.isEmpty()) {
            throw new MalformedReportException(source, "file is empty, expected a header row");
        }

        List<List<String>> rows = new ArrayList<>(lines.size() - 1);
        for (String[] line : lines.subList(1, lines.size())) {
            rows.add(trim(line));
        }
        return new DelimitedTable(source, trim(lines.get(0)), rows);
    }

    /**
     * Index of a header column.
     *
     * @param column column name
     * @return zero-based index
     * @throws MalformedReportException if the header lacks the column
     */
    public int columnIndex(String column) {
        int index = header.indexOf(column);
        if (index < 0) {
            throw MalformedReportException.missingColumn(source, column);
        }
        return index;
    }

    /**
     * Index of a header column that may be absent.
     *
     * @param column column name
     * @return zero-based index, or -1 if absent
     */
    public int optionalColumnIndex(String column) {
        return header.indexOf(column);
    }

    /**
     * Cell of a row, or an empty string if the row is shorter than the index.
     *
     * @param row data row
     * @param index column index; -1 yields an empty string
     * @return cell value
     */
    public static String cell(List<String> row, int index) {
        return index >= 0 && index < row.size() ? row.get(index) : "";
    }

    private static List<String> trim(String[] cells) {
        return Arrays.stream(cells).map(String::trim).toList();
    }
}
