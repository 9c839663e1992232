package com.genomecurator.core.report;

import com.genomecurator.core.exception.MalformedReportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DelimitedTable}.
 */
class DelimitedTableTest {

    @TempDir
    Path tempDir;

    @Test
    void readTsv_trimsCellsAndSkipsBlankLines() throws IOException {
        Path file = tempDir.resolve("table.tsv");
        Files.writeString(file, " id \t value\nA\t 1 \n\nB\t2\n");

        DelimitedTable table = DelimitedTable.readTsv(file);

        assertThat(table.header()).containsExactly("id", "value");
        assertThat(table.rows()).containsExactly(List.of("A", "1"), List.of("B", "2"));
        assertThat(table.source()).isEqualTo("table.tsv");
    }

    @Test
    void readTsv_quotesAreLiteral() throws IOException {
        Path file = tempDir.resolve("table.tsv");
        Files.writeString(file, "id\tname\nA\t\"quoted\"\n");

        assertThat(DelimitedTable.readTsv(file).rows().get(0)).containsExactly("A", "\"quoted\"");
    }

    @Test
    void read_csv_honoursQuotedCommas() throws IOException {
        Path file = tempDir.resolve("table.csv");
        Files.writeString(file, "id,members\nA,\"B,C\"\n");

        assertThat(DelimitedTable.read(file, ',').rows().get(0)).containsExactly("A", "B,C");
    }

    @Test
    void columnIndex_missingColumn_throwsMalformedReport() throws IOException {
        Path file = tempDir.resolve("table.tsv");
        Files.writeString(file, "id\tvalue\n");
        DelimitedTable table = DelimitedTable.readTsv(file);

        assertThat(table.optionalColumnIndex("other")).isEqualTo(-1);
        assertThatThrownBy(() -> table.columnIndex("other"))
            .isInstanceOf(MalformedReportException.class)
            .hasMessage("table.tsv: missing expected column 'other'");
    }

    @Test
    void cell_outOfRange_returnsEmptyString() {
        assertThat(DelimitedTable.cell(List.of("A"), 3)).isEmpty();
        assertThat(DelimitedTable.cell(List.of("A"), -1)).isEmpty();
    }
}
