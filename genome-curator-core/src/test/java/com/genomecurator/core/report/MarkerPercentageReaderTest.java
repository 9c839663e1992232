package com.genomecurator.core.report;

import com.genomecurator.core.exception.MalformedReportException;
import com.genomecurator.core.model.MarkerPercentage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MarkerPercentageReader}.
 */
class MarkerPercentageReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void read_validReport_returnsPercentagesInFileOrder() throws IOException {
        Path report = tempDir.resolve("gtdb_domain_report.tsv");
        Files.writeString(report, """
            Genome ID\tPredicted domain\tBacterial Marker Percentage\tArchaeal Marker Percentage\tNote
            RS_GCF_1\td__Bacteria\t97.5\t10.0\tok
            RS_GCF_2\td__Archaea\t5.0\t88.2\tok
            """);

        Map<String, MarkerPercentage> percentages = MarkerPercentageReader.read(report);

        assertThat(percentages.keySet()).containsExactly("RS_GCF_1", "RS_GCF_2");
        assertThat(percentages.get("RS_GCF_1").percentage()).isEqualTo(97.5);
        assertThat(percentages.get("RS_GCF_2").percentage()).isEqualTo(88.2);
    }

    @Test
    void read_stripPrefixes_returnsBareAccessions() throws IOException {
        Path report = tempDir.resolve("gtdb_domain_report.tsv");
        Files.writeString(report, """
            Genome ID\tPredicted domain\tBacterial Marker Percentage\tArchaeal Marker Percentage
            GB_GCA_1\td__Bacteria\t97.5\t10.0
            """);

        assertThat(MarkerPercentageReader.read(report, false)).containsOnlyKeys("GCA_1");
    }

    @Test
    void read_missingArchaealColumn_throwsMalformedReport() throws IOException {
        Path report = tempDir.resolve("gtdb_domain_report.tsv");
        Files.writeString(report, """
            Genome ID\tPredicted domain\tBacterial Marker Percentage
            RS_GCF_1\td__Bacteria\t97.5
            """);

        assertThatThrownBy(() -> MarkerPercentageReader.read(report))
            .isInstanceOfSatisfying(MalformedReportException.class, e -> {
                assertThat(e.getSource()).isEqualTo("gtdb_domain_report.tsv");
                assertThat(e.getMessage()).contains("Archaeal Marker Percentage");
            });
    }

    @Test
    void read_nonNumericPercentage_throwsMalformedReport() throws IOException {
        Path report = tempDir.resolve("gtdb_domain_report.tsv");
        Files.writeString(report, """
            Genome ID\tPredicted domain\tBacterial Marker Percentage\tArchaeal Marker Percentage
            RS_GCF_1\td__Bacteria\thigh\t10.0
            """);

        assertThatThrownBy(() -> MarkerPercentageReader.read(report))
            .isInstanceOf(MalformedReportException.class)
            .hasMessageContaining("RS_GCF_1");
    }
}
