package com.genomecurator.core.report;

import com.genomecurator.core.exception.MalformedReportException;
import com.genomecurator.core.exception.MissingFieldException;
import com.genomecurator.core.model.MetadataRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MetadataTableReader}.
 */
class MetadataTableReaderTest {

    private static final String TAXONOMY =
        "d__Bacteria;p__Proteobacteria;c__Gammaproteobacteria;o__Enterobacterales;"
            + "f__Enterobacteriaceae;g__Escherichia;s__Escherichia coli";

    @TempDir
    Path tempDir;

    static String header() {
        List<String> columns = new ArrayList<>();
        columns.add("accession");
        columns.addAll(MetadataTableReader.REQUIRED_COLUMNS);
        columns.add("gtdb_type_designation");
        columns.add("mimag_high_quality");
        columns.add("gtdb_representative");
        columns.add("gtdb_clustered_genomes");
        return String.join("\t", columns);
    }

    static String row(String genomeId, String completeness, String representative, String clustered) {
        return String.join("\t",
            genomeId, TAXONOMY, completeness, "1.5", "50", "4641652", "3", "4641652", "3", "0", "0",
            "7", "1542", "Complete Genome", "full", "reference genome", "assembly from type material",
            "3", "0", "0", "none", "type strain of species", "t", representative, clustered);
    }

    @Test
    void read_tsv_parsesTypedFields() throws IOException {
        Path metadataFile = tempDir.resolve("gtdb_metadata.tsv");
        Files.writeString(metadataFile, header() + "\n"
            + row("RS_GCF_000005845.2", "99.9", "t", "RS_GCF_2,GB_GCA_3") + "\n");

        Map<String, MetadataRecord> metadata = MetadataTableReader.read(metadataFile, true);

        MetadataRecord record = metadata.get("RS_GCF_000005845.2");
        assertThat(record.gtdbTaxonomy().species()).isEqualTo("s__Escherichia coli");
        assertThat(record.checkmCompleteness()).isEqualTo(99.9);
        assertThat(record.checkmStrainHeterogeneity100()).isEqualTo(50.0);
        assertThat(record.genomeSize()).isEqualTo(4_641_652L);
        assertThat(record.contigCount()).isEqualTo(3);
        assertThat(record.ssuLength()).isEqualTo(1542);
        assertThat(record.ncbiAssemblyLevel()).isEqualTo("Complete Genome");
        assertThat(record.ncbiMoleculeCount()).isEqualTo(3);
        assertThat(record.ncbiGenomeCategory()).isNull();
        assertThat(record.mimagHighQuality()).isTrue();
        assertThat(record.gtdbRepresentative()).isTrue();
        assertThat(record.gtdbClusteredGenomes()).containsExactly("RS_GCF_2", "GB_GCA_3");
    }

    @Test
    void read_stripPrefix_removesPrefixesFromIdsAndClusteredGenomes() throws IOException {
        Path metadataFile = tempDir.resolve("gtdb_metadata.tsv");
        Files.writeString(metadataFile, header() + "\n"
            + row("RS_GCF_1", "99.9", "f", "RS_GCF_2") + "\n");

        Map<String, MetadataRecord> metadata = MetadataTableReader.read(metadataFile, false);

        assertThat(metadata).containsOnlyKeys("GCF_1");
        assertThat(metadata.get("GCF_1").genomeId()).isEqualTo("GCF_1");
        assertThat(metadata.get("GCF_1").gtdbRepresentative()).isFalse();
        assertThat(metadata.get("GCF_1").gtdbClusteredGenomes()).containsExactly("GCF_2");
    }

    @Test
    void read_csv_usesCommaSeparator() throws IOException {
        Path metadataFile = tempDir.resolve("gtdb_metadata.csv");
        String tsv = header() + "\n" + row("GB_GCA_1", "80", "f", "") + "\n";
        Files.writeString(metadataFile, tsv.replace('\t', ','));

        Map<String, MetadataRecord> metadata = MetadataTableReader.read(metadataFile, true);

        assertThat(metadata.get("GB_GCA_1").checkmCompleteness()).isEqualTo(80.0);
        assertThat(metadata.get("GB_GCA_1").gtdbClusteredGenomes()).isEmpty();
    }

    @Test
    void read_blankRequiredValue_throwsMissingField() throws IOException {
        Path metadataFile = tempDir.resolve("gtdb_metadata.tsv");
        Files.writeString(metadataFile, header() + "\n" + row("RS_GCF_1", "", "f", "") + "\n");

        assertThatThrownBy(() -> MetadataTableReader.read(metadataFile, true))
            .isInstanceOfSatisfying(MissingFieldException.class, e -> {
                assertThat(e.getGenomeId()).isEqualTo("RS_GCF_1");
                assertThat(e.getFieldName()).isEqualTo("checkm_completeness");
            });
    }

    @Test
    void read_fractionalContigCount_throwsMalformedReport() throws IOException {
        Path metadataFile = tempDir.resolve("gtdb_metadata.tsv");
        String row = row("RS_GCF_1", "90", "f", "").replace("\t4641652\t3\t", "\t4641652\t3.5\t");
        Files.writeString(metadataFile, header() + "\n" + row + "\n");

        assertThatThrownBy(() -> MetadataTableReader.read(metadataFile, true))
            .isInstanceOf(MalformedReportException.class)
            .hasMessageContaining("contig_count");
    }

    @Test
    void read_missingRequiredColumn_throwsMalformedReport() throws IOException {
        Path metadataFile = tempDir.resolve("gtdb_metadata.tsv");
        Files.writeString(metadataFile, "accession\tgtdb_taxonomy\nRS_GCF_1\t" + TAXONOMY + "\n");

        assertThatThrownBy(() -> MetadataTableReader.read(metadataFile, true))
            .isInstanceOf(MalformedReportException.class)
            .hasMessageContaining("checkm_completeness");
    }
}
